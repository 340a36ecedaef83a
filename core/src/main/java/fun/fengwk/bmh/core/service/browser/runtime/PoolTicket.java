package fun.fengwk.bmh.core.service.browser.runtime;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive lease on one pooled worker, released exactly once.
 *
 * @author fengwk
 */
public final class PoolTicket {

    private final long slotId;
    private final String workerId;
    private final String endpoint;
    private final AtomicBoolean released = new AtomicBoolean(false);

    PoolTicket(long slotId, String workerId, String endpoint) {
        this.slotId = slotId;
        this.workerId = workerId;
        this.endpoint = endpoint;
    }

    public long getSlotId() {
        return slotId;
    }

    public String getWorkerId() {
        return workerId;
    }

    /**
     * Control endpoint of the leased worker, e.g. {@code http://127.0.0.1:9222}.
     */
    public String getEndpoint() {
        return endpoint;
    }

    public boolean isReleased() {
        return released.get();
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "PoolTicket(slotId=" + slotId + ", workerId=" + workerId + ", endpoint=" + endpoint + ")";
    }

}
