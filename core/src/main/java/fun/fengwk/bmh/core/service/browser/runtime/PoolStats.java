package fun.fengwk.bmh.core.service.browser.runtime;

import lombok.Builder;
import lombok.Data;

/**
 * Point-in-time pool counters.
 *
 * @author fengwk
 */
@Data
@Builder
public class PoolStats {

    private int poolSize;
    private int busyCount;
    private int idleCount;
    private int aliveCount;
    private long totalCreated;
    private long totalReused;
    private long totalRequests;

    /**
     * Reused leases over all lease requests, in percent.
     */
    private double reuseRate;

}
