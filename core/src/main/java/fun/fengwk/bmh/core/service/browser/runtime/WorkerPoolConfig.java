package fun.fengwk.bmh.core.service.browser.runtime;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for a worker process pool.
 *
 * @author fengwk
 */
@Data
@Builder
public class WorkerPoolConfig {

    /**
     * Workers pre-created at startup.
     */
    @Builder.Default
    private int minWorkers = 4;

    /**
     * Maximum live worker count.
     */
    @Builder.Default
    private int maxWorkers = 9;

    /**
     * Timeout when waiting for a new worker's control port.
     */
    @Builder.Default
    private long portReadyTimeoutMs = 8000;

    /**
     * Poll interval while waiting for the control port.
     */
    @Builder.Default
    private long portPollIntervalMs = 120;

    /**
     * Connect timeout of the liveness probe.
     */
    @Builder.Default
    private int probeTimeoutMs = 300;

}
