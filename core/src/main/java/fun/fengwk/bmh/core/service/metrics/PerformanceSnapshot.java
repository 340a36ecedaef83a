package fun.fengwk.bmh.core.service.metrics;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Render model of the performance report.
 *
 * @author fengwk
 */
@Data
@Builder
public class PerformanceSnapshot {

    private long uptimeSeconds;
    private long totalOperations;
    private long heapUsedMb;
    private long heapMaxMb;
    private int availableProcessors;
    private int liveThreads;
    private List<OperationStats> operations;
    private List<OperationMetric> recentFailures;

}
