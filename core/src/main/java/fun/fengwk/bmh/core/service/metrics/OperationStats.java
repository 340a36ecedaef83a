package fun.fengwk.bmh.core.service.metrics;

import lombok.Data;

/**
 * Aggregated counters of one operation name.
 *
 * @author fengwk
 */
@Data
public class OperationStats {

    private final String operation;
    private long count;
    private long successCount;
    private long failCount;
    private double minSeconds = Double.MAX_VALUE;
    private double maxSeconds;
    private double totalSeconds;

    void record(OperationMetric metric) {
        count++;
        if (metric.isSuccess()) {
            successCount++;
        } else {
            failCount++;
        }
        minSeconds = Math.min(minSeconds, metric.getDurationSeconds());
        maxSeconds = Math.max(maxSeconds, metric.getDurationSeconds());
        totalSeconds += metric.getDurationSeconds();
    }

    public double getAvgSeconds() {
        return count == 0 ? 0D : totalSeconds / count;
    }

    public double getSuccessRate() {
        return count == 0 ? 0D : (double) successCount / count * 100D;
    }

    OperationStats copy() {
        OperationStats copy = new OperationStats(operation);
        copy.count = count;
        copy.successCount = successCount;
        copy.failCount = failCount;
        copy.minSeconds = minSeconds;
        copy.maxSeconds = maxSeconds;
        copy.totalSeconds = totalSeconds;
        return copy;
    }

}
