package fun.fengwk.bmh.core.service.metrics;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle of a started operation, {@link #finish(boolean, String)} records it once.
 *
 * @author fengwk
 */
public class OperationTimer {

    private final PerformanceMonitor monitor;
    private final String operation;
    private final Map<String, String> tags;
    private final Instant startedAt;
    private final long startNanos;
    private final AtomicBoolean finished = new AtomicBoolean(false);

    OperationTimer(PerformanceMonitor monitor, String operation, Map<String, String> tags) {
        this.monitor = monitor;
        this.operation = operation;
        this.tags = tags == null ? Map.of() : Map.copyOf(tags);
        this.startedAt = Instant.now();
        this.startNanos = System.nanoTime();
    }

    public String getOperation() {
        return operation;
    }

    public boolean isFinished() {
        return finished.get();
    }

    public void finish(boolean success, String error) {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        double durationSeconds = (System.nanoTime() - startNanos) / 1_000_000_000D;
        monitor.record(OperationMetric.builder()
            .operation(operation)
            .startedAt(startedAt)
            .durationSeconds(durationSeconds)
            .success(success)
            .error(error)
            .tags(tags)
            .build());
    }

}
