package fun.fengwk.bmh.core.service.metrics;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory operation timings.
 *
 * <p>Keeps the last {@value #MAX_HISTORY} operations and per-operation aggregates. Slow or failed
 * operations are logged when they finish.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class PerformanceMonitor {

    static final int MAX_HISTORY = 1000;

    static final double SLOW_OPERATION_SECONDS = 10D;

    private static final int RECENT_FAILURES_IN_REPORT = 10;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<OperationMetric> history = new ArrayDeque<>();
    private final Map<String, OperationStats> stats = new TreeMap<>();
    private final Instant startedAt = Instant.now();
    private long totalOperations;

    public OperationTimer startOperation(String operation, Map<String, String> tags) {
        return new OperationTimer(this, operation, tags);
    }

    void record(OperationMetric metric) {
        lock.lock();
        try {
            history.addLast(metric);
            while (history.size() > MAX_HISTORY) {
                history.removeFirst();
            }
            stats.computeIfAbsent(metric.getOperation(), OperationStats::new).record(metric);
            totalOperations++;
        } finally {
            lock.unlock();
        }

        if (metric.getDurationSeconds() > SLOW_OPERATION_SECONDS) {
            log.warn("slow operation, operation={}, seconds={}, tags={}",
                metric.getOperation(), String.format("%.2f", metric.getDurationSeconds()), metric.getTags());
        }
        if (!metric.isSuccess()) {
            log.warn("operation failed, operation={}, error={}, tags={}", metric.getOperation(), metric.getError(), metric.getTags());
        }
    }

    public Optional<OperationStats> getStats(String operation) {
        lock.lock();
        try {
            OperationStats operationStats = stats.get(operation);
            return operationStats == null ? Optional.empty() : Optional.of(operationStats.copy());
        } finally {
            lock.unlock();
        }
    }

    public Map<String, OperationStats> getAllStats() {
        lock.lock();
        try {
            Map<String, OperationStats> copy = new LinkedHashMap<>();
            stats.forEach((name, value) -> copy.put(name, value.copy()));
            return copy;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Most recent operations first.
     *
     * @param operation optional name filter, {@code null} for all
     */
    public List<OperationMetric> recentMetrics(int count, String operation) {
        List<OperationMetric> result = new ArrayList<>();
        lock.lock();
        try {
            Iterator<OperationMetric> iterator = history.descendingIterator();
            while (iterator.hasNext() && result.size() < count) {
                OperationMetric metric = iterator.next();
                if (operation == null || operation.equals(metric.getOperation())) {
                    result.add(metric);
                }
            }
        } finally {
            lock.unlock();
        }
        return result;
    }

    public long getTotalOperations() {
        lock.lock();
        try {
            return totalOperations;
        } finally {
            lock.unlock();
        }
    }

    public PerformanceSnapshot snapshot() {
        List<OperationMetric> recentFailures = new ArrayList<>();
        for (OperationMetric metric : recentMetrics(MAX_HISTORY, null)) {
            if (!metric.isSuccess()) {
                recentFailures.add(metric);
                if (recentFailures.size() >= RECENT_FAILURES_IN_REPORT) {
                    break;
                }
            }
        }
        Runtime runtime = Runtime.getRuntime();
        return PerformanceSnapshot.builder()
            .uptimeSeconds(Duration.between(startedAt, Instant.now()).getSeconds())
            .totalOperations(getTotalOperations())
            .heapUsedMb((runtime.totalMemory() - runtime.freeMemory()) / (1024 * 1024))
            .heapMaxMb(runtime.maxMemory() / (1024 * 1024))
            .availableProcessors(runtime.availableProcessors())
            .liveThreads(ManagementFactory.getThreadMXBean().getThreadCount())
            .operations(new ArrayList<>(getAllStats().values()))
            .recentFailures(recentFailures)
            .build();
    }

    public void reset() {
        lock.lock();
        try {
            history.clear();
            stats.clear();
            totalOperations = 0;
        } finally {
            lock.unlock();
        }
    }

}
