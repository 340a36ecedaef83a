package fun.fengwk.bmh.core.service.metrics;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * PerformanceMonitor tests.
 *
 * @author fengwk
 */
class PerformanceMonitorTest {

    private final PerformanceMonitor monitor = new PerformanceMonitor();

    @Test
    void shouldAggregateStatsPerOperation() {
        monitor.startOperation("balance_check", Map.of("username", "alice")).finish(true, null);
        monitor.startOperation("balance_check", Map.of("username", "bob")).finish(false, "HTTP 500");
        monitor.startOperation("balance_batch", null).finish(true, null);

        OperationStats stats = monitor.getStats("balance_check").orElseThrow();
        assertThat(stats.getCount()).isEqualTo(2);
        assertThat(stats.getSuccessCount()).isEqualTo(1);
        assertThat(stats.getFailCount()).isEqualTo(1);
        assertThat(stats.getSuccessRate()).isEqualTo(50D);
        assertThat(stats.getMinSeconds()).isLessThanOrEqualTo(stats.getMaxSeconds());
        assertThat(monitor.getAllStats()).containsOnlyKeys("balance_batch", "balance_check");
        assertThat(monitor.getTotalOperations()).isEqualTo(3);
        assertThat(monitor.getStats("missing")).isEmpty();
    }

    @Test
    void shouldRecordTimerOnlyOnce() {
        OperationTimer timer = monitor.startOperation("web_check", Map.of());

        timer.finish(true, null);
        timer.finish(false, "late");

        assertThat(timer.isFinished()).isTrue();
        assertThat(monitor.getStats("web_check").orElseThrow().getCount()).isEqualTo(1);
        assertThat(monitor.getStats("web_check").orElseThrow().getFailCount()).isZero();
    }

    @Test
    void shouldReturnRecentMetricsNewestFirst() {
        monitor.startOperation("a", Map.of("n", "1")).finish(true, null);
        monitor.startOperation("b", Map.of("n", "2")).finish(true, null);
        monitor.startOperation("a", Map.of("n", "3")).finish(true, null);

        List<OperationMetric> recent = monitor.recentMetrics(10, null);
        List<OperationMetric> onlyA = monitor.recentMetrics(1, "a");

        assertThat(recent).extracting(metric -> metric.getTags().get("n")).containsExactly("3", "2", "1");
        assertThat(onlyA).singleElement().satisfies(metric -> assertThat(metric.getTags()).containsEntry("n", "3"));
    }

    @Test
    void shouldBoundHistory() {
        for (int i = 0; i < PerformanceMonitor.MAX_HISTORY + 5; i++) {
            monitor.startOperation("op", Map.of()).finish(true, null);
        }

        assertThat(monitor.recentMetrics(Integer.MAX_VALUE, null)).hasSize(PerformanceMonitor.MAX_HISTORY);
        assertThat(monitor.getTotalOperations()).isEqualTo(PerformanceMonitor.MAX_HISTORY + 5L);
    }

    @Test
    void shouldIncludeRecentFailuresInSnapshot() {
        monitor.startOperation("balance_check", Map.of()).finish(true, null);
        monitor.startOperation("balance_check", Map.of()).finish(false, "web login failed: captcha");

        PerformanceSnapshot snapshot = monitor.snapshot();

        assertThat(snapshot.getTotalOperations()).isEqualTo(2);
        assertThat(snapshot.getOperations()).extracting(OperationStats::getOperation).containsExactly("balance_check");
        assertThat(snapshot.getRecentFailures()).extracting(OperationMetric::getError)
            .containsExactly("web login failed: captcha");
        assertThat(snapshot.getAvailableProcessors()).isPositive();
    }

    @Test
    void shouldClearEverythingOnReset() {
        monitor.startOperation("op", Map.of()).finish(true, null);

        monitor.reset();

        assertThat(monitor.getAllStats()).isEmpty();
        assertThat(monitor.recentMetrics(10, null)).isEmpty();
        assertThat(monitor.getTotalOperations()).isZero();
    }

}
