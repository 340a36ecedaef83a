package fun.fengwk.bmh.core.service.browser.runtime;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WorkerProcessPool tests.
 *
 * @author fengwk
 */
class WorkerProcessPoolTest {

    private final FakeWorkerProcessLauncher launcher = new FakeWorkerProcessLauncher();
    private WorkerProcessPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    @Test
    void shouldPreCreateMinWorkersAsIdle() {
        pool = newPool(2, 4);

        PoolStats stats = pool.stats();
        assertThat(stats.getPoolSize()).isEqualTo(2);
        assertThat(stats.getIdleCount()).isEqualTo(2);
        assertThat(stats.getBusyCount()).isZero();
        assertThat(stats.getAliveCount()).isEqualTo(2);
        assertThat(stats.getTotalCreated()).isEqualTo(2);
        assertThat(launcher.launches.get()).isEqualTo(2);
    }

    @Test
    void shouldReuseReleasedWorker() {
        pool = newPool(0, 2);

        PoolTicket first = pool.tryAcquire();
        assertThat(first).isNotNull();
        assertThat(first.getEndpoint()).startsWith("http://127.0.0.1:");
        pool.release(first);
        assertThat(first.isReleased()).isTrue();

        PoolTicket second = pool.tryAcquire();

        assertThat(second.getSlotId()).isEqualTo(first.getSlotId());
        assertThat(second.getEndpoint()).isEqualTo(first.getEndpoint());
        assertThat(launcher.launches.get()).isEqualTo(1);
        PoolStats stats = pool.stats();
        assertThat(stats.getTotalRequests()).isEqualTo(2);
        assertThat(stats.getTotalReused()).isEqualTo(1);
        assertThat(stats.getReuseRate()).isEqualTo(50D);
    }

    @Test
    void shouldCountOnlyAcquisitionsInReuseRate() {
        pool = newPool(0, 1);

        PoolTicket first = pool.tryAcquire();
        for (int i = 0; i < 8; i++) {
            assertThat(pool.tryAcquire()).isNull();
        }
        pool.release(first);
        PoolTicket second = pool.tryAcquire();

        assertThat(second).isNotNull();
        PoolStats stats = pool.stats();
        assertThat(stats.getTotalRequests()).isEqualTo(2);
        assertThat(stats.getTotalReused()).isEqualTo(1);
        assertThat(stats.getReuseRate()).isEqualTo(50D);
    }

    @Test
    void shouldNotCountWarmUpAsAcquisition() {
        pool = newPool(2, 2);

        assertThat(pool.stats().getTotalRequests()).isZero();

        pool.tryAcquire();

        assertThat(pool.stats().getTotalRequests()).isEqualTo(1);
        assertThat(pool.stats().getReuseRate()).isEqualTo(100D);
    }

    @Test
    void shouldHandOutDistinctWorkersWhileBusy() {
        pool = newPool(0, 3);

        PoolTicket a = pool.tryAcquire();
        PoolTicket b = pool.tryAcquire();

        assertThat(a.getSlotId()).isNotEqualTo(b.getSlotId());
        assertThat(a.getEndpoint()).isNotEqualTo(b.getEndpoint());
        assertThat(pool.stats().getBusyCount()).isEqualTo(2);
    }

    @Test
    void shouldReturnNullWhenAllBusyAtMax() {
        pool = newPool(1, 1);

        PoolTicket held = pool.tryAcquire();

        assertThat(held).isNotNull();
        assertThat(pool.tryAcquire()).isNull();
        assertThat(launcher.launches.get()).isEqualTo(1);
    }

    @Test
    void shouldNeverExceedMaxWorkersUnderConcurrentLoad() throws Exception {
        int maxWorkers = 3;
        pool = newPool(0, maxWorkers);
        Set<Long> inUse = ConcurrentHashMap.newKeySet();
        AtomicInteger doubleLeases = new AtomicInteger();
        AtomicInteger maxPoolSize = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(10);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int round = 0; round < 30; round++) {
                    PoolTicket ticket = pool.tryAcquire();
                    if (ticket == null) {
                        Thread.sleep(1);
                        continue;
                    }
                    if (!inUse.add(ticket.getSlotId())) {
                        doubleLeases.incrementAndGet();
                    }
                    maxPoolSize.accumulateAndGet(pool.stats().getPoolSize(), Math::max);
                    inUse.remove(ticket.getSlotId());
                    pool.release(ticket);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdownNow();

        assertThat(doubleLeases.get()).isZero();
        assertThat(maxPoolSize.get()).isLessThanOrEqualTo(maxWorkers);
        assertThat(launcher.launches.get()).isLessThanOrEqualTo(maxWorkers);
        assertThat(pool.stats().getBusyCount()).isZero();
    }

    @Test
    void shouldPurgeDeadIdleWorker() {
        pool = newPool(0, 1);
        PoolTicket ticket = pool.tryAcquire();
        FakeWorkerProcess process = launcher.process(ticket);
        pool.release(ticket);

        process.crash();
        PoolTicket replacement = pool.tryAcquire();

        assertThat(replacement).isNotNull();
        assertThat(replacement.getSlotId()).isNotEqualTo(ticket.getSlotId());
        assertThat(launcher.terminated).contains(ticket.getWorkerId());
        assertThat(pool.stats().getPoolSize()).isEqualTo(1);
        assertThat(pool.stats().getTotalCreated()).isEqualTo(2);
    }

    @Test
    void shouldNotPurgeBusyWorker() {
        pool = newPool(0, 1);
        PoolTicket ticket = pool.tryAcquire();
        launcher.process(ticket).crash();

        assertThat(pool.tryAcquire()).isNull();
        assertThat(pool.stats().getPoolSize()).isEqualTo(1);
        assertThat(launcher.terminated).doesNotContain(ticket.getWorkerId());

        // Once released the dead worker is purged and its slot is refilled.
        pool.release(ticket);
        PoolTicket replacement = pool.tryAcquire();
        assertThat(replacement).isNotNull();
        assertThat(replacement.getSlotId()).isNotEqualTo(ticket.getSlotId());
    }

    @Test
    void shouldSkipFailedWarmUp() {
        launcher.failNextLaunches.set(1);

        pool = newPool(2, 3);

        assertThat(pool.stats().getPoolSize()).isEqualTo(1);
        assertThat(launcher.launches.get()).isEqualTo(2);
    }

    @Test
    void shouldThrowSpawnFailureAndReleaseReservation() {
        pool = newPool(0, 1);
        launcher.failNextLaunches.set(1);

        assertThatThrownBy(() -> pool.tryAcquire())
            .isInstanceOf(WorkerSpawnException.class)
            .hasMessageContaining("executable not found");

        PoolTicket ticket = pool.tryAcquire();
        assertThat(ticket).isNotNull();
    }

    @Test
    void shouldFailWhenControlPortNeverOpens() {
        launcher.listen = false;
        pool = new WorkerProcessPool(
            WorkerPoolConfig.builder().minWorkers(0).maxWorkers(1).portReadyTimeoutMs(200).portPollIntervalMs(20).build(),
            launcher
        );

        assertThatThrownBy(() -> pool.tryAcquire())
            .isInstanceOf(WorkerSpawnException.class)
            .hasMessageContaining("not ready");
        assertThat(launcher.processes.values()).allMatch(FakeWorkerProcess::isDestroyed);
        assertThat(pool.stats().getPoolSize()).isZero();
    }

    @Test
    void shouldIgnoreDuplicateRelease() {
        pool = newPool(0, 1);
        PoolTicket first = pool.tryAcquire();
        pool.release(first);
        PoolTicket second = pool.tryAcquire();
        assertThat(second.getSlotId()).isEqualTo(first.getSlotId());

        pool.release(first);

        assertThat(pool.stats().getBusyCount()).isEqualTo(1);
        assertThat(pool.tryAcquire()).isNull();
    }

    @Test
    void shouldNotCloseProcessOnRelease() {
        pool = newPool(0, 1);
        PoolTicket ticket = pool.tryAcquire();

        pool.release(ticket);

        assertThat(launcher.process(ticket).isAlive()).isTrue();
    }

    @Test
    void shouldTimeoutWhenNoWorkerAvailable() {
        pool = newPool(1, 1);
        pool.tryAcquire();

        long startedAt = System.currentTimeMillis();
        assertThatThrownBy(() -> pool.acquire(150, 20))
            .isInstanceOf(WorkerLeaseTimeoutException.class)
            .hasMessageContaining("timed out waiting for an available browser worker");
        assertThat(System.currentTimeMillis() - startedAt).isGreaterThanOrEqualTo(150);
    }

    @Test
    void shouldAcquireAfterConcurrentRelease() throws Exception {
        pool = newPool(1, 1);
        PoolTicket held = pool.tryAcquire();
        Thread releaser = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            pool.release(held);
        });
        releaser.start();

        PoolTicket ticket = pool.acquire(5000, 20);

        assertThat(ticket.getSlotId()).isEqualTo(held.getSlotId());
        releaser.join();
    }

    @Test
    void shouldShutdownIdempotently() {
        pool = newPool(2, 2);

        pool.shutdown();
        pool.shutdown();

        assertThat(pool.isShutdown()).isTrue();
        assertThat(launcher.processes.values()).allMatch(process -> !process.isAlive());
        assertThat(launcher.terminated).hasSize(2);
        assertThatThrownBy(() -> pool.tryAcquire()).isInstanceOf(IllegalStateException.class);
    }

    private WorkerProcessPool newPool(int minWorkers, int maxWorkers) {
        return new WorkerProcessPool(
            WorkerPoolConfig.builder()
                .minWorkers(minWorkers)
                .maxWorkers(maxWorkers)
                .portReadyTimeoutMs(2000)
                .portPollIntervalMs(10)
                .probeTimeoutMs(200)
                .build(),
            launcher
        );
    }

}
