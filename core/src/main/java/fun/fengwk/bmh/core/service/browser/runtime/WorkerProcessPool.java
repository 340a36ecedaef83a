package fun.fengwk.bmh.core.service.browser.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pool of external worker processes leased through single-use tickets.
 *
 * <p>Lifecycle model:
 * <ul>
 *     <li>Pre-create min workers, later workers are spawned lazily up to max.</li>
 *     <li>{@link #tryAcquire()} never waits: purge dead idle workers, reuse an idle one, spawn, or give up.</li>
 *     <li>{@link #release(PoolTicket)} only marks the worker idle, processes are terminated when found dead or on shutdown.</li>
 * </ul>
 *
 * <p>Workers are keyed by a stable slot id, removing one never invalidates another worker's ticket.
 * The pool lock is never held while spawning, sleeping or terminating a process.
 *
 * @author fengwk
 */
public class WorkerProcessPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerProcessPool.class);

    private static final String LOOPBACK_HOST = "127.0.0.1";

    private final WorkerPoolConfig config;
    private final WorkerProcessLauncher launcher;

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Registered workers by slot id, guarded by {@link #lock}.
     */
    private final Map<Long, WorkerHandle> workers = new LinkedHashMap<>();

    private final AtomicLong slotSequence = new AtomicLong(1);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    /**
     * Slots reserved by spawns in progress, guarded by {@link #lock}.
     */
    private int pendingSpawns;
    private long totalCreated;
    private long totalReused;
    private long totalRequests;

    public WorkerProcessPool(WorkerPoolConfig config, WorkerProcessLauncher launcher) {
        this.config = normalizeConfig(config);
        this.launcher = launcher;
        initializeMinWorkers();
    }

    /**
     * Lease a worker without waiting.
     *
     * @return ticket, or {@code null} when every worker is busy and the pool is at max size
     * @throws WorkerSpawnException when a new worker was needed but could not be started
     */
    public PoolTicket tryAcquire() {
        ensureRunning();

        List<WorkerHandle> deadWorkers = new ArrayList<>();
        PoolTicket ticket = null;
        boolean reserved = false;
        lock.lock();
        try {
            Iterator<WorkerHandle> iterator = workers.values().iterator();
            while (iterator.hasNext()) {
                WorkerHandle handle = iterator.next();
                // A busy worker may be mid-navigation, only its holder decides it is broken.
                if (!handle.isBusy() && !handle.isAlive(config.getProbeTimeoutMs())) {
                    iterator.remove();
                    deadWorkers.add(handle);
                }
            }

            for (WorkerHandle handle : workers.values()) {
                if (!handle.isBusy()) {
                    handle.lease();
                    totalRequests++;
                    totalReused++;
                    ticket = toTicket(handle);
                    break;
                }
            }

            if (ticket == null && workers.size() + pendingSpawns < config.getMaxWorkers()) {
                pendingSpawns++;
                reserved = true;
            }
        } finally {
            lock.unlock();
        }

        terminateAll(deadWorkers);
        if (ticket != null) {
            log.debug("reused worker, workerId={}, slotId={}", ticket.getWorkerId(), ticket.getSlotId());
            return ticket;
        }
        if (!reserved) {
            return null;
        }
        return spawnAndRegister(true);
    }

    /**
     * Lease a worker, polling {@link #tryAcquire()} until the deadline.
     *
     * @throws WorkerLeaseTimeoutException when no worker became available in time
     */
    public PoolTicket acquire(long timeoutMs, long retryIntervalMs) throws InterruptedException {
        long normalizedTimeoutMs = Math.max(0L, timeoutMs);
        long normalizedRetryMs = Math.max(10L, retryIntervalMs);
        long deadline = System.currentTimeMillis() + normalizedTimeoutMs;
        while (true) {
            PoolTicket ticket = tryAcquire();
            if (ticket != null) {
                return ticket;
            }
            long remainingMs = deadline - System.currentTimeMillis();
            if (remainingMs <= 0) {
                break;
            }
            Thread.sleep(Math.min(normalizedRetryMs, remainingMs));
        }
        log.info(
            "worker lease timed out, timeoutMs={}, retryIntervalMs={}, stats={}",
            normalizedTimeoutMs,
            normalizedRetryMs,
            stats()
        );
        throw new WorkerLeaseTimeoutException(
            "timed out waiting for an available browser worker (" + normalizedTimeoutMs + "ms)");
    }

    /**
     * Return a leased worker to the idle set. Duplicate or unknown tickets are ignored.
     */
    public void release(PoolTicket ticket) {
        if (ticket == null) {
            return;
        }
        if (!ticket.markReleased()) {
            log.warn("ignore duplicate ticket release, ticket={}", ticket);
            return;
        }
        lock.lock();
        try {
            WorkerHandle handle = workers.get(ticket.getSlotId());
            if (handle != null) {
                handle.markIdle();
            }
        } finally {
            lock.unlock();
        }
    }

    public PoolStats stats() {
        lock.lock();
        try {
            int busyCount = 0;
            int aliveCount = 0;
            for (WorkerHandle handle : workers.values()) {
                if (handle.isBusy()) {
                    busyCount++;
                }
                if (handle.isProcessAlive()) {
                    aliveCount++;
                }
            }
            double reuseRate = totalRequests == 0 ? 0D : (double) totalReused / totalRequests * 100D;
            return PoolStats.builder()
                .poolSize(workers.size())
                .busyCount(busyCount)
                .idleCount(workers.size() - busyCount)
                .aliveCount(aliveCount)
                .totalCreated(totalCreated)
                .totalReused(totalReused)
                .totalRequests(totalRequests)
                .reuseRate(reuseRate)
                .build();
        } finally {
            lock.unlock();
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Terminate every worker process, idempotent.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        List<WorkerHandle> remaining;
        lock.lock();
        try {
            remaining = new ArrayList<>(workers.values());
            workers.clear();
        } finally {
            lock.unlock();
        }
        log.info("shutting down worker process pool, workers={}", remaining.size());
        terminateAll(remaining);
        log.info("worker process pool shutdown completed");
    }

    private void initializeMinWorkers() {
        for (int i = 0; i < config.getMinWorkers(); i++) {
            lock.lock();
            try {
                pendingSpawns++;
            } finally {
                lock.unlock();
            }
            try {
                PoolTicket ticket = spawnAndRegister(false);
                release(ticket);
            } catch (RuntimeException ex) {
                // Warm-up is best effort, later acquires retry spawning.
                log.warn("pre-create worker failed, index={}, error={}", i, ex.getMessage(), ex);
            }
        }
        log.info("worker process pool initialized, stats={}", stats());
    }

    /**
     * Spawn into a slot already reserved through {@link #pendingSpawns}.
     *
     * @param leased whether the caller hands the ticket out, warm-up spawns are not counted as requests
     */
    private PoolTicket spawnAndRegister(boolean leased) {
        WorkerHandle handle;
        try {
            handle = spawnWorker();
        } catch (RuntimeException ex) {
            lock.lock();
            try {
                pendingSpawns--;
            } finally {
                lock.unlock();
            }
            throw ex;
        }

        boolean rejected;
        lock.lock();
        try {
            pendingSpawns--;
            rejected = shutdown.get();
            if (!rejected) {
                handle.lease();
                workers.put(handle.getSlotId(), handle);
                totalCreated++;
                if (leased) {
                    totalRequests++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (rejected) {
            terminate(handle);
            throw new IllegalStateException("worker process pool is shutdown");
        }
        log.debug("created worker, workerId={}, endpoint={}", handle.getWorkerId(), handle.getEndpoint());
        return toTicket(handle);
    }

    private WorkerHandle spawnWorker() {
        long slotId = slotSequence.getAndIncrement();
        String workerId = "worker-" + slotId;
        int port = allocatePort();

        Process process;
        try {
            process = launcher.launch(workerId, port);
        } catch (IOException | RuntimeException ex) {
            log.warn("launch worker failed, workerId={}, port={}, error={}", workerId, port, ex.getMessage(), ex);
            launcher.afterTermination(workerId);
            throw new WorkerSpawnException("failed to launch worker process: " + ex.getMessage(), ex);
        }

        WorkerHandle handle = new WorkerHandle(slotId, workerId, process, LOOPBACK_HOST, port);
        if (!waitPortReady(handle)) {
            terminate(handle);
            throw new WorkerSpawnException(
                "worker control port not ready within " + config.getPortReadyTimeoutMs() + "ms, port=" + port);
        }
        return handle;
    }

    private boolean waitPortReady(WorkerHandle handle) {
        long deadline = System.currentTimeMillis() + config.getPortReadyTimeoutMs();
        while (true) {
            if (!handle.isProcessAlive()) {
                log.warn("worker process exited before port ready, workerId={}", handle.getWorkerId());
                return false;
            }
            if (handle.isPortOpen(config.getProbeTimeoutMs())) {
                return true;
            }
            if (System.currentTimeMillis() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(config.getPortPollIntervalMs());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                terminate(handle);
                throw new WorkerSpawnException("interrupted while waiting for worker port", ex);
            }
        }
    }

    private int allocatePort() {
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getByName(LOOPBACK_HOST))) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException ex) {
            throw new WorkerSpawnException("failed to allocate worker port: " + ex.getMessage(), ex);
        }
    }

    private PoolTicket toTicket(WorkerHandle handle) {
        return new PoolTicket(handle.getSlotId(), handle.getWorkerId(), handle.getEndpoint());
    }

    private void terminateAll(List<WorkerHandle> handles) {
        for (WorkerHandle handle : handles) {
            terminate(handle);
        }
    }

    private void terminate(WorkerHandle handle) {
        try {
            handle.terminate();
            log.debug("terminated worker, workerId={}, uses={}", handle.getWorkerId(), handle.getUseCount());
        } catch (RuntimeException ex) {
            log.warn("terminate worker failed, workerId={}, error={}", handle.getWorkerId(), ex.getMessage(), ex);
        } finally {
            launcher.afterTermination(handle.getWorkerId());
        }
    }

    private void ensureRunning() {
        if (shutdown.get()) {
            throw new IllegalStateException("worker process pool is shutdown");
        }
    }

    private WorkerPoolConfig normalizeConfig(WorkerPoolConfig rawConfig) {
        int normalizedMaxWorkers = Math.max(1, rawConfig.getMaxWorkers());
        int normalizedMinWorkers = Math.min(Math.max(0, rawConfig.getMinWorkers()), normalizedMaxWorkers);
        return WorkerPoolConfig.builder()
            .minWorkers(normalizedMinWorkers)
            .maxWorkers(normalizedMaxWorkers)
            .portReadyTimeoutMs(Math.max(1L, rawConfig.getPortReadyTimeoutMs()))
            .portPollIntervalMs(Math.max(10L, rawConfig.getPortPollIntervalMs()))
            .probeTimeoutMs(Math.max(1, rawConfig.getProbeTimeoutMs()))
            .build();
    }

}
