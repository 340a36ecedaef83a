package fun.fengwk.bmh.core.service.browser.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * One external worker process and its control port.
 *
 * <p>Mutable fields are guarded by the owning pool's lock.
 *
 * @author fengwk
 */
final class WorkerHandle {

    private static final Logger log = LoggerFactory.getLogger(WorkerHandle.class);

    private static final long TERMINATE_WAIT_SECONDS = 2;

    private final long slotId;
    private final String workerId;
    private final Process process;
    private final String host;
    private final int port;
    private final Instant createdAt;

    private Instant lastUsedAt;
    private long useCount;
    private boolean busy;

    WorkerHandle(long slotId, String workerId, Process process, String host, int port) {
        this.slotId = slotId;
        this.workerId = workerId;
        this.process = process;
        this.host = host;
        this.port = port;
        this.createdAt = Instant.now();
        this.lastUsedAt = createdAt;
    }

    long getSlotId() {
        return slotId;
    }

    String getWorkerId() {
        return workerId;
    }

    int getPort() {
        return port;
    }

    String getEndpoint() {
        return "http://" + host + ":" + port;
    }

    Instant getCreatedAt() {
        return createdAt;
    }

    Instant getLastUsedAt() {
        return lastUsedAt;
    }

    long getUseCount() {
        return useCount;
    }

    boolean isBusy() {
        return busy;
    }

    boolean isProcessAlive() {
        return process.isAlive();
    }

    void lease() {
        busy = true;
        useCount++;
        lastUsedAt = Instant.now();
    }

    void markIdle() {
        busy = false;
        lastUsedAt = Instant.now();
    }

    /**
     * Process still running and the control port accepts connections.
     */
    boolean isAlive(int probeTimeoutMs) {
        return process.isAlive() && isPortOpen(probeTimeoutMs);
    }

    boolean isPortOpen(int connectTimeoutMs) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), Math.max(1, connectTimeoutMs));
            return true;
        } catch (IOException ex) {
            return false;
        }
    }

    /**
     * Terminate the process tree and reap it, idempotent.
     */
    void terminate() {
        try {
            process.descendants().forEach(ProcessHandle::destroy);
        } catch (UnsupportedOperationException ex) {
            log.debug("process tree not available, workerId={}", workerId);
        }
        process.destroy();
        try {
            if (!process.waitFor(TERMINATE_WAIT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                process.waitFor(TERMINATE_WAIT_SECONDS, TimeUnit.SECONDS);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            log.info("interrupted while terminating worker, workerId={}", workerId);
        }
    }

}
