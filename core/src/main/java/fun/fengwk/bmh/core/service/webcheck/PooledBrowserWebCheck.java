package fun.fengwk.bmh.core.service.webcheck;

import fun.fengwk.bmh.core.service.account.Account;
import fun.fengwk.bmh.core.service.browser.WebCheckProperties;
import fun.fengwk.bmh.core.service.browser.runtime.PoolTicket;
import fun.fengwk.bmh.core.service.browser.runtime.WorkerLeaseTimeoutException;
import fun.fengwk.bmh.core.service.browser.runtime.WorkerProcessPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Web check on a leased browser worker.
 *
 * <p>The flow runs on a separate executor so a stuck flow can be abandoned at the timeout. The ticket is
 * released by the flow task itself, a worker is never handed out again while a flow still drives it.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class PooledBrowserWebCheck implements WebCheckStrategy {

    private final WorkerProcessPool workerProcessPool;
    private final WebLoginFlow webLoginFlow;
    private final WebCheckProperties webCheckProperties;
    private final ExecutorService webFlowExecutor;

    public PooledBrowserWebCheck(
        @Lazy WorkerProcessPool workerProcessPool,
        WebLoginFlow webLoginFlow,
        WebCheckProperties webCheckProperties,
        @Qualifier("webFlowExecutor") ExecutorService webFlowExecutor
    ) {
        this.workerProcessPool = workerProcessPool;
        this.webLoginFlow = webLoginFlow;
        this.webCheckProperties = webCheckProperties;
        this.webFlowExecutor = webFlowExecutor;
    }

    @Override
    public WebCheckResult check(Account account, WebCheckRetry retry) throws WebCheckException {
        PoolTicket ticket = leaseWorker(account);
        AtomicBoolean started = new AtomicBoolean(false);

        Future<WebCheckResult> future;
        try {
            future = webFlowExecutor.submit(() -> {
                if (!started.compareAndSet(false, true)) {
                    return WebCheckResult.fail("web flow cancelled before start");
                }
                try {
                    return runWithRetry(account, ticket.getEndpoint(), retry);
                } finally {
                    releaseWorker(ticket);
                }
            });
        } catch (RejectedExecutionException ex) {
            releaseWorker(ticket);
            throw new WebCheckException("web flow executor unavailable: " + ex.getMessage(), ex);
        }

        int timeoutSeconds = Math.max(1, webCheckProperties.getTimeoutSeconds());
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException ex) {
            abandon(future, started, ticket);
            log.warn("web flow timed out, username={}, timeoutSeconds={}", account.getUsername(), timeoutSeconds);
            return WebCheckResult.fail("web flow timed out (" + timeoutSeconds + "s)");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn("web flow crashed, username={}, error={}", account.getUsername(), cause.getMessage(), cause);
            return WebCheckResult.fail("web flow failed: " + cause.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            abandon(future, started, ticket);
            throw new WebCheckException("interrupted while waiting for web flow", ex);
        }
    }

    private PoolTicket leaseWorker(Account account) throws WebCheckException {
        try {
            PoolTicket ticket = workerProcessPool.acquire(
                webCheckProperties.getLeaseTimeoutMs(),
                webCheckProperties.getLeasePollIntervalMs()
            );
            log.debug("leased browser worker, username={}, ticket={}", account.getUsername(), ticket);
            return ticket;
        } catch (WorkerLeaseTimeoutException ex) {
            throw new WebCheckException(ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new WebCheckException("interrupted while waiting for a browser worker", ex);
        } catch (RuntimeException ex) {
            log.warn("browser worker unavailable, username={}, error={}", account.getUsername(), ex.getMessage(), ex);
            throw new WebCheckException("browser worker unavailable: " + ex.getMessage(), ex);
        }
    }

    WebCheckResult runWithRetry(Account account, String endpoint, WebCheckRetry retry) {
        int attempts = retry.getAttempts();
        Exception lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                WebCheckResult result = webLoginFlow.runOnce(account, endpoint);
                log.info("web login attempt finished, username={}, attempt={}/{}, success={}",
                    account.getUsername(), attempt, attempts, result.isSuccess());
                return result;
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                lastError = ex;
                break;
            } catch (Exception ex) {
                lastError = ex;
                log.warn("web login attempt failed, username={}, attempt={}/{}, error={}",
                    account.getUsername(), attempt, attempts, ex.getMessage());
            }
            if (attempt < attempts && !sleep(retry.getDelay())) {
                break;
            }
        }
        String error = lastError == null || lastError.getMessage() == null ? "interrupted" : lastError.getMessage();
        return WebCheckResult.fail("web login failed after " + attempts + " attempts: " + error);
    }

    private void abandon(Future<WebCheckResult> future, AtomicBoolean started, PoolTicket ticket) {
        future.cancel(true);
        // A task cancelled before it ran never reaches its own release.
        if (started.compareAndSet(false, true)) {
            releaseWorker(ticket);
        }
    }

    private void releaseWorker(PoolTicket ticket) {
        try {
            workerProcessPool.release(ticket);
            log.debug("released browser worker, ticket={}, stats={}", ticket, workerProcessPool.stats());
        } catch (RuntimeException ex) {
            log.warn("release browser worker failed, ticket={}, error={}", ticket, ex.getMessage(), ex);
        }
    }

    private boolean sleep(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

}
