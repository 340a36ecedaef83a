package fun.fengwk.bmh.core.service.monitor.impl;

import fun.fengwk.bmh.core.configuration.PerformanceProperties;
import fun.fengwk.bmh.core.facade.api.ApiBalanceClientFactory;
import fun.fengwk.bmh.core.facade.api.ApiProperties;
import fun.fengwk.bmh.core.facade.api.FastBalanceProbe;
import fun.fengwk.bmh.core.service.account.Account;
import fun.fengwk.bmh.core.service.metrics.OperationTimer;
import fun.fengwk.bmh.core.service.metrics.PerformanceMonitor;
import fun.fengwk.bmh.core.service.monitor.BalanceCheckService;
import fun.fengwk.bmh.core.service.monitor.CheckMode;
import fun.fengwk.bmh.core.service.monitor.CheckResult;
import fun.fengwk.bmh.core.service.progress.ProgressLevel;
import fun.fengwk.bmh.core.service.progress.ProgressSink;
import fun.fengwk.bmh.core.service.state.StateStore;
import fun.fengwk.bmh.core.service.webcheck.WebCheckRetry;
import fun.fengwk.bmh.core.service.webcheck.WebCheckStrategy;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fans a batch out to per-account pipelines bounded by a semaphore.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class BalanceCheckServiceImpl implements BalanceCheckService {

    static final String SOURCE_INIT = "init";
    static final String SOURCE_TASK = "task";

    private final ApiBalanceClientFactory apiBalanceClientFactory;
    private final WebCheckStrategy webCheckStrategy;
    private final StateStore stateStore;
    private final ProgressSink progressSink;
    private final PerformanceMonitor performanceMonitor;
    private final ApiProperties apiProperties;
    private final PerformanceProperties performanceProperties;
    private final ExecutorService checkExecutor;

    public BalanceCheckServiceImpl(
        ApiBalanceClientFactory apiBalanceClientFactory,
        WebCheckStrategy webCheckStrategy,
        StateStore stateStore,
        ProgressSink progressSink,
        PerformanceMonitor performanceMonitor,
        ApiProperties apiProperties,
        PerformanceProperties performanceProperties,
        @Qualifier("checkExecutor") ExecutorService checkExecutor
    ) {
        this.apiBalanceClientFactory = apiBalanceClientFactory;
        this.webCheckStrategy = webCheckStrategy;
        this.stateStore = stateStore;
        this.progressSink = progressSink;
        this.performanceMonitor = performanceMonitor;
        this.apiProperties = apiProperties;
        this.performanceProperties = performanceProperties;
        this.checkExecutor = checkExecutor;
    }

    @Override
    public List<CheckResult> runBatch(List<Account> accounts, CheckMode mode, String targetUsername) {
        return runBatch(accounts, mode, targetUsername, performanceProperties.getMaxWorkers());
    }

    @Override
    public List<CheckResult> runBatch(List<Account> accounts, CheckMode mode, String targetUsername, int budget) {
        long startNanos = System.nanoTime();
        OperationTimer batchTimer = performanceMonitor.startOperation("balance_batch", Map.of("mode", mode.getValue()));
        List<Account> selected = selectAccounts(accounts, targetUsername);

        FastBalanceProbe fastProbe = null;
        if (mode == CheckMode.NORMAL) {
            try {
                fastProbe = apiBalanceClientFactory.create();
            } catch (RuntimeException ex) {
                String message = "failed to initialize api client: " + ex.getMessage();
                log.error("balance batch init failed, mode={}, error={}", mode.getValue(), ex.getMessage(), ex);
                emit(ProgressLevel.ERROR, "", message);
                batchTimer.finish(false, message);
                return List.of(CheckResult.failure(CheckResult.SYSTEM_USERNAME, SOURCE_INIT, message));
            }
        }

        int concurrency = Math.max(1, budget);
        emit(ProgressLevel.INFO, "", "starting " + mode.getValue() + " check, accounts=" + selected.size()
            + ", concurrency=" + concurrency);

        WebCheckRetry retry = WebCheckRetry.of(
            performanceProperties.getRetryTimes(),
            Duration.ofSeconds(Math.max(0, performanceProperties.getRetryDelaySeconds()))
        );
        AccountCheckPipeline pipeline = new AccountCheckPipeline(
            fastProbe,
            webCheckStrategy,
            stateStore,
            apiProperties.isFallbackToWeb(),
            retry,
            this::emit
        );

        List<CheckResult> results = new ArrayList<>(selected.size());
        Semaphore permits = new Semaphore(concurrency);
        ExecutorCompletionService<CheckResult> completionService = new ExecutorCompletionService<>(checkExecutor);
        Map<Future<CheckResult>, Submission> pending = new HashMap<>();
        boolean interrupted = false;
        for (Account account : selected) {
            OperationTimer timer = performanceMonitor.startOperation(
                "balance_check", Map.of("username", account.getUsername(), "mode", mode.getValue()));
            Submission submission = new Submission(account, timer);
            if (interrupted) {
                results.add(taskFailure(submission, new InterruptedException("batch interrupted")));
                continue;
            }
            // The permit is taken here so queued accounts never occupy an executor thread.
            try {
                permits.acquire();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                interrupted = true;
                log.warn("balance batch interrupted while waiting for a permit, username={}", account.getUsername());
                results.add(taskFailure(submission, ex));
                continue;
            }
            try {
                Future<CheckResult> future = completionService.submit(() -> runPipeline(pipeline, mode, submission, permits));
                pending.put(future, submission);
            } catch (RejectedExecutionException ex) {
                permits.release();
                results.add(taskFailure(submission, ex));
            }
        }

        int total = pending.size() + results.size();
        while (!pending.isEmpty()) {
            Future<CheckResult> future;
            try {
                future = completionService.take();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.warn("balance batch interrupted, pending={}", pending.size());
                for (Map.Entry<Future<CheckResult>, Submission> entry : pending.entrySet()) {
                    entry.getKey().cancel(true);
                    results.add(taskFailure(entry.getValue(), ex));
                }
                pending.clear();
                break;
            }
            Submission submission = pending.remove(future);
            if (submission == null) {
                continue;
            }
            results.add(collect(future, submission));
            emit(ProgressLevel.INFO, "", "progress " + results.size() + "/" + total);
        }

        results.sort(Comparator.comparing(CheckResult::getUsername));
        long successCount = results.stream().filter(CheckResult::isSuccess).count();
        long failCount = results.size() - successCount;
        double elapsedSeconds = (System.nanoTime() - startNanos) / 1_000_000_000D;
        String summary = String.format("%s check finished: total=%d, success=%d, failed=%d, elapsed=%.1fs",
            mode.getValue(), results.size(), successCount, failCount, elapsedSeconds);
        log.info(summary);
        emit(failCount == 0 ? ProgressLevel.SUCCESS : ProgressLevel.WARN, "", summary);
        batchTimer.finish(failCount == 0, failCount == 0 ? null : failCount + " of " + results.size() + " accounts failed");
        return results;
    }

    private CheckResult runPipeline(AccountCheckPipeline pipeline, CheckMode mode, Submission submission, Semaphore permits) {
        Account account = submission.getAccount();
        try {
            CheckResult result = mode == CheckMode.WEB_ONLY ? pipeline.runWebOnly(account) : pipeline.runNormal(account);
            return complete(submission, result);
        } catch (RuntimeException ex) {
            log.warn("balance check task failed, username={}, error={}", account.getUsername(), ex.getMessage(), ex);
            return taskFailure(submission, ex);
        } finally {
            permits.release();
        }
    }

    private CheckResult collect(Future<CheckResult> future, Submission submission) {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn("balance check task crashed, username={}, error={}", submission.getAccount().getUsername(), cause.getMessage(), cause);
            return taskFailure(submission, cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return taskFailure(submission, ex);
        }
    }

    private CheckResult taskFailure(Submission submission, Throwable error) {
        String message = "check task failed: " + error.getMessage();
        return complete(submission, CheckResult.failure(submission.getAccount().getUsername(), SOURCE_TASK, message));
    }

    /**
     * Record the outcome of one account, only the first outcome finishes the timer and reaches the sink.
     */
    private CheckResult complete(Submission submission, CheckResult result) {
        if (!submission.getCompleted().compareAndSet(false, true)) {
            return result;
        }
        submission.getTimer().finish(result.isSuccess(), result.isSuccess() ? null : result.getMessage());
        String username = submission.getAccount().getUsername();
        if (result.isSuccess()) {
            emit(ProgressLevel.SUCCESS, username, "balance " + result.getBalanceText() + " (" + result.getSource() + ")");
        } else {
            emit(ProgressLevel.ERROR, username, result.getMessage());
        }
        return result;
    }

    private List<Account> selectAccounts(List<Account> accounts, String targetUsername) {
        if (accounts == null) {
            return List.of();
        }
        if (targetUsername == null || targetUsername.isBlank()) {
            return accounts;
        }
        String target = targetUsername.trim();
        return accounts.stream()
            .filter(account -> account.getUsername().equals(target))
            .toList();
    }

    private void emit(ProgressLevel level, String username, String message) {
        try {
            progressSink.emit(level, username, message);
        } catch (RuntimeException ex) {
            log.warn("emit progress failed, level={}, username={}, error={}", level, username, ex.getMessage());
        }
    }

    @Value
    private static class Submission {

        Account account;
        OperationTimer timer;
        AtomicBoolean completed = new AtomicBoolean(false);

    }

}
