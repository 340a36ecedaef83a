package fun.fengwk.bmh.core.facade.query.impl;

import fun.fengwk.bmh.core.facade.query.BalanceQueryFacade;
import fun.fengwk.bmh.core.facade.query.model.QueryResponse;
import fun.fengwk.bmh.core.report.ReportFormatter;
import fun.fengwk.bmh.core.service.account.Account;
import fun.fengwk.bmh.core.service.account.AccountRepository;
import fun.fengwk.bmh.core.service.browser.runtime.PoolStats;
import fun.fengwk.bmh.core.service.browser.runtime.WorkerProcessPool;
import fun.fengwk.bmh.core.service.metrics.PerformanceMonitor;
import fun.fengwk.bmh.core.service.monitor.BalanceCheckService;
import fun.fengwk.bmh.core.service.monitor.CheckMode;
import fun.fengwk.bmh.core.service.monitor.CheckResult;
import fun.fengwk.bmh.core.service.state.BalanceRecord;
import fun.fengwk.bmh.core.service.state.StateStore;
import fun.fengwk.bmh.core.utils.BalanceNumbers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * @author fengwk
 */
@Slf4j
@Component
public class BalanceQueryFacadeImpl implements BalanceQueryFacade {

    static final String POOL_BEAN_NAME = "workerProcessPool";

    static final String PERFORMANCE_TEMPLATE = "bmh_performance_report.ftl";

    private static final DateTimeFormatter FINISHED_AT_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final BalanceCheckService balanceCheckService;
    private final AccountRepository accountRepository;
    private final StateStore stateStore;
    private final PerformanceMonitor performanceMonitor;
    private final ReportFormatter reportFormatter;
    private final ListableBeanFactory beanFactory;

    private final ReentrantLock batchLock = new ReentrantLock();
    private volatile List<Account> accounts;

    public BalanceQueryFacadeImpl(BalanceCheckService balanceCheckService,
                                  AccountRepository accountRepository,
                                  StateStore stateStore,
                                  PerformanceMonitor performanceMonitor,
                                  ReportFormatter reportFormatter,
                                  ListableBeanFactory beanFactory) {
        this.balanceCheckService = balanceCheckService;
        this.accountRepository = accountRepository;
        this.stateStore = stateStore;
        this.performanceMonitor = performanceMonitor;
        this.reportFormatter = reportFormatter;
        this.beanFactory = beanFactory;
    }

    @Override
    public QueryResponse query(String targetUsername) {
        return runExclusive(CheckMode.NORMAL, targetUsername);
    }

    @Override
    public QueryResponse webLoginOnly(String targetUsername) {
        return runExclusive(CheckMode.WEB_ONLY, targetUsername);
    }

    @Override
    public List<CheckResult> cachedResults() {
        List<CheckResult> results = new ArrayList<>();
        for (Account account : currentAccounts()) {
            Optional<BalanceRecord> cached = stateStore.getCachedRecord(account.getUsername());
            if (cached.isPresent()) {
                BalanceRecord record = cached.get();
                results.add(CheckResult.success(account.getUsername(), record.getBalance(), "cache",
                    "cached at " + record.getUpdatedAt()));
            } else {
                results.add(CheckResult.builder()
                    .username(account.getUsername())
                    .success(false)
                    .balanceText("waiting")
                    .source("-")
                    .message("idle")
                    .build());
            }
        }
        return results;
    }

    @Override
    public List<Account> reloadAccounts() {
        List<Account> loaded = accountRepository.load();
        accounts = loaded;
        log.info("accounts reloaded, count={}", loaded.size());
        return loaded;
    }

    @Override
    public List<Account> upsertAccount(Account account) {
        List<Account> updated = accountRepository.upsert(account);
        accounts = updated;
        return updated;
    }

    @Override
    public boolean removeAccount(String username) {
        boolean removed = accountRepository.remove(username);
        if (removed) {
            reloadAccounts();
        }
        return removed;
    }

    @Override
    public String performanceReport() {
        return reportFormatter.format(PERFORMANCE_TEMPLATE, performanceMonitor.snapshot());
    }

    @Override
    public Optional<PoolStats> poolStats() {
        // Asking the lazy bean directly would start the browser processes.
        if (beanFactory instanceof ConfigurableListableBeanFactory configurable
            && !configurable.containsSingleton(POOL_BEAN_NAME)) {
            return Optional.empty();
        }
        return Optional.of(beanFactory.getBean(POOL_BEAN_NAME, WorkerProcessPool.class).stats());
    }

    private QueryResponse runExclusive(CheckMode mode, String targetUsername) {
        batchLock.lock();
        try {
            long startNanos = System.nanoTime();
            List<CheckResult> results = balanceCheckService.runBatch(currentAccounts(), mode, targetUsername);
            double elapsedSecs = (System.nanoTime() - startNanos) / 1_000_000_000D;
            return summarize(results, elapsedSecs);
        } finally {
            batchLock.unlock();
        }
    }

    private List<Account> currentAccounts() {
        List<Account> current = accounts;
        return current == null ? reloadAccounts() : current;
    }

    static QueryResponse summarize(List<CheckResult> results, double elapsedSecs) {
        int successCount = 0;
        int totalBalanceCount = 0;
        double totalBalance = 0D;
        for (CheckResult result : results) {
            if (!result.isSuccess()) {
                continue;
            }
            successCount++;
            Double balance = BalanceNumbers.parseFirstNumber(result.getBalanceText());
            if (balance != null) {
                totalBalance += balance;
                totalBalanceCount++;
            }
        }
        return QueryResponse.builder()
            .results(results)
            .elapsedSecs(elapsedSecs)
            .finishedAt(LocalDateTime.now().format(FINISHED_AT_FORMATTER))
            .successCount(successCount)
            .failCount(results.size() - successCount)
            .totalBalance(totalBalance)
            .totalBalanceCount(totalBalanceCount)
            .build();
    }

}
