package fun.fengwk.bmh.core.service.monitor;

import fun.fengwk.bmh.core.service.account.Account;

import java.util.List;

/**
 * Runs balance checks over a set of accounts with bounded concurrency.
 *
 * @author fengwk
 */
public interface BalanceCheckService {

    /**
     * Run one batch with the configured concurrency budget.
     *
     * @param targetUsername restrict the batch to this account, blank for all
     * @return exactly one result per selected account, sorted by username
     */
    List<CheckResult> runBatch(List<Account> accounts, CheckMode mode, String targetUsername);

    List<CheckResult> runBatch(List<Account> accounts, CheckMode mode, String targetUsername, int budget);

}
