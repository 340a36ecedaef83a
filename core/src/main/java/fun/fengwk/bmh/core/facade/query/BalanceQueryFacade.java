package fun.fengwk.bmh.core.facade.query;

import fun.fengwk.bmh.core.facade.query.model.QueryResponse;
import fun.fengwk.bmh.core.service.account.Account;
import fun.fengwk.bmh.core.service.browser.runtime.PoolStats;
import fun.fengwk.bmh.core.service.monitor.CheckResult;

import java.util.List;
import java.util.Optional;

/**
 * @author fengwk
 */
public interface BalanceQueryFacade {

    /**
     * Run a normal batch, only one batch runs at a time.
     *
     * @param targetUsername single account to check, blank for all
     */
    QueryResponse query(String targetUsername);

    /**
     * Run a batch that only uses the web login.
     */
    QueryResponse webLoginOnly(String targetUsername);

    /**
     * Cached view of every account without touching the network.
     */
    List<CheckResult> cachedResults();

    List<Account> reloadAccounts();

    List<Account> upsertAccount(Account account);

    boolean removeAccount(String username);

    String performanceReport();

    /**
     * Worker pool counters, empty until the first web check started the pool.
     */
    Optional<PoolStats> poolStats();

}
