package fun.fengwk.bmh.core.service.webcheck;

import fun.fengwk.bmh.core.service.account.Account;

/**
 * One login-and-read attempt against a leased browser worker.
 *
 * @author fengwk
 */
public interface WebLoginFlow {

    /**
     * @param endpoint control endpoint of the leased worker
     * @throws Exception when the attempt failed and may be retried
     */
    WebCheckResult runOnce(Account account, String endpoint) throws Exception;

}
