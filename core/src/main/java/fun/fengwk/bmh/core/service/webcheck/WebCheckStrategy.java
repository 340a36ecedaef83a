package fun.fengwk.bmh.core.service.webcheck;

import fun.fengwk.bmh.core.service.account.Account;

/**
 * Slow balance acquisition through a real login.
 *
 * @author fengwk
 */
public interface WebCheckStrategy {

    /**
     * Run the web check for one account.
     *
     * @return result of the login flow, failed attempts are reported as an unsuccessful result
     * @throws WebCheckException when the check could not be executed
     */
    WebCheckResult check(Account account, WebCheckRetry retry) throws WebCheckException;

}
