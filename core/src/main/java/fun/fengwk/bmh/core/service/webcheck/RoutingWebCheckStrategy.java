package fun.fengwk.bmh.core.service.webcheck;

import fun.fengwk.bmh.core.service.account.Account;
import fun.fengwk.bmh.core.service.browser.WebCheckProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Uses the hook command when configured, the pooled browser otherwise.
 *
 * @author fengwk
 */
@Primary
@Component
@RequiredArgsConstructor
public class RoutingWebCheckStrategy implements WebCheckStrategy {

    private final WebCheckProperties webCheckProperties;
    private final CommandHookWebCheck commandHookWebCheck;
    private final PooledBrowserWebCheck pooledBrowserWebCheck;

    @Override
    public WebCheckResult check(Account account, WebCheckRetry retry) throws WebCheckException {
        if (webCheckProperties.isCommandHookEnabled()) {
            return commandHookWebCheck.check(account, retry);
        }
        return pooledBrowserWebCheck.check(account, retry);
    }

}
