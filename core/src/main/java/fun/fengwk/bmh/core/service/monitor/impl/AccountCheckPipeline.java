package fun.fengwk.bmh.core.service.monitor.impl;

import fun.fengwk.bmh.core.facade.api.ApiBalanceResult;
import fun.fengwk.bmh.core.facade.api.FastBalanceProbe;
import fun.fengwk.bmh.core.service.account.Account;
import fun.fengwk.bmh.core.service.monitor.CheckResult;
import fun.fengwk.bmh.core.service.progress.ProgressLevel;
import fun.fengwk.bmh.core.service.progress.ProgressSink;
import fun.fengwk.bmh.core.service.state.StatePersistenceException;
import fun.fengwk.bmh.core.service.state.StateStore;
import fun.fengwk.bmh.core.service.webcheck.WebCheckException;
import fun.fengwk.bmh.core.service.webcheck.WebCheckResult;
import fun.fengwk.bmh.core.service.webcheck.WebCheckRetry;
import fun.fengwk.bmh.core.service.webcheck.WebCheckStrategy;
import fun.fengwk.bmh.core.utils.BalanceNumbers;
import lombok.extern.slf4j.Slf4j;

/**
 * Strategy arbitration for a single account.
 *
 * <p>The first check of each cycle day must come from a web login. Later checks use the fast api when the
 * account has a key and fall back to the web login, or to the cached balance when fallback is disabled.
 *
 * @author fengwk
 */
@Slf4j
class AccountCheckPipeline {

    static final String SOURCE_API = "api";
    static final String SOURCE_CACHE = "cache";
    static final String SOURCE_WEB = "web_hook";
    static final String SOURCE_WEB_ONLY = "web_only";
    static final String API_FAILED_BALANCE_TEXT = "API failed";

    private final FastBalanceProbe fastProbe;
    private final WebCheckStrategy webCheckStrategy;
    private final StateStore stateStore;
    private final boolean fallbackToWeb;
    private final WebCheckRetry retry;
    private final ProgressSink progress;

    AccountCheckPipeline(
        FastBalanceProbe fastProbe,
        WebCheckStrategy webCheckStrategy,
        StateStore stateStore,
        boolean fallbackToWeb,
        WebCheckRetry retry,
        ProgressSink progress
    ) {
        this.fastProbe = fastProbe;
        this.webCheckStrategy = webCheckStrategy;
        this.stateStore = stateStore;
        this.fallbackToWeb = fallbackToWeb;
        this.retry = retry;
        this.progress = progress;
    }

    CheckResult runNormal(Account account) {
        String username = account.getUsername();
        boolean forced = stateStore.shouldForceFull(username);
        if (forced) {
            progress.emit(ProgressLevel.INFO, username,
                "first check of cycle day " + stateStore.currentCycleDay() + ", web login required");
        }

        if (!forced && account.hasApiKey()) {
            progress.emit(ProgressLevel.INFO, username, "querying balance through api");
            ApiBalanceResult api = fastProbe.queryBalance(account.getApiKey());
            if (api.isSuccess()) {
                return onFastSuccess(username, api);
            }
            progress.emit(ProgressLevel.WARN, username, "api query failed: " + api.getMessage());
            if (!fallbackToWeb) {
                return onFastFailureWithoutFallback(username, api);
            }
            progress.emit(ProgressLevel.INFO, username, "falling back to web login");
        }

        progress.emit(ProgressLevel.INFO, username, "running web login check");
        WebCheckResult web;
        try {
            web = webCheckStrategy.check(account, retry);
        } catch (WebCheckException ex) {
            String reason = "web login unavailable: " + ex.getMessage();
            progress.emit(ProgressLevel.WARN, username, reason);
            return forced ? forcedFailure(username, reason) : lastResort(account, reason);
        }

        if (web.isSuccess() && web.getBalance() != null) {
            String balanceText = BalanceNumbers.format(web.getBalance());
            persistWebSuccess(username, balanceText, web);
            if (account.hasApiKey()) {
                ApiBalanceResult api = fastProbe.queryBalance(account.getApiKey());
                if (api.isSuccess()) {
                    return onFastSuccess(username, api, web.getApikeySyncSuccess(), web.getApikeySyncMessage());
                }
                progress.emit(ProgressLevel.WARN, username, "api re-check after web login failed: " + api.getMessage());
            }
            return CheckResult.success(username, balanceText, SOURCE_WEB, messageOrDefault(web.getMessage(), "web login check succeeded"));
        }

        String reason = web.isSuccess()
            ? "web login succeeded but no balance was extracted"
            : "web login failed: " + web.getMessage();
        return forced ? forcedFailure(username, reason) : lastResort(account, reason);
    }

    CheckResult runWebOnly(Account account) {
        String username = account.getUsername();
        progress.emit(ProgressLevel.INFO, username, "running web login check");
        WebCheckResult web;
        try {
            web = webCheckStrategy.check(account, retry);
        } catch (WebCheckException ex) {
            return CheckResult.failure(username, SOURCE_WEB_ONLY, "web login unavailable: " + ex.getMessage());
        }
        if (!web.isSuccess()) {
            return CheckResult.failure(username, SOURCE_WEB_ONLY, "web login failed: " + web.getMessage());
        }
        if (web.getBalance() == null) {
            return CheckResult.failure(username, SOURCE_WEB_ONLY, "web login succeeded but no balance was extracted");
        }
        String balanceText = BalanceNumbers.format(web.getBalance());
        persistWebSuccess(username, balanceText, web);
        return CheckResult.success(username, balanceText, SOURCE_WEB_ONLY, messageOrDefault(web.getMessage(), "web login check succeeded"));
    }

    private CheckResult onFastSuccess(String username, ApiBalanceResult api) {
        return onFastSuccess(username, api, null, null);
    }

    private CheckResult onFastSuccess(String username, ApiBalanceResult api, Boolean syncSuccess, String syncMessage) {
        String balanceText = BalanceNumbers.format(api.getBalance() == null ? 0D : api.getBalance());
        try {
            stateStore.updateBalance(username, balanceText, syncSuccess, syncMessage);
        } catch (StatePersistenceException ex) {
            log.warn("persist balance failed, username={}, error={}", username, ex.getMessage(), ex);
        }
        return CheckResult.success(username, balanceText, api.getSource(), api.getMessage());
    }

    private CheckResult onFastFailureWithoutFallback(String username, ApiBalanceResult api) {
        return stateStore.getCachedBalance(username)
            .map(cached -> CheckResult.success(username, cached, SOURCE_CACHE,
                "api query failed, using cached balance: " + api.getMessage()))
            .orElseGet(() -> CheckResult.builder()
                .username(username)
                .success(false)
                .balanceText(API_FAILED_BALANCE_TEXT)
                .source(SOURCE_API)
                .message(api.getMessage())
                .build());
    }

    private CheckResult lastResort(Account account, String reason) {
        String username = account.getUsername();
        if (!account.hasApiKey()) {
            return CheckResult.failure(username, SOURCE_WEB, reason);
        }
        progress.emit(ProgressLevel.INFO, username, "retrying api after web login failure");
        ApiBalanceResult api = fastProbe.queryBalance(account.getApiKey());
        if (api.isSuccess()) {
            return onFastSuccess(username, api);
        }
        return CheckResult.failure(username, SOURCE_WEB, reason + "; api fallback failed: " + api.getMessage());
    }

    private CheckResult forcedFailure(String username, String reason) {
        return CheckResult.failure(username, SOURCE_WEB, "first check of the cycle day needs a web login balance, " + reason);
    }

    private void persistWebSuccess(String username, String balanceText, WebCheckResult web) {
        try {
            stateStore.markCycleFulfilled(username);
        } catch (StatePersistenceException ex) {
            log.warn("persist cycle marker failed, username={}, error={}", username, ex.getMessage(), ex);
        }
        try {
            stateStore.updateBalance(username, balanceText, web.getApikeySyncSuccess(), web.getApikeySyncMessage());
        } catch (StatePersistenceException ex) {
            log.warn("persist balance failed, username={}, error={}", username, ex.getMessage(), ex);
        }
    }

    private String messageOrDefault(String message, String defaultMessage) {
        return message == null || message.isBlank() ? defaultMessage : message;
    }

}
