package fun.fengwk.bmh.core.service.webcheck;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import fun.fengwk.bmh.core.service.account.Account;
import fun.fengwk.bmh.core.service.browser.BrowserProperties;
import fun.fengwk.bmh.core.utils.BalanceNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Logs into the console through a leased Chromium worker over CDP and reads the balance.
 *
 * <p>Every attempt opens a fresh browser context, so a retry never resumes a half-finished login.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlaywrightWebLoginFlow implements WebLoginFlow {

    private static final List<String> LOGIN_ERROR_SELECTORS = List.of(
        ".error-message", ".alert-danger", ".toast-error", "[role=alert]"
    );

    private static final Pattern CLOSE_BUTTON_TEXT = Pattern.compile("今日关闭|关闭公告|关闭");

    private static final long SKELETON_WAIT_MS = 10000;

    private final BrowserProperties browserProperties;
    private final PageBalanceExtractor pageBalanceExtractor;
    private final ApiKeyQuotaSync apiKeyQuotaSync;

    @Override
    public WebCheckResult runOnce(Account account, String endpoint) throws Exception {
        try (Playwright playwright = Playwright.create()) {
            Browser browser = playwright.chromium().connectOverCDP(endpoint);
            BrowserContext context = null;
            try {
                context = browser.newContext(buildContextOptions());
                if (browserProperties.isDisableImages()) {
                    context.route("**/*", route -> {
                        if ("image".equals(route.request().resourceType())) {
                            route.abort();
                        } else {
                            route.resume();
                        }
                    });
                }
                Page page = context.newPage();
                page.setDefaultNavigationTimeout(browserProperties.getPageLoadTimeoutSeconds() * 1000D);
                page.setDefaultTimeout(5000);
                return login(page, account);
            } finally {
                closeQuietly(context);
                // Disconnects only, the worker process keeps running for the next lease.
                browser.close();
            }
        }
    }

    private WebCheckResult login(Page page, Account account) {
        String consoleUrl = browserProperties.getConsoleUrl();
        page.navigate(consoleUrl);
        page.waitForTimeout(800);

        if (page.url().contains("/login")) {
            page.waitForTimeout(500);
            closeAnnouncementPopup(page);
            switchToEmailLogin(page);
            submitLogin(page, account);
            page.navigate(consoleUrl);
            page.waitForTimeout(800);
        }

        String loggedUrl = page.url();
        log.info("web login landed, username={}, url={}", account.getUsername(), loggedUrl);
        if (!loggedUrl.contains("/console") || loggedUrl.contains("/login")) {
            Optional<String> error = readLoginError(page);
            throw new IllegalStateException(error
                .map(text -> "login failed: " + text + " (url=" + loggedUrl + ")")
                .orElse("login failed, url=" + loggedUrl));
        }

        String balanceText = waitForBalance(page);
        Double balance = BalanceNumbers.parseFirstNumber(balanceText);
        if (balance == null) {
            throw new IllegalStateException("unparsable balance text: " + balanceText);
        }
        if (!browserProperties.isSyncApiKeyQuota()) {
            return WebCheckResult.ok(balance, "web login succeeded");
        }
        return WebCheckResult.synced(balance, apiKeyQuotaSync.sync(page, balance));
    }

    private void closeAnnouncementPopup(Page page) {
        try {
            Locator closeButton = page.locator(".semi-modal-close");
            if (closeButton.count() > 0 && closeButton.first().isVisible()) {
                closeButton.first().click();
                return;
            }
            Locator textButton = page.locator("button").filter(new Locator.FilterOptions().setHasText(CLOSE_BUTTON_TEXT));
            if (textButton.count() > 0) {
                textButton.first().click();
            }
        } catch (PlaywrightException ex) {
            log.debug("close announcement popup failed, error={}", ex.getMessage());
        }
    }

    private void switchToEmailLogin(Page page) {
        Locator mailButton = page.locator("button[type='button'] span.semi-icon-mail");
        if (mailButton.count() > 0) {
            mailButton.first().click();
            page.waitForTimeout(1500);
        }
    }

    private void submitLogin(Page page, Account account) {
        Locator username = page.locator("[name='username']").first();
        username.waitFor(new Locator.WaitForOptions().setTimeout(5000));
        username.fill(account.getUsername());
        Locator password = page.locator("[name='password']").first();
        password.waitFor(new Locator.WaitForOptions().setTimeout(5000));
        password.fill(account.getPassword());
        page.locator("button[type='submit']").first().click();
        page.waitForTimeout(2000);
    }

    private Optional<String> readLoginError(Page page) {
        for (String selector : LOGIN_ERROR_SELECTORS) {
            try {
                Locator locator = page.locator(selector);
                if (locator.count() == 0) {
                    continue;
                }
                String text = locator.first().innerText().trim();
                if (!text.isEmpty()) {
                    return Optional.of(text);
                }
            } catch (PlaywrightException ex) {
                log.debug("read login error failed, selector={}, error={}", selector, ex.getMessage());
            }
        }
        return Optional.empty();
    }

    private String waitForBalance(Page page) {
        long skeletonDeadline = System.currentTimeMillis() + SKELETON_WAIT_MS;
        while (System.currentTimeMillis() < skeletonDeadline && page.locator(".semi-skeleton").count() > 0) {
            page.waitForTimeout(300);
        }
        page.waitForTimeout(1000);

        int timeoutSeconds = browserProperties.resolveBalanceTimeoutSeconds();
        long deadline = System.currentTimeMillis() + timeoutSeconds * 1000L;
        while (true) {
            Optional<String> balance = pageBalanceExtractor.extract(page.content());
            if (balance.isPresent()) {
                return balance.get();
            }
            if (System.currentTimeMillis() >= deadline) {
                throw new IllegalStateException("balance not found within " + timeoutSeconds + "s, url=" + page.url());
            }
            page.waitForTimeout(500);
        }
    }

    private Browser.NewContextOptions buildContextOptions() {
        int[] viewport = browserProperties.resolveViewport();
        Browser.NewContextOptions options = new Browser.NewContextOptions()
            .setViewportSize(viewport[0], viewport[1])
            .setJavaScriptEnabled(!browserProperties.isDisableJavascript());
        if (browserProperties.getUserAgent() != null && !browserProperties.getUserAgent().isBlank()) {
            options.setUserAgent(browserProperties.getUserAgent());
        }
        return options;
    }

    private void closeQuietly(AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception ex) {
            log.debug("close browser resource failed, error={}", ex.getMessage());
        }
    }

}
