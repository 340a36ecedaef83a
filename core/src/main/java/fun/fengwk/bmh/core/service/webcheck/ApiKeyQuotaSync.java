package fun.fengwk.bmh.core.service.webcheck;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import fun.fengwk.bmh.core.service.browser.BrowserProperties;
import fun.fengwk.bmh.core.utils.BalanceNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sets the quota of the first api key to the balance read by the web login.
 *
 * <p>Runs on the logged-in page: open the api key list, open the first key's editor, detect the quota units per
 * dollar from the editor, write {@code balance x rate} and submit. Failures never fail the web check, they are
 * only reported in the returned message.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyQuotaSync {

    static final double DEFAULT_QUOTA_PER_DOLLAR = 500000D;
    static final double MIN_QUOTA_PER_DOLLAR = 1000D;
    static final double MAX_QUOTA_PER_DOLLAR = 10000000D;

    private static final String TOKEN_MENU_TEXT = "API令牌";
    private static final String QUOTA_LABEL_TEXT = "额度";
    private static final String EDIT_BUTTON_TEXT = "编辑";
    private static final String SUBMIT_BUTTON_TEXT = "提交";
    private static final String EMPTY_LIST_TEXT = "暂无数据";
    private static final String EDITOR_SELECTOR =
        ".semi-modal-content, .semi-sidesheet, .semi-sidesheet-content, [role=dialog]";
    private static final String TOKEN_ROW_SELECTOR = ".semi-table-tbody .semi-table-row, table tbody tr";

    private static final Pattern EQUIVALENT_AMOUNT = Pattern.compile("等价金额[:：]\\s*\\$\\s*(-?[\\d,.]+)");

    private static final long TOKEN_PAGE_WAIT_MS = 8000;
    private static final long EDITOR_WAIT_MS = 2000;
    private static final long SUBMIT_WAIT_MS = 5000;

    private final BrowserProperties browserProperties;

    public ApiKeySyncResult sync(Page page, double balance) {
        try {
            openTokenPage(page);
            Locator editor = openFirstTokenEditor(page);
            Locator quotaInput = locateQuotaInput(editor);
            double rate = detectRate(
                BalanceNumbers.parseFirstNumber(quotaInput.inputValue()),
                parseEquivalentAmount(editor.innerText())
            );
            long quota = targetQuota(balance, rate);
            writeQuota(quotaInput, quota);
            submit(page, editor);
            String message = String.format(Locale.ROOT,
                "first api key quota synced: balance=$%.2f, quota=%d, rate=%.2f", balance, quota, rate);
            log.info(message);
            return ApiKeySyncResult.ok(message);
        } catch (PlaywrightException | IllegalStateException ex) {
            log.warn("sync first api key quota failed, error={}", ex.getMessage());
            return ApiKeySyncResult.fail("quota sync failed: " + ex.getMessage());
        }
    }

    /**
     * Quota units per dollar from the editor's quota and equivalent amount, the default rate when either is missing
     * or the ratio is implausible.
     */
    static double detectRate(Double quotaValue, Double amountValue) {
        if (quotaValue == null || amountValue == null || Math.abs(amountValue) < 1e-9) {
            return DEFAULT_QUOTA_PER_DOLLAR;
        }
        double rate = Math.abs(quotaValue / amountValue);
        if (rate < MIN_QUOTA_PER_DOLLAR || rate > MAX_QUOTA_PER_DOLLAR) {
            return DEFAULT_QUOTA_PER_DOLLAR;
        }
        return rate;
    }

    static long targetQuota(double balance, double rate) {
        return Math.max(0L, Math.round(balance * rate));
    }

    static Double parseEquivalentAmount(String editorText) {
        if (editorText == null) {
            return null;
        }
        Matcher matcher = EQUIVALENT_AMOUNT.matcher(editorText);
        return matcher.find() ? BalanceNumbers.parseFirstNumber(matcher.group(1)) : null;
    }

    private void openTokenPage(Page page) {
        Locator menu = page.getByText(TOKEN_MENU_TEXT, new Page.GetByTextOptions().setExact(true));
        if (menu.count() > 0 && menu.first().isVisible()) {
            menu.first().click();
        } else {
            log.debug("api key menu not found, navigate to token page directly");
            page.navigate(browserProperties.resolveTokenUrl());
        }

        long deadline = System.currentTimeMillis() + TOKEN_PAGE_WAIT_MS;
        while (!page.url().contains("/token")) {
            if (System.currentTimeMillis() >= deadline) {
                throw new IllegalStateException("api key page not loaded, url=" + page.url());
            }
            page.waitForTimeout(200);
        }
    }

    private Locator openFirstTokenEditor(Page page) {
        Locator rows = page.locator(TOKEN_ROW_SELECTOR);
        if (!waitForRows(page, rows)) {
            log.debug("no api key row found, reload token page once");
            page.reload();
            if (!waitForRows(page, rows)) {
                if (page.getByText(EMPTY_LIST_TEXT).count() > 0) {
                    throw new IllegalStateException("api key list is empty, nothing to sync");
                }
                throw new IllegalStateException("no editable api key found");
            }
        }

        Locator editButton = rows.first().locator("button, [role=button]")
            .filter(new Locator.FilterOptions().setHasText(EDIT_BUTTON_TEXT));
        if (editButton.count() == 0) {
            throw new IllegalStateException("edit button not found in the first api key row");
        }
        editButton.first().click();

        Locator editor = page.locator(EDITOR_SELECTOR)
            .filter(new Locator.FilterOptions().setHasText(QUOTA_LABEL_TEXT))
            .first();
        try {
            editor.waitFor(new Locator.WaitForOptions().setTimeout(EDITOR_WAIT_MS));
        } catch (PlaywrightException ex) {
            throw new IllegalStateException("api key editor did not open", ex);
        }
        return editor;
    }

    private boolean waitForRows(Page page, Locator rows) {
        long deadline = System.currentTimeMillis() + TOKEN_PAGE_WAIT_MS;
        while (rows.count() == 0) {
            if (System.currentTimeMillis() >= deadline) {
                return false;
            }
            page.waitForTimeout(300);
        }
        return true;
    }

    private Locator locateQuotaInput(Locator editor) {
        Locator input = editor.locator(
            "xpath=.//*[normalize-space(text())='" + QUOTA_LABEL_TEXT + "']/following::input[not(@type='hidden')][1]");
        if (input.count() == 0) {
            throw new IllegalStateException("quota input not found");
        }
        return input.first();
    }

    private void writeQuota(Locator quotaInput, long quota) {
        String target = Long.toString(quota);
        quotaInput.fill(target);
        String written = quotaInput.inputValue().replace(",", "").trim();
        if (!target.equals(written)) {
            throw new IllegalStateException("quota input rejected value " + target + ", current=" + written);
        }
    }

    private void submit(Page page, Locator editor) {
        Locator submitButton = editor.locator("button, [role=button]")
            .filter(new Locator.FilterOptions().setHasText(SUBMIT_BUTTON_TEXT));
        if (submitButton.count() == 0) {
            throw new IllegalStateException("submit button not found");
        }
        submitButton.first().click();

        long deadline = System.currentTimeMillis() + SUBMIT_WAIT_MS;
        while (editor.isVisible()) {
            if (System.currentTimeMillis() >= deadline) {
                throw new IllegalStateException("quota submit not confirmed");
            }
            page.waitForTimeout(200);
        }
    }

}
