package fun.fengwk.bmh.core.service.browser;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Browser runtime shared configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "bmh.browser")
public class BrowserProperties {

    /**
     * Whether worker browsers run headless.
     */
    private boolean headless = true;

    /**
     * Max seconds to wait for the balance to appear on the console page.
     */
    private int timeoutSeconds = 20;

    /**
     * Navigation timeout in seconds.
     */
    private int pageLoadTimeoutSeconds = 30;

    /**
     * Viewport size as {@code width,height}.
     */
    private String windowSize = "1920,1080";

    /**
     * Optional fixed user agent, blank keeps the browser default.
     */
    private String userAgent = "";

    /**
     * Block image requests.
     */
    private boolean disableImages = true;

    private boolean disableJavascript = false;

    /**
     * Console page that shows the balance after login.
     */
    private String consoleUrl = "https://anyrouter.top/console";

    /**
     * Copy the balance into the quota of the first api key after each web login.
     */
    private boolean syncApiKeyQuota = true;

    /**
     * Api key list page, derived from {@link #consoleUrl} when blank.
     */
    private String tokenUrl = "";

    /**
     * Browser executable path, blank uses the Chromium bundled with Playwright.
     */
    private String executablePath = "";

    /**
     * Extra launch args for worker browsers.
     */
    private List<String> launchArgs = List.of();

    /**
     * Root directory for worker profile data.
     */
    private String profileRoot = System.getProperty("user.home") + "/.balance-monitor-hub/browser-data";

    public String resolveTokenUrl() {
        if (tokenUrl != null && !tokenUrl.isBlank()) {
            return tokenUrl.trim();
        }
        String base = consoleUrl == null ? "" : consoleUrl.trim();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/token";
    }

    public int resolveBalanceTimeoutSeconds() {
        return Math.max(3, timeoutSeconds);
    }

    public int[] resolveViewport() {
        String value = windowSize == null ? "" : windowSize.replace(" ", "");
        if (!value.matches("\\d{1,5},\\d{1,5}")) {
            return new int[] {1920, 1080};
        }
        String[] parts = value.split(",");
        return new int[] {Integer.parseInt(parts[0]), Integer.parseInt(parts[1])};
    }

}
