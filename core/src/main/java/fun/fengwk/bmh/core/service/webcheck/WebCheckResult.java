package fun.fengwk.bmh.core.service.webcheck;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of one slow (web login) check.
 *
 * @author fengwk
 */
@Data
@Builder
public class WebCheckResult {

    private boolean success;

    /**
     * Balance in dollars, may be {@code null} even on success.
     */
    private Double balance;

    private String message;

    /**
     * Whether the first api key quota was synced, {@code null} when no sync ran.
     */
    private Boolean apikeySyncSuccess;

    private String apikeySyncMessage;

    public static WebCheckResult ok(Double balance, String message) {
        return WebCheckResult.builder()
            .success(true)
            .balance(balance)
            .message(message)
            .build();
    }

    /**
     * Success carrying the api key sync outcome, the sync message becomes the result message.
     */
    public static WebCheckResult synced(double balance, ApiKeySyncResult sync) {
        return WebCheckResult.builder()
            .success(true)
            .balance(balance)
            .message(sync.getMessage())
            .apikeySyncSuccess(sync.isSuccess())
            .apikeySyncMessage(sync.getMessage())
            .build();
    }

    public static WebCheckResult fail(String message) {
        return WebCheckResult.builder()
            .success(false)
            .message(message)
            .build();
    }

}
