package fun.fengwk.bmh.core.service.monitor;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of one account in a batch.
 *
 * @author fengwk
 */
@Data
@Builder
public class CheckResult {

    /**
     * Pseudo account of batch-level failures.
     */
    public static final String SYSTEM_USERNAME = "SYSTEM";

    public static final String ERROR_BALANCE_TEXT = "error";

    private String username;

    private boolean success;

    /**
     * Display balance such as {@code $42.5}, or a short error marker.
     */
    private String balanceText;

    /**
     * Strategy that produced the result, e.g. {@code web_hook}, {@code cache} or a fast path tag.
     */
    private String source;

    private String message;

    public static CheckResult success(String username, String balanceText, String source, String message) {
        return CheckResult.builder()
            .username(username)
            .success(true)
            .balanceText(balanceText)
            .source(source)
            .message(message)
            .build();
    }

    public static CheckResult failure(String username, String source, String message) {
        return CheckResult.builder()
            .username(username)
            .success(false)
            .balanceText(ERROR_BALANCE_TEXT)
            .source(source)
            .message(message)
            .build();
    }

}
