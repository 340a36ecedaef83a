package fun.fengwk.bmh.core.service.webcheck;

import lombok.Value;

/**
 * Outcome of copying the balance into the first api key quota.
 *
 * @author fengwk
 */
@Value
public class ApiKeySyncResult {

    boolean success;
    String message;

    public static ApiKeySyncResult ok(String message) {
        return new ApiKeySyncResult(true, message);
    }

    public static ApiKeySyncResult fail(String message) {
        return new ApiKeySyncResult(false, message);
    }

}
