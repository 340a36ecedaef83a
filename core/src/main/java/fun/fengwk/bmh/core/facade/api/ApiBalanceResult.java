package fun.fengwk.bmh.core.facade.api;

import lombok.Builder;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@Builder
public class ApiBalanceResult {

    private boolean success;

    /**
     * Balance in dollars, {@code null} on failure.
     */
    private Double balance;

    /**
     * Where the balance was read, e.g. {@code billing:subscription+usage} or {@code body:/api/user/self}.
     */
    private String source;

    private String message;

    public static ApiBalanceResult ok(double balance, String source, String message) {
        return ApiBalanceResult.builder()
            .success(true)
            .balance(balance)
            .source(source)
            .message(message)
            .build();
    }

    public static ApiBalanceResult fail(String message) {
        return ApiBalanceResult.builder()
            .success(false)
            .source("api")
            .message(message)
            .build();
    }

}
