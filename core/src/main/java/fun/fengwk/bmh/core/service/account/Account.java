package fun.fengwk.bmh.core.service.account;

import lombok.Builder;
import lombok.Value;

/**
 * Monitored account.
 *
 * @author fengwk
 */
@Value
@Builder
public class Account {

    /**
     * Unique, case-sensitive account identifier.
     */
    String username;

    String password;

    /**
     * Optional token enabling the fast api probe.
     */
    String apiKey;

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        return "Account(username=" + username + ", hasApiKey=" + hasApiKey() + ")";
    }

}
