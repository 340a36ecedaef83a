package fun.fengwk.bmh.core.service.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Last known balance of an account, persisted in the balance cache file.
 *
 * @author fengwk
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BalanceRecord {

    /**
     * Formatted balance text, e.g. {@code $42.5}.
     */
    @JsonProperty("balance")
    private String balance;

    /**
     * RFC3339 time of the last update.
     */
    @JsonProperty("updated_at")
    private String updatedAt;

    /**
     * Outcome of the optional api key quota sync, absent when never attempted.
     */
    @JsonProperty("apikey_sync_success")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Boolean apikeySyncSuccess;

    @JsonProperty("apikey_sync_message")
    @Builder.Default
    private String apikeySyncMessage = "";

}
