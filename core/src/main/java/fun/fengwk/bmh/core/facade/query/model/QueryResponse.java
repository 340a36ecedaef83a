package fun.fengwk.bmh.core.facade.query.model;

import fun.fengwk.bmh.core.service.monitor.CheckResult;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of one query batch.
 *
 * @author fengwk
 */
@Data
@Builder
public class QueryResponse {

    /**
     * Per-account results sorted by username.
     */
    private List<CheckResult> results;

    private double elapsedSecs;

    /**
     * Local time the batch finished, {@code yyyy-MM-dd HH:mm:ss}.
     */
    private String finishedAt;

    private int successCount;

    private int failCount;

    /**
     * Sum of the balances parsed from successful results.
     */
    private double totalBalance;

    /**
     * Number of successful results that contributed to {@link #totalBalance}.
     */
    private int totalBalanceCount;

}
