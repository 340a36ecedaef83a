package fun.fengwk.bmh.core.facade.api.extractor;

import fun.fengwk.bmh.core.facade.api.ProbeResponse;
import fun.fengwk.bmh.core.utils.BalanceNumbers;

import java.util.List;

/**
 * Balance announced through response headers.
 *
 * @author fengwk
 */
public class HeaderBalanceExtractor implements BalanceExtractor {

    private static final List<String> DOLLAR_HEADERS = List.of(
        "x-balance",
        "x-user-balance",
        "x-credit-balance",
        "x-remaining-balance",
        "x-total-available",
        "x-account-balance"
    );

    private static final List<String> QUOTA_HEADERS = List.of(
        "x-quota",
        "x-remaining-quota",
        "x-total-quota"
    );

    @Override
    public String name() {
        return "header";
    }

    @Override
    public String describe() {
        return "balance read from response header";
    }

    @Override
    public Double extract(ProbeResponse response) {
        for (String header : DOLLAR_HEADERS) {
            Double value = BalanceNumbers.parseFirstNumber(response.header(header));
            if (value != null) {
                return Math.max(0D, value);
            }
        }
        for (String header : QUOTA_HEADERS) {
            Double value = BalanceNumbers.parseFirstNumber(response.header(header));
            if (value != null) {
                return Math.max(0D, value / QuotaUnits.QUOTA_PER_DOLLAR);
            }
        }
        return null;
    }

}
