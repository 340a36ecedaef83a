package fun.fengwk.bmh.core.facade.api.extractor;

/**
 * @author fengwk
 */
final class QuotaUnits {

    /**
     * Internal quota units per dollar.
     */
    static final double QUOTA_PER_DOLLAR = 500000D;

    /**
     * Values above this are assumed to be quota units even without a quota key.
     */
    static final double RAW_QUOTA_THRESHOLD = 100000D;

    private QuotaUnits() {
    }

    static double normalize(double value, String keyHint) {
        if (keyHint != null && keyHint.contains("quota")) {
            return value / QUOTA_PER_DOLLAR;
        }
        if (Math.abs(value) > RAW_QUOTA_THRESHOLD) {
            return value / QUOTA_PER_DOLLAR;
        }
        return value;
    }

}
