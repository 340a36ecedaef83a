package fun.fengwk.bmh.core.service.state;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Maps wall-clock time to the cycle day used for the daily web login policy.
 *
 * <p>A cycle day starts at the rollover hour, so 07:59 with rollover 8 still belongs to yesterday.
 *
 * @author fengwk
 */
public final class CycleDayPolicy {

    public static final int DEFAULT_ROLLOVER_HOUR = 8;

    private CycleDayPolicy() {
    }

    public static LocalDate currentCycleDay(LocalDateTime now, int rolloverHour) {
        int hour = normalizeRolloverHour(rolloverHour);
        LocalDate today = now.toLocalDate();
        return now.getHour() < hour ? today.minusDays(1) : today;
    }

    public static int normalizeRolloverHour(int rolloverHour) {
        if (rolloverHour < 0 || rolloverHour > 23) {
            return DEFAULT_ROLLOVER_HOUR;
        }
        return rolloverHour;
    }

}
