package fun.fengwk.bmh.core.service.webcheck;

import lombok.Value;

import java.time.Duration;

/**
 * Retry budget of the web login flow, each retry is a fresh attempt.
 *
 * @author fengwk
 */
@Value
public class WebCheckRetry {

    int attempts;
    Duration delay;

    public static WebCheckRetry of(int attempts, Duration delay) {
        Duration normalizedDelay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        return new WebCheckRetry(Math.max(1, attempts), normalizedDelay);
    }

}
