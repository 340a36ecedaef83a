package fun.fengwk.bmh.core.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Batch execution configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "bmh.performance")
public class PerformanceProperties {

    /**
     * Max account pipelines running at the same time.
     */
    private int maxWorkers = 9;

    /**
     * Period of watch mode batches in minutes.
     */
    private int queryIntervalMinutes = 60;

    /**
     * Attempts of the web login flow per slow check.
     */
    private int retryTimes = 2;

    /**
     * Delay between web login attempts in seconds.
     */
    private int retryDelaySeconds = 3;

    /**
     * Local hour at which a new cycle day starts, values outside 0..23 fall back to 8.
     */
    private int dailyRolloverHour = 8;

}
