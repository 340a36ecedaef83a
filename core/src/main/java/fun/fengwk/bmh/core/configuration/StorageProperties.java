package fun.fengwk.bmh.core.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Local storage layout.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "bmh.storage")
public class StorageProperties {

    /**
     * Directory holding credentials and state files.
     */
    private String configDir = System.getProperty("user.home") + "/.balance-monitor-hub";

    /**
     * Account credentials file name.
     */
    private String credentialsFile = "credentials.txt";

    /**
     * Balance cache file name.
     */
    private String balanceCacheFile = "balance_cache.json";

    /**
     * Cycle marker file name.
     */
    private String cycleStateFile = "daily_web_login_state.json";

    public Path resolveConfigDir() {
        return Paths.get(configDir).toAbsolutePath().normalize();
    }

    public Path resolveCredentialsFile() {
        return resolveConfigDir().resolve(credentialsFile);
    }

    public Path resolveBalanceCacheFile() {
        return resolveConfigDir().resolve(balanceCacheFile);
    }

    public Path resolveCycleStateFile() {
        return resolveConfigDir().resolve(cycleStateFile);
    }

}
