package fun.fengwk.bmh.core.service.browser;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Web login check configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "bmh.web-check")
public class WebCheckProperties {

    /**
     * Use the external hook command instead of the pooled browser.
     */
    private boolean enabled = false;

    /**
     * Hook command executable.
     */
    private String command = "";

    /**
     * Hook command args, {@code {username}}, {@code {password}} and {@code {api_key}} are substituted.
     */
    private List<String> args = new ArrayList<>();

    /**
     * Overall timeout of one web check in seconds.
     */
    private int timeoutSeconds = 90;

    /**
     * Workers started when the pool is created.
     */
    private int poolSize = 4;

    /**
     * Max live worker processes.
     */
    private int maxPoolSize = 9;

    /**
     * Max wait for a free worker.
     */
    private long leaseTimeoutMs = 20000;

    private long leasePollIntervalMs = 120;

    /**
     * Max wait for a new worker to accept control connections.
     */
    private long portReadyTimeoutMs = 8000;

    /**
     * Connect timeout of the liveness probe.
     */
    private int probeTimeoutMs = 300;

    public boolean isCommandHookEnabled() {
        return enabled && command != null && !command.isBlank();
    }

}
