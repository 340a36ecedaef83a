package fun.fengwk.bmh.core.facade.api;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Fast api probe configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "bmh.api")
public class ApiProperties {

    /**
     * Service base url.
     */
    private String baseUrl = "https://anyrouter.top";

    /**
     * Request timeout in seconds.
     */
    private int timeoutSeconds = 8;

    /**
     * Fall back to web login when the api probe fails, otherwise serve the cached balance.
     */
    private boolean fallbackToWeb = true;

}
