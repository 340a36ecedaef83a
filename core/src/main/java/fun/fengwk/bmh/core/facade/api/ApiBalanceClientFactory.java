package fun.fengwk.bmh.core.facade.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.bmh.core.configuration.HttpClientProxyProperties;
import fun.fengwk.bmh.core.facade.api.extractor.BalanceExtractor;
import fun.fengwk.bmh.core.facade.api.extractor.HeaderBalanceExtractor;
import fun.fengwk.bmh.core.facade.api.extractor.JsonBodyBalanceExtractor;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Hands out the fast balance client for the current api configuration.
 *
 * <p>The client and its HttpClient are built once and reused by later batches until the base url, timeout or
 * proxies change.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiBalanceClientFactory {

    private final ApiProperties apiProperties;
    private final ObjectMapper objectMapper;
    private final HttpClientProxyProperties proxyProperties;

    private CachedClient cached;

    /**
     * @throws IllegalArgumentException when the configured base url is not an absolute http(s) url or a proxy is
     *                                  malformed
     */
    public synchronized FastBalanceProbe create() {
        String baseUrl = apiProperties.getBaseUrl() == null ? "" : apiProperties.getBaseUrl().trim();
        validateBaseUrl(baseUrl);

        ClientKey key = new ClientKey(
            baseUrl,
            Math.max(1, apiProperties.getTimeoutSeconds()),
            proxyProperties.getHttpProxy(),
            proxyProperties.getHttpsProxy()
        );
        if (cached != null && cached.getKey().equals(key)) {
            return cached.getClient();
        }

        Duration timeout = Duration.ofSeconds(key.getTimeoutSeconds());
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .proxy(proxyProperties.proxySelector())
            .build();
        List<BalanceExtractor> extractors = List.of(
            new HeaderBalanceExtractor(),
            new JsonBodyBalanceExtractor(objectMapper)
        );
        ApiBalanceClient client = new ApiBalanceClient(
            baseUrl,
            timeout,
            httpClient,
            objectMapper,
            extractors,
            Clock.systemDefaultZone()
        );
        cached = new CachedClient(key, client);
        log.info("api client built, baseUrl={}, timeoutSeconds={}", baseUrl, key.getTimeoutSeconds());
        return client;
    }

    private void validateBaseUrl(String baseUrl) {
        URI uri;
        try {
            uri = URI.create(baseUrl);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("invalid api base url: " + baseUrl, ex);
        }
        if (uri.getHost() == null || !("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()))) {
            throw new IllegalArgumentException("invalid api base url: " + baseUrl);
        }
    }

    @Value
    private static class ClientKey {

        String baseUrl;
        int timeoutSeconds;
        String httpProxy;
        String httpsProxy;

    }

    @Value
    private static class CachedClient {

        ClientKey key;
        ApiBalanceClient client;

    }

}
