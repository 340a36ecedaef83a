package fun.fengwk.bmh.core.facade.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.bmh.core.facade.api.extractor.BalanceExtractor;
import fun.fengwk.bmh.core.utils.HttpClientUtils;
import fun.fengwk.bmh.core.utils.HttpSendResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Fast balance probe over the service's OpenAI-compatible billing api and its compatibility routes.
 *
 * @author fengwk
 */
@Slf4j
public class ApiBalanceClient implements FastBalanceProbe {

    static final String BILLING_SOURCE = "billing:subscription+usage";

    private static final String SUBSCRIPTION_PATH = "/v1/dashboard/billing/subscription";
    private static final String USAGE_PATH = "/v1/dashboard/billing/usage";

    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final List<BalanceExtractor> extractors;
    private final Clock clock;

    public ApiBalanceClient(
        String baseUrl,
        Duration timeout,
        HttpClient httpClient,
        ObjectMapper objectMapper,
        List<BalanceExtractor> extractors,
        Clock clock
    ) {
        this.baseUrl = normalizeBaseUrl(baseUrl);
        this.timeout = timeout;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.extractors = List.copyOf(extractors);
        this.clock = clock;
    }

    @Override
    public ApiBalanceResult queryBalance(String apiKey) {
        String key = apiKey == null ? "" : apiKey.trim();
        if (key.isEmpty()) {
            return ApiBalanceResult.fail("missing api key");
        }

        try {
            double remain = queryBillingBalance(key);
            return ApiBalanceResult.ok(remain, BILLING_SOURCE, "balance computed from billing subscription and usage");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return ApiBalanceResult.fail("interrupted while querying billing routes");
        } catch (Exception ex) {
            log.debug("billing routes failed, try compatibility routes, error={}", ex.getMessage());
        }

        String lastError = "no balance route available";
        for (String path : candidatePaths()) {
            ProbeResponse response;
            try {
                response = get(path, key);
            } catch (IOException | RuntimeException ex) {
                if (Thread.currentThread().isInterrupted()) {
                    return ApiBalanceResult.fail("interrupted while querying " + path);
                }
                lastError = "request failed (" + path + "): " + ex.getMessage();
                log.debug(lastError);
                continue;
            }

            if (response.getStatusCode() >= 400) {
                lastError = "HTTP " + response.getStatusCode() + " (" + path + ")";
                log.debug(lastError);
                continue;
            }

            for (BalanceExtractor extractor : extractors) {
                Double balance = extractor.extract(response);
                if (balance != null) {
                    return ApiBalanceResult.ok(Math.max(0D, balance), extractor.name() + ":" + path, extractor.describe());
                }
            }
            lastError = "no balance field in response (" + path + ")";
        }
        return ApiBalanceResult.fail(lastError);
    }

    /**
     * Remaining = hard limit - usage of the current month.
     */
    double queryBillingBalance(String apiKey) throws Exception {
        CompletableFuture<HttpSendResult> subscriptionFuture =
            HttpClientUtils.sendAsync(httpClient, buildRequest(SUBSCRIPTION_PATH, apiKey));
        CompletableFuture<HttpSendResult> usageFuture =
            HttpClientUtils.sendAsync(httpClient, buildRequest(usagePath(), apiKey));

        JsonNode subscriptionJson;
        JsonNode usageJson;
        try (HttpSendResult subscription = subscriptionFuture.get(); HttpSendResult usage = usageFuture.get()) {
            subscriptionJson = readBillingJson(subscription, "subscription");
            usageJson = readBillingJson(usage, "usage");
        }
        Double hardLimit = number(subscriptionJson.get("hard_limit_usd"));
        if (hardLimit == null) {
            hardLimit = number(subscriptionJson.get("soft_limit_usd"));
        }
        if (hardLimit == null) {
            throw new IllegalStateException("subscription has no hard_limit_usd/soft_limit_usd");
        }
        Double totalUsage = number(usageJson.get("total_usage"));
        if (totalUsage == null) {
            throw new IllegalStateException("usage has no total_usage");
        }

        // total_usage is reported in cents by most deployments.
        double usageUsd = hardLimit > 0 && totalUsage > hardLimit * 2 ? totalUsage / 100D : totalUsage;
        double remain = Math.max(0D, hardLimit - usageUsd);
        log.debug(
            "billing balance computed, hardLimitUsd={}, totalUsageRaw={}, usageUsd={}, remain={}",
            hardLimit,
            totalUsage,
            usageUsd,
            remain
        );
        return remain;
    }

    List<String> candidatePaths() {
        return List.of(
            usagePath(),
            "/v1/dashboard/billing/subscription",
            "/v1/dashboard/billing/credit_grants",
            "/dashboard/billing/credit_grants",
            "/api/user/balance",
            "/api/user/self",
            "/api/user/info",
            "/api/token/self",
            "/api/token/info",
            "/v1/models"
        );
    }

    private String usagePath() {
        LocalDate today = LocalDate.now(clock);
        return USAGE_PATH + "?start_date=" + today.withDayOfMonth(1) + "&end_date=" + today;
    }

    private JsonNode readBillingJson(HttpSendResult result, String name) throws IOException {
        if (result.hasError()) {
            throw new IOException(name + " request failed: " + result.getError().getMessage(), result.getError());
        }
        if (result.getStatusCode() >= 400) {
            throw new IOException(name + " returned HTTP " + result.getStatusCode());
        }
        return objectMapper.readTree(result.parseBodyString());
    }

    private ProbeResponse get(String path, String apiKey) throws IOException {
        try (HttpSendResult result = HttpClientUtils.send(httpClient, buildRequest(path, apiKey))) {
            if (result.hasError()) {
                throw new IOException(result.getError().getMessage(), result.getError());
            }
            return ProbeResponse.builder()
                .path(path)
                .statusCode(result.getStatusCode())
                .headers(result.getHeaders())
                .body(result.parseBodyString())
                .build();
        }
    }

    private HttpRequest buildRequest(String path, String apiKey) {
        return HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .timeout(timeout)
            .header("Authorization", "Bearer " + apiKey)
            .header("Accept", "application/json")
            .GET()
            .build();
    }

    private Double number(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private static String normalizeBaseUrl(String baseUrl) {
        String normalized = baseUrl == null ? "" : baseUrl.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

}
