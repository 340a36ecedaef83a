package fun.fengwk.bmh.core.facade.api.extractor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.bmh.core.facade.api.ProbeResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Balance found in a JSON response body.
 *
 * <p>Lookup order: top-level {@code total_available}, top-level {@code balance}, then a depth-limited
 * scan preferring dollar-like field names over quota-like ones.
 *
 * @author fengwk
 */
@Slf4j
public class JsonBodyBalanceExtractor implements BalanceExtractor {

    private static final int MAX_SCAN_DEPTH = 5;

    private static final List<String> DOLLAR_FIELD_PATTERNS = List.of(
        "balance",
        "remaining_balance",
        "available_balance",
        "current_balance",
        "credit_balance",
        "total_available",
        "available_credit",
        "remain_amount"
    );

    private static final List<String> QUOTA_FIELD_PATTERNS = List.of(
        "quota",
        "remaining_quota",
        "remain_quota",
        "left_quota",
        "available_quota"
    );

    private final ObjectMapper objectMapper;

    public JsonBodyBalanceExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "body";
    }

    @Override
    public String describe() {
        return "balance read from response body";
    }

    @Override
    public Double extract(ProbeResponse response) {
        if (response.getBody() == null || response.getBody().isBlank()) {
            return null;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response.getBody());
        } catch (Exception ex) {
            log.debug("response body is not json, path={}", response.getPath());
            return null;
        }
        if (root == null) {
            return null;
        }

        Double totalAvailable = toDouble(root.get("total_available"));
        if (totalAvailable != null) {
            return Math.max(0D, totalAvailable);
        }
        Double balance = toDouble(root.get("balance"));
        if (balance != null) {
            return Math.max(0D, QuotaUnits.normalize(balance, "balance"));
        }
        Double scanned = scan(root, 0);
        return scanned == null ? null : Math.max(0D, scanned);
    }

    private Double scan(JsonNode node, int depth) {
        if (depth > MAX_SCAN_DEPTH) {
            return null;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                Double found = scan(item, depth + 1);
                if (found != null) {
                    return found;
                }
            }
            return null;
        }
        if (!node.isObject()) {
            return null;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey().toLowerCase(Locale.ROOT);
            if (matchesAny(key, DOLLAR_FIELD_PATTERNS)) {
                Double value = toDouble(field.getValue());
                if (value != null) {
                    return QuotaUnits.normalize(value, key);
                }
            }
        }

        fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey().toLowerCase(Locale.ROOT);
            if (matchesAny(key, QUOTA_FIELD_PATTERNS)) {
                Double value = toDouble(field.getValue());
                if (value != null) {
                    return value / QuotaUnits.QUOTA_PER_DOLLAR;
                }
            }
        }

        for (JsonNode child : node) {
            Double found = scan(child, depth + 1);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private boolean matchesAny(String key, List<String> patterns) {
        for (String pattern : patterns) {
            if (key.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    static Double toDouble(JsonNode node) {
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

}
