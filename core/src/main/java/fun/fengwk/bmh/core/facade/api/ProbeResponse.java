package fun.fengwk.bmh.core.facade.api;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Raw response of one probed path.
 *
 * @author fengwk
 */
@Data
@Builder
public class ProbeResponse {

    private String path;
    private int statusCode;
    private Map<String, List<String>> headers;
    private String body;

    /**
     * First value of a header, matched case-insensitively.
     */
    public String header(String name) {
        if (headers == null) {
            return null;
        }
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)
                && entry.getValue() != null && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }

}
