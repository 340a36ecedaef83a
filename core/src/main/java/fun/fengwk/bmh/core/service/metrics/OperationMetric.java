package fun.fengwk.bmh.core.service.metrics;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * One finished operation.
 *
 * @author fengwk
 */
@Data
@Builder
public class OperationMetric {

    private String operation;
    private Instant startedAt;
    private double durationSeconds;
    private boolean success;
    private String error;
    private Map<String, String> tags;

}
