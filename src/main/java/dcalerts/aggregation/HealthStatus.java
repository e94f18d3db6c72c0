package dcalerts.aggregation;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 健康检查状态
 */
@Data
public class HealthStatus {
    @JsonProperty("generated_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant generatedAt;
    @JsonProperty("last_error")
    private String lastError;
    private List<SourceStatus> sources;
    private Map<String, Integer> counts;

    public static HealthStatus from(AlertView view) {
        HealthStatus health = new HealthStatus();
        health.setGeneratedAt(view.getGeneratedAt());
        health.setLastError(view.getLastError());
        health.setSources(view.getSources());
        health.setCounts(view.counts());
        return health;
    }
}
