package dcalerts.report;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 单条告警在窗口内的有效持续时间
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertDurationDetail {
    private String alertname;
    private String source;
    private String fingerprint;
    private List<String> statuses;
    @JsonProperty("start_utc")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant startUtc;
    @JsonProperty("end_utc")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant endUtc;
    @JsonProperty("duration_seconds")
    private long durationSeconds;
    private Map<String, String> labels;
    private Map<String, String> annotations;
}
