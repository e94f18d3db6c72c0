package dcalerts.report;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WindowReport {
    private String period;
    @JsonProperty("start_utc")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant startUtc;
    @JsonProperty("end_utc")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant endUtc;
    private List<SiteSummary> summary;
    private Map<String, List<AlertDurationDetail>> details;
}
