package dcalerts.aggregation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 合并后的告警：每个站点内每个告警标识只保留一条。发布后同一周期内不再修改
 */
@Value
@Builder
public class NormalizedAlert {
    private String identity;
    private String alertname;
    private String status;
    private Map<String, String> labels;
    private Map<String, String> annotations;
    private Instant startsAt;
    private Instant endsAt;
    private String fingerprint;
    @JsonProperty("generatorURL")
    private String generatorUrl;
    @JsonProperty("sourceGrafana")
    private String source;
    @JsonProperty("sourceBaseURL")
    private String baseUrl;
    private List<String> silencedBy;
    private List<Silence> silences;

    @JsonIgnore
    public boolean isSuppressed() {
        return silences != null && !silences.isEmpty();
    }
}
