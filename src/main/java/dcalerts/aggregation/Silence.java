package dcalerts.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 静默规则，按 id 查找后挂到告警上用于展示
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Silence {
    private String id;
    private String createdBy;
    private String comment;
    private Instant startsAt;
    private Instant endsAt;
    @Builder.Default
    private List<SilenceMatcher> matchers = new ArrayList<>();
    @JsonProperty("status")
    private String state;                   // active / pending / expired
    @JsonProperty("sourceGrafana")
    private String source;
    @JsonProperty("sourceBaseURL")
    private String baseUrl;
}
