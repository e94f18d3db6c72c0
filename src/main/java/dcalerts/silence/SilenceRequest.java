package dcalerts.silence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dcalerts.aggregation.SilenceMatcher;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 创建/更新静默的请求。grafana 可以是数据源名称或 base_url
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SilenceRequest {
    private String grafana;
    private String id;                  // 非空时先删除旧静默
    @Builder.Default
    private List<SilenceMatcher> matchers = new ArrayList<>();
    private String startsAt;
    private String endsAt;
    private String comment;
    private String createdBy;
}
