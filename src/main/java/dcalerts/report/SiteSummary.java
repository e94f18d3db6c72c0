package dcalerts.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单站点在窗口内的去重计数
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SiteSummary {
    @JsonProperty("dc")
    private String site;
    private int fired;          // 至少一次 active/firing 的告警数
    private int suppressed;     // 至少一次 suppressed 的告警数
    private int samples;        // 原始快照行数
}
