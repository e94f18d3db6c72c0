package dcalerts.aggregation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 单次轮询中从某个数据源拿到的原始告警，只在一个刷新周期内存在
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawAlert {
    private String status;                  // firing / active / suppressed / 其他
    @Builder.Default
    private Map<String, String> labels = new HashMap<>();
    @Builder.Default
    private Map<String, String> annotations = new HashMap<>();
    private Instant startsAt;
    private Instant endsAt;                 // 可能为空
    private String fingerprint;             // 数据源提供的指纹，可能为空
    private String generatorUrl;
    @Builder.Default
    private List<String> silencedBy = new ArrayList<>();

    // 来源标记
    private String source;
    private String baseUrl;
}
