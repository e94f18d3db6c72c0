package dcalerts.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个数据源在一个周期内的拉取结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceStatus {
    private String name;
    @JsonProperty("base_url")
    private String baseUrl;
    private boolean ok;
    private String error;
    private int alerts;
    private int silences;
}
