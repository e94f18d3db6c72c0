package dcalerts.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SilenceMatcher {
    private String name;
    private String value;
    @JsonProperty("isRegex")
    private boolean regex;
}
