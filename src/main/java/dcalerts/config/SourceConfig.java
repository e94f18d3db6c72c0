package dcalerts.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

/**
 * 单个告警后端（Grafana）的连接配置
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceConfig {
    private String name;
    private String baseUrl;
    private String token;
    private String user;
    private String password;

    public boolean hasCredentials() {
        return StringUtils.isNotEmpty(token) || StringUtils.isNotEmpty(user);
    }
}
