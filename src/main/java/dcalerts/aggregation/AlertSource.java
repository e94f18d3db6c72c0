package dcalerts.aggregation;

import java.util.List;
import java.util.Map;

/**
 * 告警后端。实现负责地址、认证和协议细节
 */
public interface AlertSource {
    String getName();

    String getBaseUrl();

    /**
     * 是否配置了 token 或用户名
     */
    boolean hasCredentials();

    /**
     * @throws SourceFetchException 后端不可达或返回错误
     */
    List<RawAlert> fetchAlerts();

    /**
     * @throws SourceFetchException 后端不可达或返回错误
     */
    List<Silence> fetchSilences();

    /**
     * 创建静默，返回后端响应
     */
    Map<String, Object> createSilence(Map<String, Object> body);

    void deleteSilence(String silenceId);
}
