package dcalerts.grafana;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import dcalerts.aggregation.AlertSource;
import dcalerts.aggregation.RawAlert;
import dcalerts.aggregation.Silence;
import dcalerts.aggregation.SourceFetchException;
import dcalerts.config.SourceConfig;
import dcalerts.utils.HttpUtils;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.HttpUrl;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Grafana 内置 Alertmanager 数据源
 *
 * <p>每次调用依次尝试 {@code /api/alertmanager/grafana} 和 {@code /api/alertmanager} 两个前缀，
 * 第一个返回 200 且响应体是合法 JSON 的地址即为结果。</p>
 */
@Slf4j
public class GrafanaAlertSource implements AlertSource {
    private static final String[] PATH_PREFIXES = {"/api/alertmanager/grafana", "/api/alertmanager"};

    private final SourceConfig config;
    private final HttpUtils httpUtils;

    public GrafanaAlertSource(SourceConfig config, HttpUtils httpUtils) {
        this.config = config;
        this.httpUtils = httpUtils;
    }

    @Override
    public String getName() {
        return config.getName();
    }

    @Override
    public String getBaseUrl() {
        return config.getBaseUrl();
    }

    @Override
    public boolean hasCredentials() {
        return config.hasCredentials();
    }

    @Override
    public List<RawAlert> fetchAlerts() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("active", "true");
        params.put("inhibited", "false");
        params.put("silenced", "true");
        return GrafanaRecordParser.parseAlerts(amGet("/api/v2/alerts", params));
    }

    @Override
    public List<Silence> fetchSilences() {
        return GrafanaRecordParser.parseSilences(amGet("/api/v2/silences", Map.of()));
    }

    @Override
    public Map<String, Object> createSilence(Map<String, Object> body) {
        String response = amPost("/api/v2/silences", JSON.toJSONString(body));
        if (StringUtils.isBlank(response)) {
            return new HashMap<>();
        }
        Object parsed = JSON.parse(response);
        return parsed instanceof JSONObject ? (JSONObject) parsed : new HashMap<>();
    }

    @Override
    public void deleteSilence(String silenceId) {
        amDelete("/api/v2/silence/" + silenceId);
    }

    /**
     * @return 解析后的 JSON，响应体为空时为 null
     */
    private Object amGet(String path, Map<String, String> params) {
        String lastError = null;
        for (HttpUrl url : amUrls(path)) {
            HttpUrl.Builder withParams = url.newBuilder();
            params.forEach(withParams::addQueryParameter);
            try {
                HttpUtils.HttpResult result = httpUtils.get(withParams.build(), authHeaders());
                if (result.getCode() != 200) {
                    lastError = "HTTP " + result.getCode() + " from " + url;
                    continue;
                }
                if (StringUtils.isBlank(result.getBody())) {
                    return null;
                }
                return JSON.parse(result.getBody());
            } catch (JSONException e) {
                log.warn("响应不是合法JSON: {}", url);
                lastError = "invalid JSON from " + url;
            } catch (IOException e) {
                lastError = e.toString();
            }
        }
        throw new SourceFetchException("GET failed for " + getName() + " " + path + ": "
                + StringUtils.defaultString(lastError, "unknown"));
    }

    private String amPost(String path, String jsonBody) {
        String lastError = null;
        for (HttpUrl url : amUrls(path)) {
            try {
                HttpUtils.HttpResult result = httpUtils.post(url, authHeaders(), jsonBody);
                if (result.isSuccessful()) {
                    return result.getBody();
                }
                lastError = "HTTP " + result.getCode() + " from " + url;
            } catch (IOException e) {
                lastError = e.toString();
            }
        }
        throw new SourceFetchException("POST failed for " + getName() + " " + path + ": "
                + StringUtils.defaultString(lastError, "unknown"));
    }

    private void amDelete(String path) {
        String lastError = null;
        for (HttpUrl url : amUrls(path)) {
            try {
                HttpUtils.HttpResult result = httpUtils.delete(url, authHeaders());
                if (result.isSuccessful()) {
                    return;
                }
                lastError = "HTTP " + result.getCode() + " from " + url;
            } catch (IOException e) {
                lastError = e.toString();
            }
        }
        throw new SourceFetchException("DELETE failed for " + getName() + " " + path + ": "
                + StringUtils.defaultString(lastError, "unknown"));
    }

    /**
     * 两个候选地址，按顺序尝试。以 / 开头的路径会替换 base_url 中原有的路径
     */
    List<HttpUrl> amUrls(String path) {
        HttpUrl base = HttpUrl.parse(config.getBaseUrl());
        if (base == null) {
            throw new SourceFetchException("无效的 base_url: " + config.getBaseUrl());
        }
        List<HttpUrl> urls = new ArrayList<>(PATH_PREFIXES.length);
        for (String prefix : PATH_PREFIXES) {
            HttpUrl resolved = base.resolve(prefix + path);
            if (resolved != null) {
                urls.add(resolved);
            }
        }
        return urls;
    }

    private Map<String, String> authHeaders() {
        Map<String, String> headers = new HashMap<>();
        if (StringUtils.isNotEmpty(config.getToken())) {
            headers.put("Authorization", "Bearer " + config.getToken());
        } else if (StringUtils.isNotEmpty(config.getUser())) {
            headers.put("Authorization", Credentials.basic(config.getUser(), StringUtils.defaultString(config.getPassword())));
        }
        return headers;
    }
}
