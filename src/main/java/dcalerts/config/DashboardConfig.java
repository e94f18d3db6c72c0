package dcalerts.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import dcalerts.aggregation.SiteTable;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 看板配置 - YAML 文件，按点号路径读取
 *
 * <p>形如 {@code ${GRAFANA_TOKEN_MAIN:}} 的字符串值从环境变量解析，冒号后为默认值。</p>
 */
public class DashboardConfig {
    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private static final Pattern ENV_PLACEHOLDER = Pattern.compile("^\\$\\{([A-Za-z0-9_.]+)(?::(.*))?}$");

    public static final String DEFAULT_TIMEZONE = "Asia/Tehran";

    private final Map<String, Object> config;
    private final Function<String, String> env;

    private DashboardConfig(Map<String, Object> config, Function<String, String> env) {
        this.config = config == null ? Collections.emptyMap() : config;
        this.env = env;
    }

    /**
     * 加载配置文件
     */
    public static DashboardConfig load(String configPath) {
        return load(configPath, System::getenv);
    }

    static DashboardConfig load(String configPath, Function<String, String> env) {
        try {
            Path path = Paths.get(configPath);
            Map<String, Object> config = yamlMapper.readValue(
                    new File(path.toAbsolutePath().toString()),
                    Map.class
            );
            return new DashboardConfig(config, env);
        } catch (Exception e) {
            throw new IllegalStateException("加载配置文件失败: " + configPath, e);
        }
    }

    public String getString(String key) {
        return getString(key, null);
    }

    public String getString(String key, String defaultValue) {
        Object value = getValue(key);
        return value != null ? value.toString() : defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        Object value = getValue(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public double getDouble(String key, double defaultValue) {
        Object value = getValue(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = getValue(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String && StringUtils.isNotBlank((String) value)) {
            return Boolean.parseBoolean(((String) value).trim());
        }
        return defaultValue;
    }

    public List<String> getStringList(String key) {
        Object value = getValue(key);
        if (!(value instanceof List)) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item != null) {
                result.add(resolve(item).toString());
            }
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getSubConfig(String key) {
        Object value = getValue(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Collections.emptyMap();
    }

    /**
     * 数据源列表，顺序即配置顺序
     */
    public List<SourceConfig> getSources() {
        Object value = getValue("sources");
        List<SourceConfig> sources = new ArrayList<>();
        if (!(value instanceof List)) {
            return sources;
        }
        for (Object item : (List<?>) value) {
            if (!(item instanceof Map)) {
                continue;
            }
            Map<?, ?> entry = (Map<?, ?>) item;
            sources.add(SourceConfig.builder()
                    .name(stringOf(entry.get("name")))
                    .baseUrl(stringOf(entry.get("base_url")))
                    .token(stringOf(entry.get("token")))
                    .user(stringOf(entry.get("user")))
                    .password(stringOf(entry.get("password")))
                    .build());
        }
        return sources;
    }

    public SiteTable getSiteTable() {
        List<String> canonical = getStringList("sites.canonical");
        Map<String, List<String>> synonyms = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : getSubConfig("sites.synonyms").entrySet()) {
            List<String> words = new ArrayList<>();
            if (entry.getValue() instanceof List) {
                for (Object word : (List<?>) entry.getValue()) {
                    if (word != null) {
                        words.add(word.toString());
                    }
                }
            }
            synonyms.put(entry.getKey(), words);
        }
        return new SiteTable(canonical, synonyms);
    }

    public String getSiteLabel() {
        return getString("sites.label", "dc");
    }

    public ZoneId getReportZone() {
        return ZoneId.of(getString("report.timezone", DEFAULT_TIMEZONE));
    }

    public Duration getPollInterval() {
        return Duration.ofSeconds(getInt("poll.interval", 60));
    }

    public Duration getRequestTimeout() {
        return Duration.ofSeconds(getInt("http.timeout", 120));
    }

    public boolean isVerifyTls() {
        return getBoolean("http.verify_tls", false);
    }

    public int getFetchRetries() {
        return getInt("fetch.retries", 3);
    }

    public Duration getFetchRetryDelay() {
        return Duration.ofMillis((long) (getDouble("fetch.retry_delay", 5) * 1000));
    }

    public int getFetchParallelism() {
        return getInt("fetch.parallelism", 4);
    }

    public String getStorageType() {
        return getString("storage.type", "local");
    }

    /**
     * 获取配置值
     */
    @SuppressWarnings("unchecked")
    private Object getValue(String key) {
        if (StringUtils.isEmpty(key)) {
            return null;
        }

        String[] parts = key.split("\\.");
        Map<String, Object> current = config;

        for (int i = 0; i < parts.length - 1; i++) {
            Object value = current.get(parts[i]);
            if (!(value instanceof Map)) {
                return null;
            }
            current = (Map<String, Object>) value;
        }

        return resolve(current.get(parts[parts.length - 1]));
    }

    private Object resolve(Object value) {
        if (!(value instanceof String)) {
            return value;
        }
        Matcher matcher = ENV_PLACEHOLDER.matcher((String) value);
        if (!matcher.matches()) {
            return value;
        }
        String fromEnv = env.apply(matcher.group(1));
        if (fromEnv != null) {
            return fromEnv;
        }
        return matcher.group(2) == null ? null : matcher.group(2);
    }

    private String stringOf(Object value) {
        Object resolved = resolve(value);
        return resolved == null ? null : resolved.toString();
    }

    /**
     * 验证配置
     */
    public void validate() {
        List<SourceConfig> sources = getSources();
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("未配置任何数据源");
        }
        for (SourceConfig source : sources) {
            if (StringUtils.isAnyBlank(source.getName(), source.getBaseUrl())) {
                throw new IllegalArgumentException("数据源缺少 name 或 base_url: " + source.getName());
            }
        }
        if (getStringList("sites.canonical").isEmpty()) {
            throw new IllegalArgumentException("未配置站点 sites.canonical");
        }
        try {
            getReportZone();
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("无效的时区: " + getString("report.timezone"), e);
        }
    }
}
