package dcalerts.grafana;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import dcalerts.aggregation.RawAlert;
import dcalerts.aggregation.Silence;
import dcalerts.aggregation.SilenceMatcher;
import dcalerts.utils.TimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Alertmanager v2 响应解析。缺失或类型不对的字段用安全默认值替代，不抛异常
 */
@Slf4j
public final class GrafanaRecordParser {

    private GrafanaRecordParser() {
    }

    /**
     * 告警列表；响应为 {"alerts": [...]} 时取内层，非列表返回空列表
     *
     * @param data 已解析的 JSON 响应
     */
    public static List<RawAlert> parseAlerts(Object data) {
        if (data instanceof JSONObject && ((JSONObject) data).containsKey("alerts")) {
            data = ((JSONObject) data).get("alerts");
        }
        List<RawAlert> alerts = new ArrayList<>();
        if (!(data instanceof JSONArray)) {
            return alerts;
        }
        for (Object item : (JSONArray) data) {
            if (item instanceof JSONObject) {
                alerts.add(toRawAlert((JSONObject) item));
            } else {
                log.debug("跳过非对象告警记录: {}", item);
            }
        }
        return alerts;
    }

    public static List<Silence> parseSilences(Object data) {
        List<Silence> silences = new ArrayList<>();
        if (!(data instanceof JSONArray)) {
            return silences;
        }
        for (Object item : (JSONArray) data) {
            if (item instanceof JSONObject) {
                silences.add(toSilence((JSONObject) item));
            }
        }
        return silences;
    }

    static RawAlert toRawAlert(JSONObject json) {
        String status = null;
        List<String> silencedBy = new ArrayList<>();
        Object statusField = json.get("status");
        if (statusField instanceof JSONObject) {
            JSONObject statusObject = (JSONObject) statusField;
            status = StringUtils.firstNonEmpty(
                    stringOf(statusObject.get("state")),
                    stringOf(statusObject.get("status")));
            silencedBy = stringList(statusObject.get("silencedBy"));
        } else if (statusField instanceof String) {
            status = (String) statusField;
        }

        return RawAlert.builder()
                .status(status)
                .labels(stringMap(json.get("labels")))
                .annotations(stringMap(json.get("annotations")))
                .startsAt(TimeUtils.parseInstant(stringOf(json.get("startsAt"))))
                .endsAt(TimeUtils.parseInstant(stringOf(json.get("endsAt"))))
                .fingerprint(stringOf(json.get("fingerprint")))
                .generatorUrl(stringOf(json.get("generatorURL")))
                .silencedBy(silencedBy)
                .build();
    }

    static Silence toSilence(JSONObject json) {
        List<SilenceMatcher> matchers = new ArrayList<>();
        Object matcherField = json.get("matchers");
        if (matcherField instanceof JSONArray) {
            for (Object item : (JSONArray) matcherField) {
                if (item instanceof JSONObject) {
                    JSONObject m = (JSONObject) item;
                    matchers.add(new SilenceMatcher(
                            stringOf(m.get("name")),
                            stringOf(m.get("value")),
                            Boolean.TRUE.equals(m.get("isRegex"))));
                }
            }
        }
        String state = null;
        Object statusField = json.get("status");
        if (statusField instanceof JSONObject) {
            state = stringOf(((JSONObject) statusField).get("state"));
        }
        return Silence.builder()
                .id(stringOf(json.get("id")))
                .createdBy(stringOf(json.get("createdBy")))
                .comment(stringOf(json.get("comment")))
                .startsAt(TimeUtils.parseInstant(stringOf(json.get("startsAt"))))
                .endsAt(TimeUtils.parseInstant(stringOf(json.get("endsAt"))))
                .matchers(matchers)
                .state(state)
                .build();
    }

    private static Map<String, String> stringMap(Object value) {
        Map<String, String> result = new HashMap<>();
        if (value instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (entry.getKey() != null) {
                    result.put(entry.getKey().toString(), entry.getValue() == null ? "" : entry.getValue().toString());
                }
            }
        }
        return result;
    }

    private static List<String> stringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        }
        return result;
    }

    private static String stringOf(Object value) {
        return value == null ? null : value.toString();
    }
}
