package dcalerts.silence;

import dcalerts.aggregation.AlertSource;
import dcalerts.aggregation.SilenceMatcher;
import dcalerts.aggregation.SnapshotAggregator;
import dcalerts.aggregation.SourceRegistry;
import dcalerts.utils.TimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 静默管理：更新 = 先删除旧静默再创建新静默
 *
 * <p>两步之间不是原子的：中途失败会导致静默缺失，重试是安全的。</p>
 */
@Slf4j
public class SilenceService {
    public static final String DEFAULT_CREATED_BY = "dc-alerts-ui";
    static final Set<String> FORBIDDEN_MATCHER_NAMES = Set.of("__alert_rule_uid__");
    static final Duration DEFAULT_LENGTH = Duration.ofHours(2);
    static final Duration MIN_LENGTH = Duration.ofMinutes(1);

    private final SourceRegistry sourceRegistry;
    private final SnapshotAggregator aggregator;
    private final Clock clock;

    public SilenceService(SourceRegistry sourceRegistry, SnapshotAggregator aggregator, Clock clock) {
        this.sourceRegistry = sourceRegistry;
        this.aggregator = aggregator;
        this.clock = clock;
    }

    /**
     * 创建或更新静默，成功后同步刷新一次
     *
     * @return 后端返回的响应体
     * @throws SilenceException 数据源未知、没有可用 matcher，或后端调用失败
     */
    public Map<String, Object> createOrUpdate(SilenceRequest request) {
        AlertSource source = resolveSource(request.getGrafana());

        List<Map<String, Object>> matchers = sanitizeMatchers(request.getMatchers());
        if (matchers.isEmpty()) {
            throw SilenceException.badRequest("no matchers supplied");
        }

        Instant[] window = resolveWindow(request.getStartsAt(), request.getEndsAt());

        if (StringUtils.isNotEmpty(request.getId())) {
            try {
                source.deleteSilence(request.getId());
            } catch (RuntimeException e) {
                log.warn("Delete existing silence failed ({}): {}", request.getId(), e.getMessage());
            }
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("matchers", matchers);
        body.put("startsAt", window[0].toString());
        body.put("endsAt", window[1].toString());
        body.put("createdBy", StringUtils.defaultIfEmpty(request.getCreatedBy(), DEFAULT_CREATED_BY));
        body.put("comment", StringUtils.defaultString(request.getComment()));

        log.info("Creating silence on {} with matchers={}", source.getName(), matchers);
        Map<String, Object> result;
        try {
            result = source.createSilence(body);
        } catch (RuntimeException e) {
            throw new SilenceException(e.getMessage(), e);
        }
        refreshAfterChange();
        return result;
    }

    /**
     * 删除静默，成功后同步刷新一次
     */
    public void unsilence(String sourceNameOrBaseUrl, String silenceId) {
        if (StringUtils.isAnyEmpty(sourceNameOrBaseUrl, silenceId)) {
            throw SilenceException.badRequest("missing grafana or id");
        }
        AlertSource source = sourceRegistry.find(sourceNameOrBaseUrl)
                .orElseThrow(() -> SilenceException.badRequest("missing grafana or id"));
        try {
            source.deleteSilence(silenceId);
        } catch (RuntimeException e) {
            throw new SilenceException(e.getMessage(), e);
        }
        log.info("Deleted silence {} on {}", silenceId, source.getName());
        refreshAfterChange();
    }

    private AlertSource resolveSource(String nameOrBaseUrl) {
        return sourceRegistry.find(nameOrBaseUrl)
                .orElseThrow(() -> SilenceException.badRequest("unknown grafana"));
    }

    static List<Map<String, Object>> sanitizeMatchers(List<SilenceMatcher> matchers) {
        List<Map<String, Object>> result = new ArrayList<>();
        if (matchers == null) {
            return result;
        }
        for (SilenceMatcher matcher : matchers) {
            if (matcher == null || StringUtils.isEmpty(matcher.getName())
                    || FORBIDDEN_MATCHER_NAMES.contains(matcher.getName())) {
                continue;
            }
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("name", matcher.getName());
            m.put("value", StringUtils.defaultString(matcher.getValue()));
            m.put("isRegex", matcher.isRegex());
            result.add(m);
        }
        return result;
    }

    /**
     * 起点缺省为现在，终点缺省为起点后 2 小时；终点不晚于起点时改为起点后 1 分钟。
     * 任一时间无法解析时整体退回 [now, now + 2h)
     */
    Instant[] resolveWindow(String startsAt, String endsAt) {
        Instant now = clock.instant();
        Instant start = TimeUtils.parseInstant(startsAt);
        Instant end = TimeUtils.parseInstant(endsAt);
        boolean unparseable = (StringUtils.isNotBlank(startsAt) && start == null)
                || (StringUtils.isNotBlank(endsAt) && end == null);
        if (unparseable) {
            return new Instant[]{now, now.plus(DEFAULT_LENGTH)};
        }
        if (start == null) {
            start = now;
        }
        if (end == null) {
            end = start.plus(DEFAULT_LENGTH);
        }
        if (!end.isAfter(start)) {
            end = start.plus(MIN_LENGTH);
        }
        return new Instant[]{start, end};
    }

    /**
     * 静默已经生效，刷新失败只记录在视图的 last_error 中
     */
    private void refreshAfterChange() {
        try {
            aggregator.refresh();
        } catch (RuntimeException e) {
            log.warn("Refresh after silence change failed: {}", e.getMessage());
        }
    }
}
