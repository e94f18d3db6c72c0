package dcalerts.report;

import dcalerts.aggregation.AlertState;
import dcalerts.aggregation.SiteTable;
import dcalerts.storage.AlertSnapshotRow;
import dcalerts.storage.SnapshotStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 基于快照历史生成日报、周报和月报
 *
 * <p>报表中的告警身份：有 fingerprint 时用 fingerprint，否则退化为 {@code alertname|source}。
 * 这比实时合并使用的身份更粗，跨 fingerprint 变化时能保持历史连续。</p>
 */
@Slf4j
public class WindowReportBuilder {
    private static final Comparator<AlertDurationDetail> DETAIL_ORDER =
            Comparator.comparingLong(AlertDurationDetail::getDurationSeconds).reversed()
                    .thenComparing(AlertDurationDetail::getAlertname, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final SnapshotStore snapshotStore;
    private final ZoneId zone;
    private final Clock clock;

    public WindowReportBuilder(SnapshotStore snapshotStore, ZoneId zone, Clock clock) {
        this.snapshotStore = snapshotStore;
        this.zone = zone;
        this.clock = clock;
    }

    /**
     * 报表时区下的今天
     */
    public LocalDate today() {
        return LocalDate.now(clock.withZone(zone));
    }

    /**
     * 日报取 day 当天，周报取截止到 day 的 7 天，月报取 day 所在月份
     */
    public WindowReport build(ReportKind kind, LocalDate day) {
        switch (kind) {
            case DAILY:
                return build(ReportWindow.daily(day, zone));
            case WEEKLY:
                return build(ReportWindow.weekly(day, zone));
            case MONTHLY:
                return monthly(YearMonth.from(day));
            default:
                throw new IllegalArgumentException("未知的报表类型: " + kind);
        }
    }

    public WindowReport monthly(YearMonth month) {
        return build(ReportWindow.monthly(month, zone));
    }

    /**
     * @throws ReportQueryException 快照查询失败
     */
    public WindowReport build(ReportWindow window) {
        List<AlertSnapshotRow> rows;
        try {
            rows = snapshotStore.querySnapshotsInRange(window.getStart(), window.getEnd());
        } catch (RuntimeException e) {
            log.error("报表查询失败: {}", window, e);
            throw new ReportQueryException("报表查询失败: " + window + ": " + e.getMessage(), e);
        }
        log.debug("生成报表: {}, 快照行数: {}", window, rows.size());
        return new WindowReport(
                window.getKind().getPeriod(),
                window.getStart(),
                window.getEnd(),
                summarize(rows),
                details(rows, window)
        );
    }

    List<SiteSummary> summarize(List<AlertSnapshotRow> rows) {
        Map<String, Set<String>> fired = new HashMap<>();
        Map<String, Set<String>> suppressed = new HashMap<>();
        Map<String, Integer> samples = new TreeMap<>();

        for (AlertSnapshotRow row : rows) {
            String site = siteOf(row);
            samples.merge(site, 1, Integer::sum);
            String key = alertKey(row);
            if (AlertState.isFiringLike(row.getStatus())) {
                fired.computeIfAbsent(site, s -> new HashSet<>()).add(key);
            }
            if (AlertState.of(row.getStatus()) == AlertState.SUPPRESSED) {
                suppressed.computeIfAbsent(site, s -> new HashSet<>()).add(key);
            }
        }

        List<SiteSummary> summary = new ArrayList<>(samples.size());
        samples.forEach((site, count) -> summary.add(new SiteSummary(
                site,
                fired.getOrDefault(site, Set.of()).size(),
                suppressed.getOrDefault(site, Set.of()).size(),
                count
        )));
        return summary;
    }

    Map<String, List<AlertDurationDetail>> details(List<AlertSnapshotRow> rows, ReportWindow window) {
        Map<String, Map<String, Observation>> bySite = new LinkedHashMap<>();
        for (AlertSnapshotRow row : rows) {
            bySite.computeIfAbsent(siteOf(row), s -> new LinkedHashMap<>())
                    .computeIfAbsent(alertKey(row), k -> new Observation(row))
                    .add(row);
        }

        Map<String, List<AlertDurationDetail>> details = new TreeMap<>();
        bySite.forEach((site, observations) -> {
            List<AlertDurationDetail> records = new ArrayList<>(observations.size());
            for (Observation observation : observations.values()) {
                records.add(observation.toDetail(window));
            }
            records.sort(DETAIL_ORDER);
            details.put(site, records);
        });
        return details;
    }

    static String alertKey(AlertSnapshotRow row) {
        if (StringUtils.isNotBlank(row.getFingerprint())) {
            return row.getFingerprint();
        }
        return row.getAlertname() + "|" + row.getSource();
    }

    private static String siteOf(AlertSnapshotRow row) {
        return StringUtils.defaultIfEmpty(row.getSite(), SiteTable.UNASSIGNED);
    }

    /**
     * 同一站点同一告警在窗口内的全部观测
     */
    private static final class Observation {
        private final AlertSnapshotRow first;
        private final Set<String> statuses = new TreeSet<>();
        private Instant minSeen;
        private Instant maxSeen;
        private Instant minStartsAt;
        private Instant maxEndsAt;

        Observation(AlertSnapshotRow first) {
            this.first = first;
        }

        void add(AlertSnapshotRow row) {
            statuses.add(StringUtils.defaultString(row.getStatus()).toLowerCase(Locale.ROOT));
            Instant ts = row.getTs();
            minSeen = minSeen == null || ts.isBefore(minSeen) ? ts : minSeen;
            maxSeen = maxSeen == null || ts.isAfter(maxSeen) ? ts : maxSeen;
            if (row.getStartsAt() != null && (minStartsAt == null || row.getStartsAt().isBefore(minStartsAt))) {
                minStartsAt = row.getStartsAt();
            }
            if (row.getEndsAt() != null && (maxEndsAt == null || row.getEndsAt().isAfter(maxEndsAt))) {
                maxEndsAt = row.getEndsAt();
            }
        }

        AlertDurationDetail toDetail(ReportWindow window) {
            // 没有 endsAt 时截止到最后一次观测到的时间
            Instant start = minStartsAt != null ? minStartsAt : minSeen;
            Instant end = maxEndsAt != null ? maxEndsAt : maxSeen;
            Instant effectiveStart = start.isAfter(window.getStart()) ? start : window.getStart();
            Instant effectiveEnd = end.isBefore(window.getEnd()) ? end : window.getEnd();
            long seconds = Math.max(0, Duration.between(effectiveStart, effectiveEnd).getSeconds());

            return AlertDurationDetail.builder()
                    .alertname(first.getAlertname())
                    .source(first.getSource())
                    .fingerprint(first.getFingerprint())
                    .statuses(new ArrayList<>(statuses))
                    .startUtc(effectiveStart)
                    .endUtc(effectiveEnd)
                    .durationSeconds(seconds)
                    .labels(first.getLabels() == null ? Map.of() : first.getLabels())
                    .annotations(first.getAnnotations() == null ? Map.of() : first.getAnnotations())
                    .build();
        }
    }
}
