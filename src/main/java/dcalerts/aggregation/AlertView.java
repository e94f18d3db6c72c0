package dcalerts.aggregation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 某一刷新周期结束时的完整告警视图，创建后不可变
 */
@Getter
public final class AlertView {
    private final Instant generatedAt;
    private final ImmutableMap<String, ImmutableList<NormalizedAlert>> bySite;
    private final ImmutableList<SourceStatus> sources;
    private final String lastError;

    public AlertView(Instant generatedAt,
                     Map<String, ? extends List<NormalizedAlert>> bySite,
                     List<SourceStatus> sources,
                     String lastError) {
        this.generatedAt = generatedAt;
        ImmutableMap.Builder<String, ImmutableList<NormalizedAlert>> builder = ImmutableMap.builder();
        bySite.forEach((site, alerts) -> builder.put(site, ImmutableList.copyOf(alerts)));
        this.bySite = builder.build();
        this.sources = ImmutableList.copyOf(sources);
        this.lastError = lastError;
    }

    /**
     * 尚未完成任何周期时的视图：所有站点为空
     */
    public static AlertView empty(SiteTable siteTable) {
        Map<String, List<NormalizedAlert>> bySite = new LinkedHashMap<>();
        for (String bucket : siteTable.allBuckets()) {
            bySite.put(bucket, ImmutableList.of());
        }
        return new AlertView(null, bySite, ImmutableList.of(), null);
    }

    public AlertView withLastError(String error) {
        return new AlertView(generatedAt, bySite, sources, error);
    }

    /**
     * 按告警名和 summary/message/description 注解做不区分大小写的子串过滤
     */
    public AlertView filter(String query) {
        String q = StringUtils.lowerCase(StringUtils.trimToEmpty(query), Locale.ROOT);
        if (q.isEmpty()) {
            return this;
        }
        Map<String, List<NormalizedAlert>> filtered = new LinkedHashMap<>();
        bySite.forEach((site, alerts) -> filtered.put(site,
                alerts.stream().filter(a -> searchText(a).contains(q)).collect(ImmutableList.toImmutableList())));
        return new AlertView(generatedAt, filtered, sources, lastError);
    }

    public Map<String, Integer> counts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        bySite.forEach((site, alerts) -> counts.put(site, alerts.size()));
        return counts;
    }

    private static String searchText(NormalizedAlert alert) {
        Map<String, String> annotations = alert.getAnnotations() == null ? Map.of() : alert.getAnnotations();
        return String.join(" ",
                StringUtils.defaultString(alert.getAlertname()),
                StringUtils.defaultString(annotations.get("summary")),
                StringUtils.defaultString(annotations.get("message")),
                StringUtils.defaultString(annotations.get("description"))
        ).toLowerCase(Locale.ROOT);
    }
}
