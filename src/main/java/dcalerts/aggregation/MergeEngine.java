package dcalerts.aggregation;

import com.alibaba.fastjson2.JSON;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * 合并引擎 - 把多个数据源、多次重复观测到的告警合并为每站点每标识一条
 *
 * <p>同一标识的胜出规则：状态优先级高者胜（firing > active > suppressed > 其他）；
 * 优先级相同取开始时间较晚者；仍相同则按来源和内容摘要比较，保证任意处理顺序得到同一胜者。</p>
 */
public class MergeEngine {
    private static final Logger logger = LoggerFactory.getLogger(MergeEngine.class);

    static final String UNKNOWN_ALERT_NAME = "unknown";
    static final String DEFAULT_STATUS = "active";

    /**
     * 胜者比较器，较大者胜出
     */
    static final Comparator<RawAlert> PRECEDENCE = Comparator
            .comparingInt((RawAlert a) -> AlertState.rank(a.getStatus()))
            .thenComparing(a -> startOf(a))
            .thenComparing(a -> StringUtils.defaultString(a.getSource()))
            .thenComparing(a -> StringUtils.defaultString(a.getBaseUrl()))
            .thenComparing(MergeEngine::contentDigest);

    private final SiteTable siteTable;
    private final SiteClassifier classifier;

    public MergeEngine(SiteTable siteTable, SiteClassifier classifier) {
        this.siteTable = siteTable;
        this.classifier = classifier;
    }

    /**
     * 合并一个周期内所有数据源的告警和静默
     *
     * @return 按站点顺序（最后是 Unassigned）排列的告警列表
     */
    public ImmutableMap<String, ImmutableList<NormalizedAlert>> merge(List<RawAlert> alerts, List<Silence> silences) {
        Map<String, Silence> silenceById = indexSilences(silences);

        Map<String, Map<String, RawAlert>> winners = new LinkedHashMap<>();
        for (String bucket : siteTable.allBuckets()) {
            winners.put(bucket, new HashMap<>());
        }

        for (RawAlert raw : alerts) {
            String identity = IdentityResolver.resolve(raw);
            Set<String> sites = classifier.classify(raw);
            if (sites.isEmpty()) {
                winners.get(SiteTable.UNASSIGNED).merge(identity, raw, MergeEngine::choose);
                continue;
            }
            for (String site : sites) {
                Map<String, RawAlert> bucket = winners.get(site);
                if (bucket == null) {
                    logger.warn("分类结果包含未配置的站点: {}", site);
                    continue;
                }
                bucket.merge(identity, raw, MergeEngine::choose);
            }
        }

        ImmutableMap.Builder<String, ImmutableList<NormalizedAlert>> result = ImmutableMap.builder();
        for (Map.Entry<String, Map<String, RawAlert>> entry : winners.entrySet()) {
            List<NormalizedAlert> normalized = new ArrayList<>();
            entry.getValue().forEach((identity, raw) -> normalized.add(normalize(identity, raw, silenceById)));
            normalized.sort(Comparator
                    .comparing((NormalizedAlert a) -> a.getStartsAt() == null ? Instant.EPOCH : a.getStartsAt())
                    .reversed()
                    .thenComparing(NormalizedAlert::getIdentity));
            result.put(entry.getKey(), ImmutableList.copyOf(normalized));
        }
        return result.build();
    }

    /**
     * 同一标识两次观测的取舍，满足交换律和结合律
     */
    static RawAlert choose(RawAlert current, RawAlert candidate) {
        if (current == null) {
            return candidate;
        }
        return PRECEDENCE.compare(candidate, current) >= 0 ? candidate : current;
    }

    private Map<String, Silence> indexSilences(List<Silence> silences) {
        Map<String, Silence> byId = new HashMap<>();
        for (Silence silence : silences) {
            if (StringUtils.isNotEmpty(silence.getId())) {
                byId.put(silence.getId(), silence);
            }
        }
        return byId;
    }

    private NormalizedAlert normalize(String identity, RawAlert raw, Map<String, Silence> silenceById) {
        // 拷贝一份，视图和快照行不与原始记录共享可变集合
        ImmutableMap<String, String> labels = copyOf(raw.getLabels());
        ImmutableMap<String, String> annotations = copyOf(raw.getAnnotations());
        ImmutableList<String> silencedBy = raw.getSilencedBy() == null
                ? ImmutableList.of()
                : raw.getSilencedBy().stream().filter(Objects::nonNull).collect(ImmutableList.toImmutableList());

        ImmutableList.Builder<Silence> details = ImmutableList.builder();
        for (String silenceId : silencedBy) {
            Silence silence = silenceById.get(silenceId);
            if (silence != null) {
                details.add(silence);
            }
        }

        String alertname = StringUtils.firstNonEmpty(labels.get("alertname"), labels.get("alert_name"), UNKNOWN_ALERT_NAME);
        String status = StringUtils.isEmpty(raw.getStatus()) ? DEFAULT_STATUS : raw.getStatus();

        return NormalizedAlert.builder()
                .identity(identity)
                .alertname(alertname)
                .status(status)
                .labels(labels)
                .annotations(annotations)
                .startsAt(raw.getStartsAt())
                .endsAt(raw.getEndsAt())
                .fingerprint(StringUtils.defaultString(raw.getFingerprint()))
                .generatorUrl(StringUtils.defaultString(raw.getGeneratorUrl()))
                .source(raw.getSource())
                .baseUrl(raw.getBaseUrl())
                .silencedBy(silencedBy)
                .silences(details.build())
                .build();
    }

    private static ImmutableMap<String, String> copyOf(Map<String, String> source) {
        if (source == null) {
            return ImmutableMap.of();
        }
        ImmutableMap.Builder<String, String> copy = ImmutableMap.builder();
        source.forEach((key, value) -> {
            if (key != null) {
                copy.put(key, StringUtils.defaultString(value));
            }
        });
        return copy.build();
    }

    private static Instant startOf(RawAlert alert) {
        return alert.getStartsAt() == null ? Instant.EPOCH : alert.getStartsAt();
    }

    /**
     * 完全打平时的最终裁决依据
     */
    private static String contentDigest(RawAlert alert) {
        Map<String, Object> content = new TreeMap<>();
        content.put("status", StringUtils.defaultString(alert.getStatus()));
        content.put("labels", alert.getLabels() == null ? Map.of() : new TreeMap<>(alert.getLabels()));
        content.put("annotations", alert.getAnnotations() == null ? Map.of() : new TreeMap<>(alert.getAnnotations()));
        content.put("endsAt", alert.getEndsAt() == null ? "" : alert.getEndsAt().toString());
        content.put("fingerprint", StringUtils.defaultString(alert.getFingerprint()));
        content.put("generatorUrl", StringUtils.defaultString(alert.getGeneratorUrl()));
        content.put("silencedBy", alert.getSilencedBy() == null ? List.of() : alert.getSilencedBy());
        return DigestUtils.sha1Hex(JSON.toJSONString(content));
    }
}
