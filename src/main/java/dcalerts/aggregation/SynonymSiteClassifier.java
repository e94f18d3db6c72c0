package dcalerts.aggregation;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 基于站点标签 + 注解文本同义词匹配的站点分类
 */
public class SynonymSiteClassifier implements SiteClassifier {
    public static final String DEFAULT_SITE_LABEL = "dc";
    private static final String[] TEXT_ANNOTATIONS = {"summary", "message", "description", "body"};

    private final SiteTable siteTable;
    private final String siteLabel;

    public SynonymSiteClassifier(SiteTable siteTable) {
        this(siteTable, DEFAULT_SITE_LABEL);
    }

    public SynonymSiteClassifier(SiteTable siteTable, String siteLabel) {
        this.siteTable = siteTable;
        this.siteLabel = siteLabel;
    }

    @Override
    public Set<String> classify(RawAlert alert) {
        List<String> labelValues = siteLabelValues(alert.getLabels());
        String explicit = labelValues.stream()
                .filter(StringUtils::isNotEmpty)
                .findFirst()
                .map(v -> v.toLowerCase(Locale.ROOT))
                .orElse("");
        String text = searchText(labelValues, alert.getAnnotations());

        Set<String> found = new LinkedHashSet<>();
        for (String site : siteTable.getCanonical()) {
            // 站点标签精确匹配优先
            if (!explicit.isEmpty() && explicit.equals(site.toLowerCase(Locale.ROOT))) {
                found.add(site);
                continue;
            }
            for (String synonym : siteTable.synonymsOf(site)) {
                if (text.contains(synonym)) {
                    found.add(site);
                    break;
                }
            }
        }
        return found;
    }

    /**
     * 取出 key 忽略大小写等于站点标签名的所有标签值，按 key 排序（"DC" 在 "dc" 之前）
     */
    private List<String> siteLabelValues(Map<String, String> labels) {
        List<String> values = new ArrayList<>();
        if (labels == null) {
            return values;
        }
        for (Map.Entry<String, String> entry : new TreeMap<>(labels).entrySet()) {
            if (siteLabel.equalsIgnoreCase(entry.getKey())) {
                values.add(StringUtils.defaultString(entry.getValue()));
            }
        }
        return values;
    }

    private String searchText(List<String> labelValues, Map<String, String> annotations) {
        List<String> parts = new ArrayList<>(labelValues);
        for (String key : TEXT_ANNOTATIONS) {
            parts.add(annotations == null ? "" : StringUtils.defaultString(annotations.get(key)));
        }
        return String.join(" ", parts).toLowerCase(Locale.ROOT);
    }
}
