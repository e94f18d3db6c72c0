package dcalerts.aggregation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 站点定义：有序的标准站点名 + 每个站点的小写同义词
 */
public class SiteTable {
    public static final String UNASSIGNED = "Unassigned";

    private final ImmutableList<String> canonical;
    private final ImmutableMap<String, ImmutableSet<String>> synonyms;

    public SiteTable(List<String> canonical, Map<String, ? extends Iterable<String>> synonyms) {
        if (canonical.isEmpty()) {
            throw new IllegalArgumentException("至少需要配置一个站点");
        }
        this.canonical = ImmutableList.copyOf(canonical);
        ImmutableMap.Builder<String, ImmutableSet<String>> builder = ImmutableMap.builder();
        for (String site : this.canonical) {
            ImmutableSet.Builder<String> words = ImmutableSet.builder();
            Iterable<String> configured = synonyms.get(site);
            if (configured != null) {
                for (String word : configured) {
                    if (word != null && !word.isBlank()) {
                        words.add(word.toLowerCase(Locale.ROOT));
                    }
                }
            }
            builder.put(site, words.build());
        }
        this.synonyms = builder.build();
    }

    public ImmutableList<String> getCanonical() {
        return canonical;
    }

    public ImmutableSet<String> synonymsOf(String site) {
        return synonyms.getOrDefault(site, ImmutableSet.of());
    }

    /**
     * 全部桶：标准站点 + Unassigned
     */
    public ImmutableList<String> allBuckets() {
        return ImmutableList.<String>builder().addAll(canonical).add(UNASSIGNED).build();
    }
}
