package dcalerts.aggregation;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Optional;

/**
 * 已配置的数据源，保持配置顺序
 */
public class SourceRegistry {
    private final ImmutableList<AlertSource> sources;

    public SourceRegistry(List<? extends AlertSource> sources) {
        this.sources = ImmutableList.copyOf(sources);
    }

    public ImmutableList<AlertSource> getSources() {
        return sources;
    }

    /**
     * 按名称或 base_url 查找，base_url 比较忽略末尾的 /
     */
    public Optional<AlertSource> find(String nameOrBaseUrl) {
        if (StringUtils.isEmpty(nameOrBaseUrl)) {
            return Optional.empty();
        }
        String wantedBase = StringUtils.stripEnd(nameOrBaseUrl, "/");
        for (AlertSource source : sources) {
            if (nameOrBaseUrl.equals(source.getName())
                    || wantedBase.equals(StringUtils.stripEnd(StringUtils.defaultString(source.getBaseUrl()), "/"))) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }
}
