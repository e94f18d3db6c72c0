package dcalerts.aggregation;

import java.util.Set;

/**
 * 站点归属判定策略，返回零个或多个标准站点名
 *
 * <p>空集合表示未匹配，由调用方放入 Unassigned。</p>
 */
public interface SiteClassifier {
    Set<String> classify(RawAlert alert);
}
