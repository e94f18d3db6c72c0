package dcalerts.aggregation;

import com.alibaba.fastjson2.JSON;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 告警标识计算：与数据源无关，纯函数
 *
 * <p>指纹非空（trim 后）时直接使用指纹原值；否则对按 key 排序后的标签集合做规范化序列化，
 * 再取 SHA-1 摘要。标签插入顺序不影响结果。</p>
 */
public final class IdentityResolver {

    private IdentityResolver() {
    }

    public static String resolve(RawAlert alert) {
        String fingerprint = alert.getFingerprint();
        if (StringUtils.isNotBlank(fingerprint)) {
            return fingerprint;
        }
        return DigestUtils.sha1Hex(canonicalLabels(alert.getLabels()));
    }

    /**
     * 形如 [["alertname","Disk"],["dc","tehran"]] 的规范化串
     */
    static String canonicalLabels(Map<String, String> labels) {
        List<List<String>> pairs = new ArrayList<>();
        if (labels != null) {
            for (Map.Entry<String, String> entry : new TreeMap<>(labels).entrySet()) {
                List<String> pair = new ArrayList<>(2);
                pair.add(entry.getKey());
                pair.add(entry.getValue());
                pairs.add(pair);
            }
        }
        return JSON.toJSONString(pairs);
    }
}
