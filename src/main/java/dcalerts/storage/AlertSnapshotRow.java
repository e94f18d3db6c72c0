package dcalerts.storage;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * 单条告警在某个刷新时刻的快照，写入后不再修改
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertSnapshotRow {
    private Instant ts;                     // 快照时间(UTC)
    private String batchId;                 // 所属写入批次
    private int seq;                        // 同一周期内的写入顺序
    private String site;
    private String alertname;
    private String status;                  // active|firing|suppressed
    private String fingerprint;             // 数据源未提供时为空串
    private String source;                  // 数据源名称
    private Instant startsAt;
    private Instant endsAt;
    private Map<String, String> labels;
    private Map<String, String> annotations;
}
