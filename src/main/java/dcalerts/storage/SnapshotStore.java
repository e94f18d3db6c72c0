package dcalerts.storage;

import java.time.Instant;
import java.util.List;

/**
 * 快照存储接口 - 只追加，供报表按时间窗口查询
 */
public interface SnapshotStore {
    /**
     * 写入一个周期的计数行和告警行
     *
     * @throws PersistenceException 写入失败
     */
    void append(SnapshotBatch batch);

    /**
     * 查询 start <= ts < end 的告警快照，按 ts、batchId、seq 升序
     */
    List<AlertSnapshotRow> querySnapshotsInRange(Instant start, Instant end);

    /**
     * 关闭存储
     */
    void shutdown();
}
