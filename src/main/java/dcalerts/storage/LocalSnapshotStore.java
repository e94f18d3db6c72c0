package dcalerts.storage;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 进程内快照存储，用于本地运行和测试
 */
@Slf4j
public class LocalSnapshotStore implements SnapshotStore {
    private final List<SiteCountRow> countRows = new ArrayList<>();
    private final List<AlertSnapshotRow> alertRows = new ArrayList<>();

    @Override
    public synchronized void append(SnapshotBatch batch) {
        countRows.addAll(batch.getCountRows());
        alertRows.addAll(batch.getAlertRows());
        log.debug("本地快照写入: ts={}, counts={}, alerts={}",
                batch.getTs(), batch.getCountRows().size(), batch.getAlertRows().size());
    }

    @Override
    public synchronized List<AlertSnapshotRow> querySnapshotsInRange(Instant start, Instant end) {
        return alertRows.stream()
                .filter(r -> !r.getTs().isBefore(start) && r.getTs().isBefore(end))
                .sorted(Comparator.comparing(AlertSnapshotRow::getTs)
                        .thenComparing(AlertSnapshotRow::getBatchId, Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparingInt(AlertSnapshotRow::getSeq))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void shutdown() {
        countRows.clear();
        alertRows.clear();
    }
}
