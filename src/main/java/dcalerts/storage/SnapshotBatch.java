package dcalerts.storage;

import dcalerts.aggregation.NormalizedAlert;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * 一个刷新周期要写入的全部行，共用同一个时间戳
 *
 * <p>batchId 每批唯一，与 seq 一起保证 (ts, batchId, seq) 在全部快照中不重复。</p>
 */
@Getter
public class SnapshotBatch {
    private final Instant ts;
    private final String batchId;
    private final List<SiteCountRow> countRows = new ArrayList<>();
    private final List<AlertSnapshotRow> alertRows = new ArrayList<>();

    public SnapshotBatch(Instant ts) {
        this.ts = ts;
        this.batchId = UUID.randomUUID().toString();
    }

    public void appendCountRow(String site, int active, int suppressed) {
        countRows.add(SiteCountRow.builder()
                .ts(ts)
                .site(site)
                .active(active)
                .suppressed(suppressed)
                .total(active + suppressed)
                .build());
    }

    public void appendAlertRow(String site, NormalizedAlert alert) {
        alertRows.add(AlertSnapshotRow.builder()
                .ts(ts)
                .batchId(batchId)
                .seq(alertRows.size())
                .site(site)
                .alertname(alert.getAlertname())
                .status(alert.getStatus() == null ? "active" : alert.getStatus())
                .fingerprint(alert.getFingerprint() == null ? "" : alert.getFingerprint())
                .source(alert.getSource() == null ? "" : alert.getSource())
                .startsAt(alert.getStartsAt())
                .endsAt(alert.getEndsAt())
                .labels(alert.getLabels())
                .annotations(alert.getAnnotations())
                .build());
    }

    public List<SiteCountRow> getCountRows() {
        return Collections.unmodifiableList(countRows);
    }

    public List<AlertSnapshotRow> getAlertRows() {
        return Collections.unmodifiableList(alertRows);
    }
}
