package dcalerts.storage;

import dcalerts.aggregation.NormalizedAlert;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LocalSnapshotStoreTest {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void rangeIsHalfOpenAndOrderedByTsThenSeq() {
        LocalSnapshotStore store = new LocalSnapshotStore();
        store.append(batch(T0.plusSeconds(60), "late-a", "late-b"));
        store.append(batch(T0, "early-a", "early-b"));
        store.append(batch(T0.plusSeconds(120), "excluded"));

        List<AlertSnapshotRow> rows = store.querySnapshotsInRange(T0, T0.plusSeconds(120));

        assertThat(rows).extracting(AlertSnapshotRow::getAlertname)
                .containsExactly("early-a", "early-b", "late-a", "late-b");
    }

    @Test
    void batchFillsDefaults() {
        SnapshotBatch batch = new SnapshotBatch(T0);
        batch.appendCountRow("Tehran", 3, 2);
        batch.appendAlertRow("Tehran", NormalizedAlert.builder().alertname("Disk").labels(Map.of()).build());

        SiteCountRow count = batch.getCountRows().get(0);
        assertThat(count.getTotal()).isEqualTo(5);
        AlertSnapshotRow row = batch.getAlertRows().get(0);
        assertThat(row.getStatus()).isEqualTo("active");
        assertThat(row.getFingerprint()).isEmpty();
        assertThat(row.getSource()).isEmpty();
        assertThat(row.getTs()).isEqualTo(T0);
    }

    private static SnapshotBatch batch(Instant ts, String... names) {
        SnapshotBatch batch = new SnapshotBatch(ts);
        batch.appendCountRow("Tehran", names.length, 0);
        for (String name : names) {
            batch.appendAlertRow("Tehran", NormalizedAlert.builder()
                    .alertname(name)
                    .status("firing")
                    .fingerprint(name)
                    .source("main")
                    .build());
        }
        return batch;
    }
}
