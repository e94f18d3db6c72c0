package dcalerts.storage;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.bulk.OperationType;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.ElasticsearchIndicesClient;
import co.elastic.clients.transport.endpoints.BooleanResponse;
import dcalerts.aggregation.NormalizedAlert;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SuppressWarnings("unchecked")
class ESSnapshotStoreTest {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private ElasticsearchClient esClient;
    private ElasticsearchIndicesClient indices;

    @BeforeEach
    void setUp() throws IOException {
        esClient = mock(ElasticsearchClient.class);
        indices = mock(ElasticsearchIndicesClient.class);
        when(esClient.indices()).thenReturn(indices);
    }

    @Test
    void createsOnlyMissingIndices() throws IOException {
        when(indices.exists(any(Function.class)))
                .thenReturn(new BooleanResponse(true))
                .thenReturn(new BooleanResponse(false));

        new ESSnapshotStore(esClient, "dc_counts", "alert_snapshots");

        verify(indices, times(2)).exists(any(Function.class));
        verify(indices, times(1)).create(any(Function.class));
    }

    @Test
    void indexInitFailureIsFatal() throws IOException {
        when(indices.exists(any(Function.class))).thenThrow(new IOException("connection refused"));

        assertThatThrownBy(() -> new ESSnapshotStore(esClient, "dc_counts", "alert_snapshots"))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("dc_counts");
    }

    @Test
    void bulkItemErrorFailsTheWrite() throws IOException {
        ESSnapshotStore store = existingStore();
        BulkResponse response = BulkResponse.of(b -> b
                .errors(true)
                .took(3)
                .items(BulkResponseItem.of(i -> i
                        .operationType(OperationType.Index)
                        .index("alert_snapshots")
                        .status(400)
                        .error(e -> e.type("mapper_parsing_exception").reason("failed to parse")))));
        when(esClient.bulk(any(BulkRequest.class))).thenReturn(response);

        assertThatThrownBy(() -> store.append(batch()))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("mapper_parsing_exception");
    }

    @Test
    void emptyBatchIsNotSent() throws IOException {
        ESSnapshotStore store = existingStore();

        store.append(new SnapshotBatch(T0));

        verify(esClient, never()).bulk(any(BulkRequest.class));
    }

    @Test
    void queryPagesWithSearchAfter() throws IOException {
        ESSnapshotStore store = existingStore();
        when(esClient.search(any(SearchRequest.class), eq(AlertSnapshotRow.class)))
                .thenReturn(page(0, 1000))
                .thenReturn(page(1000, 1));

        List<AlertSnapshotRow> rows = store.querySnapshotsInRange(T0, T0.plusSeconds(3600));

        assertThat(rows).hasSize(1001);
        assertThat(rows.get(1000).getSeq()).isEqualTo(1000);
        verify(esClient, times(2)).search(any(SearchRequest.class), eq(AlertSnapshotRow.class));
    }

    @Test
    void pagingSortKeyIncludesBatchId() throws IOException {
        ESSnapshotStore store = existingStore();
        when(esClient.search(any(SearchRequest.class), eq(AlertSnapshotRow.class)))
                .thenReturn(page(0, 1000))
                .thenReturn(page(1000, 1));

        store.querySnapshotsInRange(T0, T0.plusSeconds(3600));

        ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
        verify(esClient, times(2)).search(captor.capture(), eq(AlertSnapshotRow.class));
        SearchRequest first = captor.getAllValues().get(0);
        assertThat(first.sort()).extracting(sort -> sort.field().field()).containsExactly("ts", "batchId", "seq");
        assertThat(first.searchAfter()).isEmpty();
        List<FieldValue> after = captor.getAllValues().get(1).searchAfter();
        assertThat(after).hasSize(3);
        assertThat(after.get(1).stringValue()).isEqualTo("b-1");
        assertThat(after.get(2).longValue()).isEqualTo(999L);
    }

    @Test
    void batchesWrittenInTheSameMillisecondHaveDistinctIds() {
        SnapshotBatch first = batch();
        SnapshotBatch second = batch();

        assertThat(first.getBatchId()).isNotEqualTo(second.getBatchId());
        assertThat(first.getAlertRows()).extracting(AlertSnapshotRow::getBatchId).containsOnly(first.getBatchId());
        assertThat(second.getAlertRows()).extracting(AlertSnapshotRow::getBatchId).containsOnly(second.getBatchId());
    }

    @Test
    void searchFailureIsPersistenceError() throws IOException {
        ESSnapshotStore store = existingStore();
        when(esClient.search(any(SearchRequest.class), eq(AlertSnapshotRow.class)))
                .thenThrow(new IOException("timeout"));

        assertThatThrownBy(() -> store.querySnapshotsInRange(T0, T0.plusSeconds(60)))
                .isInstanceOf(PersistenceException.class);
    }

    private ESSnapshotStore existingStore() throws IOException {
        when(indices.exists(any(Function.class))).thenReturn(new BooleanResponse(true));
        return new ESSnapshotStore(esClient, "dc_counts", "alert_snapshots");
    }

    private static SnapshotBatch batch() {
        SnapshotBatch batch = new SnapshotBatch(T0);
        batch.appendCountRow("Tehran", 1, 0);
        batch.appendAlertRow("Tehran", NormalizedAlert.builder().alertname("Disk").status("firing").build());
        return batch;
    }

    private static SearchResponse<AlertSnapshotRow> page(int firstSeq, int size) {
        List<Hit<AlertSnapshotRow>> hits = new ArrayList<>();
        for (int seq = firstSeq; seq < firstSeq + size; seq++) {
            AlertSnapshotRow row = AlertSnapshotRow.builder().ts(T0).batchId("b-1").seq(seq).site("Tehran").alertname("A" + seq).build();
            long sortSeq = seq;
            hits.add(Hit.of(h -> h
                    .index("alert_snapshots")
                    .id(String.valueOf(sortSeq))
                    .source(row)
                    .sort(FieldValue.of(T0.toEpochMilli()), FieldValue.of("b-1"), FieldValue.of(sortSeq))));
        }
        return SearchResponse.of(r -> r
                .took(1)
                .timedOut(false)
                .shards(s -> s.total(1).successful(1).failed(0))
                .hits(h -> h.hits(hits)));
    }
}
