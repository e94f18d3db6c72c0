package dcalerts.storage;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.FieldType;
import co.elastic.clients.elasticsearch._types.mapping.TypeMapping;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * 基于 Elasticsearch 的快照存储：计数行和告警行各一个索引
 */
@Slf4j
public class ESSnapshotStore implements SnapshotStore {
    private static final String DATE_FORMAT = "strict_date_optional_time||epoch_millis";
    private static final int PAGE_SIZE = 1000;

    private final ElasticsearchClient esClient;
    private final String countsIndex;
    private final String alertsIndex;

    public ESSnapshotStore(ElasticsearchClient esClient, String countsIndex, String alertsIndex) {
        this.esClient = esClient;
        this.countsIndex = countsIndex;
        this.alertsIndex = alertsIndex;
        ensureIndexExists(countsIndex, m -> m
                .properties("ts", p -> p.date(d -> d.format(DATE_FORMAT)))
                .properties("site", p -> p.keyword(k -> k))
                .properties("active", p -> p.integer(i -> i))
                .properties("suppressed", p -> p.integer(i -> i))
                .properties("total", p -> p.integer(i -> i))
        );
        ensureIndexExists(alertsIndex, m -> m
                .properties("ts", p -> p.date(d -> d.format(DATE_FORMAT)))
                .properties("batchId", p -> p.keyword(k -> k))
                .properties("seq", p -> p.integer(i -> i))
                .properties("site", p -> p.keyword(k -> k))
                .properties("alertname", p -> p.keyword(k -> k))
                .properties("status", p -> p.keyword(k -> k))
                .properties("fingerprint", p -> p.keyword(k -> k))
                .properties("source", p -> p.keyword(k -> k))
                .properties("startsAt", p -> p.date(d -> d.format(DATE_FORMAT)))
                .properties("endsAt", p -> p.date(d -> d.format(DATE_FORMAT)))
                // 标签/注解只保存在 _source 中，不建索引
                .properties("labels", p -> p.object(o -> o.enabled(false)))
                .properties("annotations", p -> p.object(o -> o.enabled(false)))
        );
    }

    @Override
    public void append(SnapshotBatch batch) {
        if (batch.getCountRows().isEmpty() && batch.getAlertRows().isEmpty()) {
            return;
        }
        BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
        for (SiteCountRow row : batch.getCountRows()) {
            bulkBuilder.operations(op -> op.index(idx -> idx.index(countsIndex).document(row)));
        }
        for (AlertSnapshotRow row : batch.getAlertRows()) {
            bulkBuilder.operations(op -> op.index(idx -> idx.index(alertsIndex).document(row)));
        }

        BulkResponse response;
        try {
            response = esClient.bulk(bulkBuilder.build());
        } catch (IOException | RuntimeException e) {
            throw new PersistenceException("快照批量写入失败: " + e.getMessage(), e);
        }

        if (response.errors()) {
            String firstError = response.items().stream()
                    .map(BulkResponseItem::error)
                    .filter(error -> error != null)
                    .map(error -> error.type() + ": " + error.reason())
                    .findFirst()
                    .orElse("unknown");
            throw new PersistenceException("快照批量写入存在失败条目: " + firstError);
        }
        log.debug("快照写入ES: ts={}, counts={}, alerts={}",
                batch.getTs(), batch.getCountRows().size(), batch.getAlertRows().size());
    }

    @Override
    public List<AlertSnapshotRow> querySnapshotsInRange(Instant start, Instant end) {
        return searchAll(alertsIndex, start, end, AlertSnapshotRow.class);
    }

    /**
     * 用 search_after 翻页读出窗口内的全部文档。排序键 (ts, batchId, seq) 唯一，翻页边界上不会丢行
     */
    private <T> List<T> searchAll(String index, Instant start, Instant end, Class<T> type) {
        List<T> rows = new ArrayList<>();
        List<FieldValue> searchAfter = null;
        try {
            while (true) {
                SearchRequest.Builder searchBuilder = new SearchRequest.Builder()
                        .index(index)
                        .size(PAGE_SIZE)
                        .query(q -> q.range(r -> r.date(d -> d
                                .field("ts")
                                .gte(start.toString())
                                .lt(end.toString()))))
                        .sort(s -> s.field(f -> f.field("ts").order(SortOrder.Asc)))
                        .sort(s -> s.field(f -> f.field("batchId").order(SortOrder.Asc).unmappedType(FieldType.Keyword)))
                        .sort(s -> s.field(f -> f.field("seq").order(SortOrder.Asc)));
                if (searchAfter != null) {
                    searchBuilder.searchAfter(searchAfter);
                }

                SearchResponse<T> response = esClient.search(searchBuilder.build(), type);
                List<Hit<T>> hits = response.hits().hits();
                for (Hit<T> hit : hits) {
                    if (hit.source() != null) {
                        rows.add(hit.source());
                    }
                }
                if (hits.size() < PAGE_SIZE) {
                    return rows;
                }
                searchAfter = hits.get(hits.size() - 1).sort();
            }
        } catch (IOException | RuntimeException e) {
            throw new PersistenceException("查询快照失败: " + index, e);
        }
    }

    private void ensureIndexExists(String index, Function<TypeMapping.Builder, TypeMapping.Builder> mappings) {
        try {
            boolean exists = esClient.indices().exists(req -> req.index(index)).value();
            if (!exists) {
                esClient.indices().create(req -> req
                        .index(index)
                        .mappings(mappings::apply)
                );
                log.info("创建快照索引: {}", index);
            }
        } catch (IOException | RuntimeException e) {
            throw new PersistenceException("初始化快照索引失败: " + index, e);
        }
    }

    @Override
    public void shutdown() {
        try {
            esClient._transport().close();
        } catch (IOException e) {
            log.error("关闭ES客户端失败", e);
        }
    }
}
