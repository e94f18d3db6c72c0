package dcalerts.aggregation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import dcalerts.storage.PersistenceException;
import dcalerts.storage.SnapshotBatch;
import dcalerts.storage.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 刷新周期：拉取所有数据源 -> 分类合并 -> 写快照 -> 发布视图
 *
 * <p>后台定时周期和客户端强制刷新共用 {@link #refresh()}。并发的强制刷新不做合并，
 * 各自独立完成；合并结果与处理顺序无关。</p>
 */
public class SnapshotAggregator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotAggregator.class);

    private final SourceRegistry sourceRegistry;
    private final SourceFetcher sourceFetcher;
    private final MergeEngine mergeEngine;
    private final SnapshotStore snapshotStore;
    private final AlertViewCache viewCache;
    private final SiteTable siteTable;
    private final ExecutorService fetchExecutor;
    private final Clock clock;

    public SnapshotAggregator(SourceRegistry sourceRegistry,
                              SourceFetcher sourceFetcher,
                              MergeEngine mergeEngine,
                              SnapshotStore snapshotStore,
                              AlertViewCache viewCache,
                              SiteTable siteTable,
                              ExecutorService fetchExecutor,
                              Clock clock) {
        this.sourceRegistry = sourceRegistry;
        this.sourceFetcher = sourceFetcher;
        this.mergeEngine = mergeEngine;
        this.snapshotStore = snapshotStore;
        this.viewCache = viewCache;
        this.siteTable = siteTable;
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
    }

    /**
     * 同步执行一个完整周期并返回新视图
     *
     * @throws PersistenceException 快照写入失败，旧视图保持不变并记录错误
     */
    public AlertView refresh() {
        try {
            return runCycle();
        } catch (RuntimeException e) {
            viewCache.recordError(clock.instant() + " - " + e.getMessage());
            throw e;
        }
    }

    /**
     * 定时任务入口，异常只记录不外抛
     */
    public void runScheduledCycle() {
        try {
            refresh();
        } catch (Exception e) {
            logger.error("Background refresh failed: {}", e.getMessage(), e);
        }
    }

    public AlertView currentView() {
        return viewCache.get();
    }

    private AlertView runCycle() {
        List<RawAlert> combinedAlerts = new ArrayList<>();
        List<Silence> combinedSilences = new ArrayList<>();
        List<SourceStatus> statuses = new ArrayList<>();

        for (SourceFetchResult result : fetchAll()) {
            combinedAlerts.addAll(result.getAlerts());
            combinedSilences.addAll(result.getSilences());
            statuses.add(result.getStatus());
        }

        ImmutableMap<String, ImmutableList<NormalizedAlert>> bySite = mergeEngine.merge(combinedAlerts, combinedSilences);

        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        SnapshotBatch batch = new SnapshotBatch(now);
        for (String site : siteTable.allBuckets()) {
            List<NormalizedAlert> alerts = bySite.getOrDefault(site, ImmutableList.of());
            int suppressed = (int) alerts.stream().filter(NormalizedAlert::isSuppressed).count();
            batch.appendCountRow(site, alerts.size() - suppressed, suppressed);
            for (NormalizedAlert alert : alerts) {
                batch.appendAlertRow(site, alert);
            }
        }
        try {
            snapshotStore.append(batch);
        } catch (PersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceException("快照写入失败: " + e.getMessage(), e);
        }

        AlertView view = new AlertView(now, bySite, statuses, null);
        viewCache.publish(view);
        logger.info("刷新完成: ts={}, counts={}", now, view.counts());
        return view;
    }

    /**
     * 并行拉取，结果按配置顺序返回
     */
    private List<SourceFetchResult> fetchAll() {
        List<AlertSource> sources = sourceRegistry.getSources();
        List<Future<SourceFetchResult>> futures = new ArrayList<>(sources.size());
        for (AlertSource source : sources) {
            futures.add(fetchExecutor.submit(() -> sourceFetcher.fetch(source)));
        }

        List<SourceFetchResult> results = new ArrayList<>(sources.size());
        for (int i = 0; i < sources.size(); i++) {
            AlertSource source = sources.get(i);
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                logger.error("Grafana {} fetch task failed", source.getName(), e.getCause());
                results.add(SourceFetchResult.failure(source, String.valueOf(e.getCause())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.get(i).cancel(true);
                results.add(SourceFetchResult.failure(source, "interrupted"));
            }
        }
        return results;
    }

    @Override
    public void close() {
        fetchExecutor.shutdown();
        try {
            if (!fetchExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                fetchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            fetchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
