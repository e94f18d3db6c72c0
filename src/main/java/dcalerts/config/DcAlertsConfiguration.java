package dcalerts.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import dcalerts.aggregation.AlertViewCache;
import dcalerts.aggregation.MergeEngine;
import dcalerts.aggregation.RefreshScheduler;
import dcalerts.aggregation.SiteTable;
import dcalerts.aggregation.SnapshotAggregator;
import dcalerts.aggregation.SourceFetcher;
import dcalerts.aggregation.SourceRegistry;
import dcalerts.aggregation.SynonymSiteClassifier;
import dcalerts.grafana.GrafanaAlertSource;
import dcalerts.report.WindowReportBuilder;
import dcalerts.silence.SilenceService;
import dcalerts.storage.ESSnapshotStore;
import dcalerts.storage.EsClientFactory;
import dcalerts.storage.LocalSnapshotStore;
import dcalerts.storage.SnapshotStore;
import dcalerts.utils.HttpUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@Slf4j
@Configuration
public class DcAlertsConfiguration {

    @Autowired
    private ConfigFilePathManage configFilePathManage;

    @Bean
    public DashboardConfig dashboardConfig() {
        DashboardConfig config = DashboardConfig.load(configFilePathManage.dashboardConfigPath);
        config.validate();
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SiteTable siteTable(DashboardConfig config) {
        return config.getSiteTable();
    }

    @Bean
    public SourceRegistry sourceRegistry(DashboardConfig config) {
        HttpUtils httpUtils = new HttpUtils(config.getRequestTimeout(), config.isVerifyTls());
        List<GrafanaAlertSource> sources = new ArrayList<>();
        for (SourceConfig sourceConfig : config.getSources()) {
            sources.add(new GrafanaAlertSource(sourceConfig, httpUtils));
        }
        List<String> missing = sources.stream()
                .filter(source -> !source.hasCredentials())
                .map(GrafanaAlertSource::getName)
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            log.warn("No token or user set for: {}", String.join(", ", missing));
        }
        return new SourceRegistry(sources);
    }

    @Bean(destroyMethod = "shutdown")
    public SnapshotStore snapshotStore(DashboardConfig config) {
        String type = config.getStorageType();
        if ("elasticsearch".equalsIgnoreCase(type)) {
            log.info("使用ES快照存储");
            return new ESSnapshotStore(
                    EsClientFactory.create(config),
                    config.getString("elasticsearch.index.counts", "dc_counts"),
                    config.getString("elasticsearch.index.alerts", "alert_snapshots")
            );
        }
        if (!"local".equalsIgnoreCase(type)) {
            throw new IllegalArgumentException("未知的存储类型: " + type);
        }
        log.info("使用本地快照存储");
        return new LocalSnapshotStore();
    }

    @Bean
    public AlertViewCache alertViewCache(SiteTable siteTable) {
        return new AlertViewCache(siteTable);
    }

    @Bean
    public SnapshotAggregator snapshotAggregator(DashboardConfig config,
                                                 SiteTable siteTable,
                                                 SourceRegistry sourceRegistry,
                                                 SnapshotStore snapshotStore,
                                                 AlertViewCache alertViewCache,
                                                 Clock clock) {
        int parallelism = Math.max(1, config.getFetchParallelism());
        ThreadPoolExecutor fetchExecutor = new ThreadPoolExecutor(
                parallelism,
                parallelism,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder()
                        .setNameFormat("dcalerts-fetch-%d")
                        .setDaemon(true)
                        .build()
        );
        return new SnapshotAggregator(
                sourceRegistry,
                new SourceFetcher(config.getFetchRetries(), config.getFetchRetryDelay()),
                new MergeEngine(siteTable, new SynonymSiteClassifier(siteTable, config.getSiteLabel())),
                snapshotStore,
                alertViewCache,
                siteTable,
                fetchExecutor,
                clock
        );
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public RefreshScheduler refreshScheduler(DashboardConfig config, SnapshotAggregator aggregator) {
        return new RefreshScheduler(aggregator, config.getPollInterval());
    }

    @Bean
    public WindowReportBuilder windowReportBuilder(DashboardConfig config, SnapshotStore snapshotStore, Clock clock) {
        return new WindowReportBuilder(snapshotStore, config.getReportZone(), clock);
    }

    @Bean
    public SilenceService silenceService(SourceRegistry sourceRegistry, SnapshotAggregator aggregator, Clock clock) {
        return new SilenceService(sourceRegistry, aggregator, clock);
    }
}
