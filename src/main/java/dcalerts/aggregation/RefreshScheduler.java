package dcalerts.aggregation;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 后台刷新调度：启动时立即执行一次，之后按固定间隔执行
 */
public class RefreshScheduler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RefreshScheduler.class);

    private final SnapshotAggregator aggregator;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private volatile boolean running;
    private ScheduledFuture<?> schedule;

    public RefreshScheduler(SnapshotAggregator aggregator, Duration interval) {
        this.aggregator = aggregator;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder()
                        .setNameFormat("dcalerts-scheduler-%d")
                        .setDaemon(true)
                        .build()
        );
    }

    /**
     * 启动调度
     */
    public synchronized void start() {
        if (running) {
            logger.warn("刷新调度已经在运行");
            return;
        }
        running = true;
        schedule = scheduler.scheduleWithFixedDelay(
                this::runCycle,
                0,
                interval.toMillis(),
                TimeUnit.MILLISECONDS
        );
        logger.info("刷新调度已启动, 间隔: {}秒", interval.getSeconds());
    }

    private void runCycle() {
        if (!running) {
            return;
        }
        aggregator.runScheduledCycle();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * 停止调度。拉取线程池由 {@link SnapshotAggregator#close()} 负责关闭
     */
    @Override
    public synchronized void close() {
        if (running) {
            logger.info("正在停止刷新调度...");
        }
        running = false;
        if (schedule != null) {
            schedule.cancel(false);
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
