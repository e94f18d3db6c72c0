package dcalerts.aggregation;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * 带重试的单数据源拉取，重试耗尽只标记该数据源失败
 */
@Slf4j
public class SourceFetcher {
    private final int retries;
    private final Duration retryDelay;

    public SourceFetcher(int retries, Duration retryDelay) {
        this.retries = Math.max(0, retries);
        this.retryDelay = retryDelay;
    }

    public SourceFetchResult fetch(AlertSource source) {
        int attempts = retries + 1;
        Exception lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                List<RawAlert> alerts = source.fetchAlerts();
                List<Silence> silences = source.fetchSilences();
                for (RawAlert alert : alerts) {
                    alert.setSource(source.getName());
                    alert.setBaseUrl(source.getBaseUrl());
                }
                for (Silence silence : silences) {
                    silence.setSource(source.getName());
                    silence.setBaseUrl(source.getBaseUrl());
                }
                log.info("Grafana {}: OK (alerts={}, silences={})", source.getName(), alerts.size(), silences.size());
                return SourceFetchResult.success(source, alerts, silences);
            } catch (RuntimeException e) {
                lastError = e;
                log.warn("Grafana {} fetch attempt {}/{} failed: {}", source.getName(), attempt, attempts, e.getMessage());
                if (attempt < attempts && !pause()) {
                    break;
                }
            }
        }
        String error = lastError == null ? "interrupted" : lastError.getMessage();
        log.error("Grafana {}: ERROR after {} attempts ({})", source.getName(), attempts, error);
        return SourceFetchResult.failure(source, error);
    }

    /**
     * @return false 表示等待被中断
     */
    private boolean pause() {
        if (retryDelay.isZero() || retryDelay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(retryDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
