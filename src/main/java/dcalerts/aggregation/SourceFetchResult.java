package dcalerts.aggregation;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

@Getter
public class SourceFetchResult {
    private final List<RawAlert> alerts;
    private final List<Silence> silences;
    private final SourceStatus status;

    private SourceFetchResult(List<RawAlert> alerts, List<Silence> silences, SourceStatus status) {
        this.alerts = alerts;
        this.silences = silences;
        this.status = status;
    }

    public static SourceFetchResult success(AlertSource source, List<RawAlert> alerts, List<Silence> silences) {
        return new SourceFetchResult(alerts, silences, SourceStatus.builder()
                .name(source.getName())
                .baseUrl(source.getBaseUrl())
                .ok(true)
                .alerts(alerts.size())
                .silences(silences.size())
                .build());
    }

    public static SourceFetchResult failure(AlertSource source, String error) {
        return new SourceFetchResult(Collections.emptyList(), Collections.emptyList(), SourceStatus.builder()
                .name(source.getName())
                .baseUrl(source.getBaseUrl())
                .ok(false)
                .error(error)
                .build());
    }
}
