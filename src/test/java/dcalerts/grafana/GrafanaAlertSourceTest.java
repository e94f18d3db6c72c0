package dcalerts.grafana;

import dcalerts.aggregation.RawAlert;
import dcalerts.aggregation.Silence;
import dcalerts.aggregation.SourceFetchException;
import dcalerts.config.SourceConfig;
import dcalerts.utils.HttpUtils;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GrafanaAlertSourceTest {
    private static final String ALERTS_JSON = "[{"
            + "\"labels\":{\"alertname\":\"DiskFull\",\"dc\":\"Tehran\"},"
            + "\"annotations\":{\"summary\":\"disk almost full\"},"
            + "\"startsAt\":\"2024-03-01T10:00:00.000Z\","
            + "\"endsAt\":\"0001-01-01T00:00:00Z\","
            + "\"fingerprint\":\"abc123\","
            + "\"generatorURL\":\"https://grafana.example.test/alerting/1\","
            + "\"status\":{\"state\":\"suppressed\",\"silencedBy\":[\"s-1\"],\"inhibitedBy\":[]}"
            + "}]";

    private MockWebServer server;
    private HttpUtils httpUtils;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        httpUtils = new HttpUtils(Duration.ofSeconds(5), true);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void fetchesAlertsFromGrafanaPathWithBearerToken() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(ALERTS_JSON));
        GrafanaAlertSource source = source(SourceConfig.builder().name("main").token("secret"));

        List<RawAlert> alerts = source.fetchAlerts();

        assertThat(alerts).hasSize(1);
        RawAlert alert = alerts.get(0);
        assertThat(alert.getStatus()).isEqualTo("suppressed");
        assertThat(alert.getSilencedBy()).containsExactly("s-1");
        assertThat(alert.getFingerprint()).isEqualTo("abc123");
        assertThat(alert.getStartsAt()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
        assertThat(alert.getLabels()).containsEntry("dc", "Tehran");

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/api/alertmanager/grafana/api/v2/alerts");
        assertThat(request.getRequestUrl().queryParameter("active")).isEqualTo("true");
        assertThat(request.getRequestUrl().queryParameter("inhibited")).isEqualTo("false");
        assertThat(request.getRequestUrl().queryParameter("silenced")).isEqualTo("true");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer secret");
    }

    @Test
    void fallsBackToPlainAlertmanagerPath() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"alerts\":" + ALERTS_JSON + "}"));
        GrafanaAlertSource source = source(SourceConfig.builder().name("main").user("admin").password("pw"));

        assertThat(source.fetchAlerts()).hasSize(1);

        server.takeRequest(1, TimeUnit.SECONDS);
        RecordedRequest second = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(second.getRequestUrl().encodedPath()).isEqualTo("/api/alertmanager/api/v2/alerts");
        assertThat(second.getHeader("Authorization")).startsWith("Basic ");
    }

    @Test
    void getRequiresExactly200() {
        server.enqueue(new MockResponse().setResponseCode(204));
        server.enqueue(new MockResponse().setResponseCode(500));
        GrafanaAlertSource source = source(SourceConfig.builder().name("main"));

        assertThatThrownBy(source::fetchAlerts)
                .isInstanceOf(SourceFetchException.class)
                .hasMessageContaining("GET failed for main")
                .hasMessageContaining("HTTP 500");
    }

    @Test
    void nonListBodyIsEmptyNotAnError() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"message\":\"nothing here\"}"));
        GrafanaAlertSource source = source(SourceConfig.builder().name("main"));

        assertThat(source.fetchAlerts()).isEmpty();
    }

    @Test
    void invalidJsonFallsBackToNextPath() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>login</html>"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody(ALERTS_JSON));
        GrafanaAlertSource source = source(SourceConfig.builder().name("main").token("t"));

        assertThat(source.fetchAlerts()).hasSize(1);
        assertThat(server.getRequestCount()).isEqualTo(2);
        server.takeRequest(1, TimeUnit.SECONDS);
        RecordedRequest second = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(second.getRequestUrl().encodedPath()).isEqualTo("/api/alertmanager/api/v2/alerts");
    }

    @Test
    void invalidJsonOnEveryPathIsAnError() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>login</html>"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>login</html>"));
        GrafanaAlertSource source = source(SourceConfig.builder().name("main"));

        assertThatThrownBy(source::fetchAlerts)
                .isInstanceOf(SourceFetchException.class)
                .hasMessageContaining("invalid JSON from");
    }

    @Test
    void parsesSilences() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("[{"
                + "\"id\":\"s-1\",\"createdBy\":\"ops\",\"comment\":\"maintenance\","
                + "\"startsAt\":\"2024-03-01T10:00:00Z\",\"endsAt\":\"2024-03-01T12:00:00Z\","
                + "\"matchers\":[{\"name\":\"alertname\",\"value\":\"Disk.*\",\"isRegex\":true}],"
                + "\"status\":{\"state\":\"active\"}}]"));
        GrafanaAlertSource source = source(SourceConfig.builder().name("main"));

        List<Silence> silences = source.fetchSilences();

        assertThat(silences).hasSize(1);
        Silence silence = silences.get(0);
        assertThat(silence.getState()).isEqualTo("active");
        assertThat(silence.getMatchers()).hasSize(1);
        assertThat(silence.getMatchers().get(0).isRegex()).isTrue();
        assertThat(silence.getEndsAt()).isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
    }

    @Test
    void createAcceptsAny2xxAndDeleteUsesSingularPath() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(202).setBody("{\"silenceID\":\"s-9\"}"));
        server.enqueue(new MockResponse().setResponseCode(200));
        GrafanaAlertSource source = source(SourceConfig.builder().name("main").token("t"));

        Map<String, Object> created = source.createSilence(Map.of("comment", "x"));
        source.deleteSilence("s-9");

        assertThat(created).containsEntry("silenceID", "s-9");
        RecordedRequest post = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(post.getMethod()).isEqualTo("POST");
        assertThat(post.getRequestUrl().encodedPath()).isEqualTo("/api/alertmanager/grafana/api/v2/silences");
        assertThat(post.getBody().readUtf8()).contains("\"comment\":\"x\"");
        RecordedRequest delete = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(delete.getMethod()).isEqualTo("DELETE");
        assertThat(delete.getRequestUrl().encodedPath()).isEqualTo("/api/alertmanager/grafana/api/v2/silence/s-9");
    }

    @Test
    void basePathIsReplacedByAbsoluteApiPath() {
        GrafanaAlertSource source = new GrafanaAlertSource(
                SourceConfig.builder().name("x").baseUrl("https://grafana.example.test/sub/").build(), httpUtils);

        assertThat(source.amUrls("/api/v2/alerts")).extracting(Object::toString).containsExactly(
                "https://grafana.example.test/api/alertmanager/grafana/api/v2/alerts",
                "https://grafana.example.test/api/alertmanager/api/v2/alerts");
    }

    private GrafanaAlertSource source(SourceConfig.SourceConfigBuilder builder) {
        return new GrafanaAlertSource(builder.baseUrl(server.url("/").toString()).build(), httpUtils);
    }
}
