package in.sitewatch.infrastructure.metrics;

import in.sitewatch.domain.alert.AlertSeverity;
import in.sitewatch.domain.alert.AlertStatistics;
import in.sitewatch.domain.rule.ChannelType;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 */
public class PrometheusMetricsEndpointTest {

    private static final int TEST_PORT = 19091;
    private Undertow server;
    private PrometheusAlertingMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        CollectorRegistry registry = new CollectorRegistry();
        metrics = new PrometheusAlertingMetrics(registry);

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path()
                .addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> scrape() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics"))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMetricsEndpointReturnsPrometheusFormat() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("text/plain"),
            "Content-Type should be Prometheus text format");
        assertTrue(response.body().contains("# HELP alerts_created_total"));
        assertTrue(response.body().contains("# TYPE alerts_created_total counter"));
    }

    @Test
    public void testRecordedEventsAppearInScrape() throws Exception {
        metrics.recordAlertCreated(AlertSeverity.CRITICAL);
        metrics.recordAlertCreated(AlertSeverity.CRITICAL);
        metrics.recordDelivery(ChannelType.WEBHOOK, false, false);
        metrics.recordRetryScheduled(ChannelType.WEBHOOK);
        metrics.recordEscalation("critical-errors", 1);

        String body = scrape().body();

        assertTrue(body.contains("alerts_created_total{severity=\"critical\",} 2.0"), body);
        assertTrue(body.contains("alert_notifications_total{channel=\"webhook\",status=\"failure\",kind=\"initial\",} 1.0"), body);
        assertTrue(body.contains("alert_notification_retries_total{channel=\"webhook\",} 1.0"), body);
        assertTrue(body.contains("alert_escalations_total{rule=\"critical-errors\",level=\"1\",} 1.0"), body);
    }

    @Test
    public void testAlertCountGauges() throws Exception {
        metrics.updateAlertCounts(new AlertStatistics(3, 2, 1, 0, 1, Map.of(AlertSeverity.ERROR, 3)));

        String body = scrape().body();

        assertTrue(body.contains("alerts_current{status=\"active\",} 2.0"), body);
        assertTrue(body.contains("alerts_current{status=\"suppressed\",} 1.0"), body);
        assertTrue(body.contains("alerts_current_by_severity{severity=\"error\",} 3.0"), body);
        assertTrue(body.contains("alerts_current_by_severity{severity=\"info\",} 0.0"), body);
    }
}
