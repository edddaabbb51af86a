package in.sitewatch.bootstrap;

import in.sitewatch.application.alerting.AlertingFacade;
import in.sitewatch.config.AlertingConfig;
import in.sitewatch.config.RuleDefinitionLoader;
import in.sitewatch.domain.rule.AlertRule;
import in.sitewatch.infrastructure.metrics.JvmMetricsSource;
import in.sitewatch.infrastructure.metrics.PrometheusAlertingMetrics;
import in.sitewatch.infrastructure.metrics.PrometheusMetricsHandler;
import in.sitewatch.transport.http.AlertsHandler;
import in.sitewatch.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Core Java entry point (NO Spring).
 *
 * Wires the alerting engine from ALERTING_* environment variables, loads rule
 * definitions and serves the read-only alert dashboard plus Prometheus metrics.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== SiteWatch Alerting Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        AlertingConfig config = AlertingConfig.fromEnv();
        int port = Env.getInt("ALERTING_HTTP_PORT", 9090);
        String rulesFile = Env.get("ALERTING_RULES_FILE", null);

        PrometheusAlertingMetrics metrics = new PrometheusAlertingMetrics();
        AlertingFacade alerting = AlertingFacade.builder()
            .config(config)
            .metricsSource(new JvmMetricsSource())
            .metrics(metrics)
            .build();

        List<AlertRule> rules = loadRules(rulesFile);
        rules.forEach(alerting::addRule);
        log.info("✓ {} alert rules registered", rules.size());

        alerting.start();

        AlertsHandler alertsHandler = new AlertsHandler(alerting);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());
        log.info("✓ Prometheus /metrics endpoint ready");

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/monitoring/alerts", alertsHandler::getAlerts)
            .get("/api/monitoring/alerts/active", alertsHandler::getActiveAlerts)
            .get("/api/monitoring/alerts/statistics", alertsHandler::getStatistics)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "SiteWatch Alerting\n\n" +
                    "API: GET /api/monitoring/alerts, /api/monitoring/alerts/active, /api/monitoring/alerts/statistics\n" +
                    "Metrics: GET /metrics\n"
                );
            });

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        log.info("✓ HTTP API server started on port {}", port);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down SiteWatch Alerting...");
            server.stop();
            alerting.stop();
        }, "shutdown-hook"));
    }

    private static List<AlertRule> loadRules(String rulesFile) {
        RuleDefinitionLoader loader = new RuleDefinitionLoader();
        try {
            if (rulesFile != null) {
                return loader.loadFile(Path.of(rulesFile));
            }
            return loader.loadResource(RuleDefinitionLoader.DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load alert rules: " + e.getMessage(), e);
        }
    }
}
