package in.sitewatch.transport.http;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.sitewatch.application.alerting.AlertingFacade;
import in.sitewatch.domain.alert.Alert;
import in.sitewatch.domain.alert.AlertSeverity;
import in.sitewatch.domain.alert.AlertStatus;
import in.sitewatch.infrastructure.json.AlertJson;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Read-only HTTP handler for the alert dashboard.
 *
 * - GET /api/monitoring/alerts - All alerts plus statistics (optional ?status= / ?severity=)
 * - GET /api/monitoring/alerts/active - Active, unsuppressed alerts
 * - GET /api/monitoring/alerts/statistics - Counts by status and severity
 */
public final class AlertsHandler {
    private static final Logger log = LoggerFactory.getLogger(AlertsHandler.class);

    private final AlertingFacade alerting;

    public AlertsHandler(AlertingFacade alerting) {
        this.alerting = alerting;
    }

    /**
     * GET /api/monitoring/alerts
     */
    public void getAlerts(HttpServerExchange exchange) {
        List<Alert> alerts;
        try {
            String status = queryParam(exchange, "status");
            String severity = queryParam(exchange, "severity");
            if (status != null) {
                alerts = alerting.getAlertsByStatus(AlertStatus.valueOf(status.toUpperCase(Locale.ROOT)));
            } else if (severity != null) {
                alerts = alerting.getAlertsBySeverity(AlertSeverity.fromWire(severity));
            } else {
                alerts = alerting.getAllAlerts();
            }
        } catch (IllegalArgumentException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid filter: " + e.getMessage());
            return;
        }

        try {
            ObjectNode body = AlertJson.MAPPER.createObjectNode();
            body.set("alerts", toArray(alerts));
            body.set("statistics", AlertJson.statistics(alerting.getAlertStatistics()));
            sendJson(exchange, body);
        } catch (Exception e) {
            log.error("Failed to get alerts: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get alerts: " + e.getMessage());
        }
    }

    /**
     * GET /api/monitoring/alerts/active
     */
    public void getActiveAlerts(HttpServerExchange exchange) {
        try {
            ObjectNode body = AlertJson.MAPPER.createObjectNode();
            body.set("alerts", toArray(alerting.getActiveAlerts()));
            sendJson(exchange, body);
        } catch (Exception e) {
            log.error("Failed to get active alerts: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get active alerts: " + e.getMessage());
        }
    }

    /**
     * GET /api/monitoring/alerts/statistics
     */
    public void getStatistics(HttpServerExchange exchange) {
        try {
            sendJson(exchange, AlertJson.statistics(alerting.getAlertStatistics()));
        } catch (Exception e) {
            log.error("Failed to get alert statistics: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get statistics: " + e.getMessage());
        }
    }

    private static ArrayNode toArray(List<Alert> alerts) {
        ArrayNode array = AlertJson.MAPPER.createArrayNode();
        alerts.forEach(alert -> array.add(AlertJson.full(alert)));
        return array;
    }

    private static String queryParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty() || values.peekFirst().isBlank()) {
            return null;
        }
        return values.peekFirst();
    }

    private void sendJson(HttpServerExchange exchange, Object data) throws Exception {
        String json = AlertJson.MAPPER.writeValueAsString(data);
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
