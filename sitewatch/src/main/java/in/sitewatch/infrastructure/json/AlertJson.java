package in.sitewatch.infrastructure.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.sitewatch.domain.alert.Alert;
import in.sitewatch.domain.alert.AlertSeverity;
import in.sitewatch.domain.alert.AlertStatistics;

import java.time.Instant;
import java.util.Map;

/**
 * Jackson tree builders for alerts, shared by the outbound channels and the dashboard API.
 *
 * Timestamps are ISO-8601 strings; severity and status use their lowercase wire names.
 */
public final class AlertJson {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Summary form sent to webhooks: id, title, message, severity, status, source, tags, createdAt.
     */
    public static ObjectNode summary(Alert alert) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", alert.getId());
        node.put("title", alert.getTitle());
        node.put("message", alert.getMessage());
        node.put("severity", alert.getSeverity().wireName());
        node.put("status", alert.getStatus().wireName());
        node.put("source", alert.getSource());
        ArrayNode tags = node.putArray("tags");
        alert.getTags().forEach(tags::add);
        node.put("createdAt", alert.getCreatedAt().toString());
        return node;
    }

    /**
     * Every field of the alert, including lifecycle and suppression state.
     */
    public static ObjectNode full(Alert alert) {
        ObjectNode node = summary(alert);
        node.set("metadata", MAPPER.valueToTree(alert.getMetadata()));
        node.put("updatedAt", alert.getUpdatedAt().toString());
        putInstant(node, "acknowledgedAt", alert.getAcknowledgedAt());
        node.put("acknowledgedBy", alert.getAcknowledgedBy());
        putInstant(node, "resolvedAt", alert.getResolvedAt());
        node.put("resolvedBy", alert.getResolvedBy());
        node.put("suppressed", alert.isSuppressed());
        putInstant(node, "suppressedUntil", alert.getSuppressedUntil());
        node.put("escalationLevel", alert.getEscalationLevel());
        node.put("retryCount", alert.getRetryCount());
        return node;
    }

    public static ObjectNode statistics(AlertStatistics stats) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("total", stats.total());
        node.put("active", stats.active());
        node.put("acknowledged", stats.acknowledged());
        node.put("resolved", stats.resolved());
        node.put("suppressed", stats.suppressed());
        ObjectNode bySeverity = node.putObject("bySeverity");
        for (Map.Entry<AlertSeverity, Integer> entry : stats.bySeverity().entrySet()) {
            bySeverity.put(entry.getKey().wireName(), entry.getValue());
        }
        return node;
    }

    private static void putInstant(ObjectNode node, String field, Instant value) {
        if (value != null) {
            node.put(field, value.toString());
        } else {
            node.putNull(field);
        }
    }

    private AlertJson() {}
}
