package in.sitewatch.infrastructure.channel;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.sitewatch.application.port.output.ChannelDeliveryException;
import in.sitewatch.application.port.output.ChannelHandler;
import in.sitewatch.domain.alert.Alert;
import in.sitewatch.domain.alert.AlertSeverity;
import in.sitewatch.domain.channel.ChannelSettings;
import in.sitewatch.domain.channel.NotificationPayload;
import in.sitewatch.domain.rule.ChannelConfig;
import in.sitewatch.domain.rule.ChannelType;
import in.sitewatch.infrastructure.json.AlertJson;

import java.util.Locale;
import java.util.Map;

/**
 * Posts a Slack-style incoming-webhook message with one colour-coded attachment.
 */
public final class ChatChannelHandler implements ChannelHandler {

    private final JsonHttpPoster poster;

    public ChatChannelHandler(JsonHttpPoster poster) {
        this.poster = poster;
    }

    @Override
    public void send(NotificationPayload payload, ChannelConfig config) {
        ChannelSettings.Chat settings = config.settings(ChannelSettings.Chat.class);
        String alertId = payload.alert().getId();
        if (settings.webhookUrl() == null || settings.webhookUrl().isBlank()) {
            throw new ChannelDeliveryException(ChannelType.CHAT, alertId, "Chat webhook not configured");
        }
        poster.post(ChannelType.CHAT, alertId, settings.webhookUrl(), Map.of(),
            buildMessage(payload, settings.channel()).toString());
    }

    ObjectNode buildMessage(NotificationPayload payload, String channel) {
        Alert alert = payload.alert();
        String prefix = payload.isEscalation() ? "ESCALATION L" + payload.escalationLevel() : "ALERT";

        ObjectNode message = AlertJson.MAPPER.createObjectNode();
        if (channel != null) {
            message.put("channel", channel);
        }
        message.put("text", prefix + ": " + alert.getTitle());

        ObjectNode attachment = message.putArray("attachments").addObject();
        attachment.put("color", colorFor(alert.getSeverity()));
        attachment.put("title", alert.getTitle());
        attachment.put("text", alert.getMessage());
        ArrayNode fields = attachment.putArray("fields");
        addField(fields, "Severity", alert.getSeverity().name().toUpperCase(Locale.ROOT));
        addField(fields, "Source", alert.getSource());
        addField(fields, "Status", alert.getStatus().wireName());
        addField(fields, "Created", alert.getCreatedAt().toString());
        attachment.put("footer", "Monitoring System");
        attachment.put("ts", alert.getCreatedAt().getEpochSecond());
        return message;
    }

    static String colorFor(AlertSeverity severity) {
        return switch (severity) {
            case CRITICAL -> "danger";
            case ERROR, WARNING -> "warning";
            case INFO -> "good";
        };
    }

    private static void addField(ArrayNode fields, String title, String value) {
        ObjectNode field = fields.addObject();
        field.put("title", title);
        field.put("value", value);
        field.put("short", true);
    }
}
