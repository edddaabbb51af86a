package in.sitewatch.infrastructure.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.sitewatch.application.port.output.ChannelDeliveryException;
import in.sitewatch.application.port.output.ChannelHandler;
import in.sitewatch.domain.channel.ChannelSettings;
import in.sitewatch.domain.channel.NotificationPayload;
import in.sitewatch.domain.rule.ChannelConfig;
import in.sitewatch.domain.rule.ChannelType;
import in.sitewatch.infrastructure.json.AlertJson;

import java.time.Clock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * POSTs the alert as JSON to a configured URL.
 *
 * Without a template the body is
 * {@code {alert:{...}, isEscalation, escalationLevel, timestamp}}. With a template,
 * each {@code {{field}}} is replaced by the JSON encoding of that alert field and the
 * result must parse as JSON.
 */
public final class WebhookChannelHandler implements ChannelHandler {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)}}");

    private final JsonHttpPoster poster;
    private final Clock clock;

    public WebhookChannelHandler(JsonHttpPoster poster, Clock clock) {
        this.poster = poster;
        this.clock = clock;
    }

    @Override
    public void send(NotificationPayload payload, ChannelConfig config) {
        ChannelSettings.Webhook settings = config.settings(ChannelSettings.Webhook.class);
        String alertId = payload.alert().getId();
        if (settings.url() == null || settings.url().isBlank()) {
            throw new ChannelDeliveryException(ChannelType.WEBHOOK, alertId, "Webhook URL not configured");
        }

        String body = settings.template() != null
            ? applyTemplate(settings.template(), payload)
            : defaultBody(payload);
        poster.post(ChannelType.WEBHOOK, alertId, settings.url(), settings.headers(), body);
    }

    String defaultBody(NotificationPayload payload) {
        ObjectNode body = AlertJson.MAPPER.createObjectNode();
        body.set("alert", AlertJson.summary(payload.alert()));
        body.put("isEscalation", payload.isEscalation());
        body.put("escalationLevel", payload.escalationLevel());
        body.put("timestamp", clock.instant().toString());
        return body.toString();
    }

    /**
     * Render the template; unknown or null fields become an empty JSON string.
     *
     * @throws ChannelDeliveryException if the rendered text is not valid JSON
     */
    String applyTemplate(String template, NotificationPayload payload) {
        ObjectNode fields = AlertJson.full(payload.alert());
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            JsonNode value = fields.get(matcher.group(1));
            String encoded = value == null || value.isNull() ? "\"\"" : value.toString();
            matcher.appendReplacement(sb, Matcher.quoteReplacement(encoded));
        }
        matcher.appendTail(sb);

        String rendered = sb.toString();
        try {
            return AlertJson.MAPPER.readTree(rendered).toString();
        } catch (JsonProcessingException e) {
            throw new ChannelDeliveryException(ChannelType.WEBHOOK, payload.alert().getId(),
                "Webhook template did not render valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
