package in.sitewatch.infrastructure.channel;

import in.sitewatch.application.port.output.ChannelDeliveryException;
import in.sitewatch.application.port.output.ChannelHandler;
import in.sitewatch.application.port.output.SmsGateway;
import in.sitewatch.domain.alert.Alert;
import in.sitewatch.domain.channel.ChannelSettings;
import in.sitewatch.domain.channel.NotificationPayload;
import in.sitewatch.domain.rule.ChannelConfig;
import in.sitewatch.domain.rule.ChannelType;

import java.util.Locale;

/**
 * Sends a one-line text to every configured number. Fails if any number fails.
 */
public final class SmsChannelHandler implements ChannelHandler {

    private final SmsGateway gateway;

    public SmsChannelHandler(SmsGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public void send(NotificationPayload payload, ChannelConfig config) {
        ChannelSettings.Sms settings = config.settings(ChannelSettings.Sms.class);
        Alert alert = payload.alert();
        if (settings.numbers().isEmpty()) {
            throw new ChannelDeliveryException(ChannelType.SMS, alert.getId(), "SMS numbers not configured");
        }

        String text = format(payload);
        for (String number : settings.numbers()) {
            try {
                gateway.sendText(number, text);
            } catch (Exception e) {
                throw new ChannelDeliveryException(ChannelType.SMS, alert.getId(),
                    "SMS to " + number + " failed: " + e.getMessage(), e);
            }
        }
    }

    static String format(NotificationPayload payload) {
        Alert alert = payload.alert();
        String prefix = payload.isEscalation() ? "ESCALATION L" + payload.escalationLevel() : "ALERT";
        return String.format("%s [%s] %s",
            prefix, alert.getSeverity().name().toUpperCase(Locale.ROOT), alert.getTitle());
    }
}
