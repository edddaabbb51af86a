package in.sitewatch.infrastructure.channel;

import in.sitewatch.application.port.output.ChannelDeliveryException;
import in.sitewatch.application.port.output.ChannelHandler;
import in.sitewatch.application.port.output.EmailTransport;
import in.sitewatch.domain.alert.Alert;
import in.sitewatch.domain.channel.ChannelSettings;
import in.sitewatch.domain.channel.EmailMessage;
import in.sitewatch.domain.channel.NotificationPayload;
import in.sitewatch.domain.rule.ChannelConfig;
import in.sitewatch.domain.rule.ChannelType;

/**
 * Renders the alert as an email and hands it to the transport.
 */
public final class EmailChannelHandler implements ChannelHandler {

    private final EmailTransport transport;

    public EmailChannelHandler(EmailTransport transport) {
        this.transport = transport;
    }

    @Override
    public void send(NotificationPayload payload, ChannelConfig config) {
        ChannelSettings.Email settings = config.settings(ChannelSettings.Email.class);
        Alert alert = payload.alert();
        if (settings.recipients().isEmpty()) {
            throw new ChannelDeliveryException(ChannelType.EMAIL, alert.getId(), "Email recipients not configured");
        }

        try {
            transport.deliver(render(payload, settings));
        } catch (ChannelDeliveryException e) {
            throw e;
        } catch (Exception e) {
            throw new ChannelDeliveryException(ChannelType.EMAIL, alert.getId(),
                "Email transport failed: " + e.getMessage(), e);
        }
    }

    static EmailMessage render(NotificationPayload payload, ChannelSettings.Email settings) {
        Alert alert = payload.alert();
        String subject = settings.subject() != null && !settings.subject().isBlank()
            ? settings.subject()
            : alert.getTitle();
        if (payload.isEscalation()) {
            subject = "[Escalation L" + payload.escalationLevel() + "] " + subject;
        }

        StringBuilder body = new StringBuilder()
            .append(alert.getMessage()).append("\n\n")
            .append("Severity: ").append(alert.getSeverity().wireName()).append('\n')
            .append("Source: ").append(alert.getSource()).append('\n')
            .append("Status: ").append(alert.getStatus().wireName()).append('\n')
            .append("Created: ").append(alert.getCreatedAt()).append('\n')
            .append("Alert ID: ").append(alert.getId());
        return new EmailMessage(settings.recipients(), subject, body.toString());
    }
}
