package in.sitewatch.infrastructure.channel;

import in.sitewatch.application.port.output.AlertArchive;
import in.sitewatch.application.port.output.ChannelDeliveryException;
import in.sitewatch.application.port.output.ChannelHandler;
import in.sitewatch.domain.channel.ChannelSettings;
import in.sitewatch.domain.channel.NotificationPayload;
import in.sitewatch.domain.rule.ChannelConfig;
import in.sitewatch.domain.rule.ChannelType;

/**
 * Writes the notified alert to an archive.
 */
public final class DatabaseChannelHandler implements ChannelHandler {

    private final AlertArchive archive;

    public DatabaseChannelHandler(AlertArchive archive) {
        this.archive = archive;
    }

    @Override
    public void send(NotificationPayload payload, ChannelConfig config) {
        ChannelSettings.Database settings = config.settings(ChannelSettings.Database.class);
        try {
            archive.store(payload.alert(), settings.table());
        } catch (Exception e) {
            throw new ChannelDeliveryException(ChannelType.DATABASE, payload.alert().getId(),
                "Archive write failed: " + e.getMessage(), e);
        }
    }
}
