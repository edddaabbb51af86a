package in.sitewatch.application.port.output;

import in.sitewatch.domain.channel.NotificationPayload;
import in.sitewatch.domain.rule.ChannelConfig;

/**
 * Delivery capability for one channel type.
 */
@FunctionalInterface
public interface ChannelHandler {

    /**
     * Deliver a notification.
     *
     * @param payload alert, matched rule and escalation context
     * @param config channel routing entry with typed settings
     * @throws ChannelDeliveryException if the notification could not be delivered
     */
    void send(NotificationPayload payload, ChannelConfig config) throws ChannelDeliveryException;
}
