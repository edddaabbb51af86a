package in.sitewatch.application.port.output;

import in.sitewatch.domain.rule.ChannelType;

/**
 * Exception thrown when a channel handler fails to deliver a notification.
 */
public class ChannelDeliveryException extends RuntimeException {

    private final ChannelType channelType;
    private final String alertId;

    public ChannelDeliveryException(ChannelType channelType, String alertId, String message) {
        super(String.format("[%s:%s] %s", channelType.wireName(), alertId, message));
        this.channelType = channelType;
        this.alertId = alertId;
    }

    public ChannelDeliveryException(ChannelType channelType, String alertId, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", channelType.wireName(), alertId, message), cause);
        this.channelType = channelType;
        this.alertId = alertId;
    }

    public ChannelType getChannelType() {
        return channelType;
    }

    public String getAlertId() {
        return alertId;
    }
}
