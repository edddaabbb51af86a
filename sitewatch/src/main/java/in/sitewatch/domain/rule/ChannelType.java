package in.sitewatch.domain.rule;

import java.util.Locale;

/**
 * Delivery mechanisms a rule can route notifications to.
 */
public enum ChannelType {
    CONSOLE,
    WEBHOOK,
    EMAIL,
    CHAT,
    SMS,
    DATABASE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a rule-file channel name. "slack" is accepted as an alias for CHAT.
     */
    public static ChannelType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Channel type is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("SLACK".equals(normalized)) {
            return CHAT;
        }
        return valueOf(normalized);
    }
}
