package in.sitewatch.domain.rule;

import in.sitewatch.domain.channel.ChannelSettings;

/**
 * Routing entry binding a rule (or escalation step) to one channel.
 */
public record ChannelConfig(
    ChannelType type,
    boolean enabled,
    ChannelSettings settings,
    int priority,                 // lower sends first
    RetryPolicy retryPolicy
) {
    public ChannelConfig {
        if (type == null) {
            throw new IllegalArgumentException("Channel type is required");
        }
        if (settings == null) {
            settings = ChannelSettings.Console.INSTANCE;
        }
        if (retryPolicy == null) {
            retryPolicy = RetryPolicy.none();
        }
    }

    public static ChannelConfig of(ChannelType type, ChannelSettings settings, RetryPolicy retryPolicy) {
        return new ChannelConfig(type, true, settings, 1, retryPolicy);
    }

    public static ChannelConfig console() {
        return of(ChannelType.CONSOLE, ChannelSettings.Console.INSTANCE, RetryPolicy.none());
    }

    public ChannelConfig disabled() {
        return new ChannelConfig(type, false, settings, priority, retryPolicy);
    }

    /**
     * Typed view of the settings for the handler of this channel.
     *
     * @throws IllegalStateException if the settings variant does not match the expected class
     */
    public <T extends ChannelSettings> T settings(Class<T> expected) {
        if (!expected.isInstance(settings)) {
            throw new IllegalStateException(String.format("Channel %s carries %s settings, expected %s",
                type, settings.getClass().getSimpleName(), expected.getSimpleName()));
        }
        return expected.cast(settings);
    }
}
