package in.sitewatch.domain.channel;

import in.sitewatch.domain.rule.ChannelType;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Typed per-channel configuration. Each variant corresponds to exactly one
 * {@link ChannelType} and validates its own required fields.
 */
public interface ChannelSettings {

    ChannelType type();

    /**
     * @throws IllegalArgumentException if a required field is missing or malformed
     */
    void validate();

    record Console() implements ChannelSettings {
        public static final Console INSTANCE = new Console();

        @Override
        public ChannelType type() {
            return ChannelType.CONSOLE;
        }

        @Override
        public void validate() {
        }
    }

    record Webhook(
        String url,
        Map<String, String> headers,
        String template            // optional JSON body with {{field}} placeholders
    ) implements ChannelSettings {
        public Webhook {
            headers = headers != null ? Map.copyOf(headers) : Map.of();
        }

        public Webhook(String url) {
            this(url, Map.of(), null);
        }

        @Override
        public ChannelType type() {
            return ChannelType.WEBHOOK;
        }

        @Override
        public void validate() {
            requireHttpUrl(url, "Webhook URL");
        }
    }

    record Email(
        List<String> recipients,
        String subject             // optional; defaults to the alert title
    ) implements ChannelSettings {
        public Email {
            recipients = recipients != null ? List.copyOf(recipients) : List.of();
        }

        @Override
        public ChannelType type() {
            return ChannelType.EMAIL;
        }

        @Override
        public void validate() {
            if (recipients.isEmpty()) {
                throw new IllegalArgumentException("Email recipients not configured");
            }
            for (String recipient : recipients) {
                if (recipient == null || !recipient.contains("@")) {
                    throw new IllegalArgumentException("Invalid email recipient: " + recipient);
                }
            }
        }
    }

    record Chat(
        String webhookUrl,
        String channel             // optional, e.g. "#alerts"
    ) implements ChannelSettings {
        @Override
        public ChannelType type() {
            return ChannelType.CHAT;
        }

        @Override
        public void validate() {
            requireHttpUrl(webhookUrl, "Chat webhook");
        }
    }

    record Sms(List<String> numbers) implements ChannelSettings {
        public Sms {
            numbers = numbers != null ? List.copyOf(numbers) : List.of();
        }

        @Override
        public ChannelType type() {
            return ChannelType.SMS;
        }

        @Override
        public void validate() {
            if (numbers.isEmpty()) {
                throw new IllegalArgumentException("SMS numbers not configured");
            }
        }
    }

    record Database(String table) implements ChannelSettings {
        @Override
        public ChannelType type() {
            return ChannelType.DATABASE;
        }

        @Override
        public void validate() {
        }
    }

    private static void requireHttpUrl(String url, String label) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException(label + " not configured");
        }
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(label + " is not a valid URI: " + url, e);
        }
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException(label + " must be http(s): " + url);
        }
    }
}
