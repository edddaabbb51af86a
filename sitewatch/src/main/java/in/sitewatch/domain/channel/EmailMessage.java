package in.sitewatch.domain.channel;

import java.util.List;

/**
 * Rendered email notification handed to an email transport.
 */
public record EmailMessage(
    List<String> recipients,
    String subject,
    String body
) {
    public EmailMessage {
        recipients = List.copyOf(recipients);
    }
}
