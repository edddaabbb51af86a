package in.sitewatch.infrastructure.channel;

import in.sitewatch.application.port.output.EmailTransport;
import in.sitewatch.domain.channel.EmailMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default email transport: logs the message instead of sending it.
 */
public final class LoggingEmailTransport implements EmailTransport {
    private static final Logger log = LoggerFactory.getLogger(LoggingEmailTransport.class);

    @Override
    public void deliver(EmailMessage message) {
        log.info("[EMAIL] To: {} | Subject: {} | {}",
            String.join(", ", message.recipients()), message.subject(), message.body());
    }
}
