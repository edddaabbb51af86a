package in.sitewatch.application.port.output;

import in.sitewatch.domain.channel.EmailMessage;

/**
 * Outbound mail delivery (SMTP relay, transactional mail API, ...).
 */
@FunctionalInterface
public interface EmailTransport {

    /**
     * @throws Exception any failure; the email channel reports it as a delivery failure
     */
    void deliver(EmailMessage message) throws Exception;
}
