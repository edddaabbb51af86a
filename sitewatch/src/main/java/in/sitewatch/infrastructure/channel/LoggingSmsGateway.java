package in.sitewatch.infrastructure.channel;

import in.sitewatch.application.port.output.SmsGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default SMS gateway: logs the text instead of sending it.
 */
public final class LoggingSmsGateway implements SmsGateway {
    private static final Logger log = LoggerFactory.getLogger(LoggingSmsGateway.class);

    @Override
    public void sendText(String number, String text) {
        log.info("[SMS] To: {} | {}", number, text);
    }
}
