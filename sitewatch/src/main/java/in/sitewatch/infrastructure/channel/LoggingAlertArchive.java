package in.sitewatch.infrastructure.channel;

import in.sitewatch.application.port.output.AlertArchive;
import in.sitewatch.domain.alert.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default archive: logs the alert id instead of persisting it.
 */
public final class LoggingAlertArchive implements AlertArchive {
    private static final Logger log = LoggerFactory.getLogger(LoggingAlertArchive.class);

    @Override
    public void store(Alert alert, String table) {
        log.info("[ARCHIVE] Alert {} would be stored in {}", alert.getId(), table != null ? table : "alerts");
    }
}
