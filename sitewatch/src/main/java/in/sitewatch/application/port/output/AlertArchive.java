package in.sitewatch.application.port.output;

import in.sitewatch.domain.alert.Alert;

/**
 * Durable record of notified alerts, written by the database channel.
 */
@FunctionalInterface
public interface AlertArchive {

    /**
     * @param table target table, null for the archive's default
     * @throws Exception any failure; the database channel reports it as a delivery failure
     */
    void store(Alert alert, String table) throws Exception;
}
