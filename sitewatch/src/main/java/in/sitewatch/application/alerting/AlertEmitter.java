package in.sitewatch.application.alerting;

import in.sitewatch.domain.alert.AlertSeverity;

import java.util.Map;
import java.util.Set;

/**
 * Sink for alerts raised by the rule engine.
 */
@FunctionalInterface
public interface AlertEmitter {

    /**
     * @return id of the stored (or deduplicated) alert
     */
    String emit(String title, String message, AlertSeverity severity, String source,
                Set<String> tags, Map<String, Object> metadata);
}
