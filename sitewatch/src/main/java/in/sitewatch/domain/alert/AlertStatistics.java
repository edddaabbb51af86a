package in.sitewatch.domain.alert;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time counts over the alert store, read by dashboards.
 */
public record AlertStatistics(
    int total,
    int active,
    int acknowledged,
    int resolved,
    int suppressed,
    Map<AlertSeverity, Integer> bySeverity
) {
    public AlertStatistics {
        EnumMap<AlertSeverity, Integer> filled = new EnumMap<>(AlertSeverity.class);
        for (AlertSeverity severity : AlertSeverity.values()) {
            filled.put(severity, bySeverity != null ? bySeverity.getOrDefault(severity, 0) : 0);
        }
        bySeverity = Collections.unmodifiableMap(filled);
    }

    public static AlertStatistics empty() {
        return new AlertStatistics(0, 0, 0, 0, 0, Map.of());
    }
}
