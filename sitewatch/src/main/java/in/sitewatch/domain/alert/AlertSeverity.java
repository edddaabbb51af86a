package in.sitewatch.domain.alert;

import java.util.Locale;

/**
 * Alert severity levels, ordered from least to most urgent.
 *
 * Rule matching compares ordinals, so declaration order is significant.
 */
public enum AlertSeverity {
    /**
     * INFO - General information
     */
    INFO,

    /**
     * WARNING - Review and monitor
     * Examples: memory usage above threshold, slow page renders
     */
    WARNING,

    /**
     * ERROR - Action required soon
     * Examples: API error rate above 10%
     */
    ERROR,

    /**
     * CRITICAL - Immediate action required
     * Examples: database unreachable, error bursts
     */
    CRITICAL;

    /**
     * True when this severity is at or above the given floor.
     */
    public boolean isAtLeast(AlertSeverity floor) {
        return ordinal() >= floor.ordinal();
    }

    /**
     * Lowercase name used in JSON payloads and rule files.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AlertSeverity fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
