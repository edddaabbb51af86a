package in.sitewatch.domain.rule;

import in.sitewatch.domain.alert.AlertStatus;

import java.util.Locale;

/**
 * Optional condition that blocks an escalation step.
 */
public enum EscalationGate {
    /** Blocks once the alert has been acknowledged. */
    UNACKNOWLEDGED,

    /** Blocks once the alert has been resolved. */
    UNRESOLVED;

    public boolean blocks(AlertStatus status) {
        return switch (this) {
            case UNACKNOWLEDGED -> status == AlertStatus.ACKNOWLEDGED;
            case UNRESOLVED -> status == AlertStatus.RESOLVED;
        };
    }

    public static EscalationGate fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
