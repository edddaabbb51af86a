package in.sitewatch.domain.alert;

import java.util.Locale;

/**
 * Alert lifecycle status.
 *
 * ACTIVE → ACKNOWLEDGED → RESOLVED, or ACTIVE → RESOLVED directly.
 * Suppression is a separate flag on {@link Alert}, not a status.
 */
public enum AlertStatus {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED;

    public boolean isTerminal() {
        return this == RESOLVED;
    }

    /**
     * Whether a transition from this status to {@code target} moves the lifecycle forward.
     */
    public boolean canTransitionTo(AlertStatus target) {
        return switch (this) {
            case ACTIVE -> target == ACKNOWLEDGED || target == RESOLVED;
            case ACKNOWLEDGED -> target == RESOLVED;
            case RESOLVED -> false;
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
