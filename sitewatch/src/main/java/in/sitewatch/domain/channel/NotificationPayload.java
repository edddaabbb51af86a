package in.sitewatch.domain.channel;

import in.sitewatch.domain.alert.Alert;
import in.sitewatch.domain.rule.AlertRule;

/**
 * Transient bundle handed to a channel handler for one send.
 */
public record NotificationPayload(
    Alert alert,
    AlertRule rule,
    boolean isEscalation,
    int escalationLevel
) {
    public static NotificationPayload initial(Alert alert, AlertRule rule) {
        return new NotificationPayload(alert, rule, false, alert.getEscalationLevel());
    }

    public static NotificationPayload escalation(Alert alert, AlertRule rule, int level) {
        return new NotificationPayload(alert, rule, true, level);
    }
}
