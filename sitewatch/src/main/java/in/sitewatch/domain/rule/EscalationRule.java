package in.sitewatch.domain.rule;

import in.sitewatch.domain.alert.AlertStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One step of an escalation ladder.
 */
public record EscalationRule(
    int level,                    // 1-based, strictly increasing within a ladder
    int delayMinutes,             // measured from alert creation
    List<ChannelConfig> channels,
    EscalationGate gate           // null = always fires
) {
    public EscalationRule {
        channels = channels != null ? List.copyOf(channels) : List.of();
    }

    public Instant dueAt(Instant alertCreatedAt) {
        return alertCreatedAt.plus(Duration.ofMinutes(delayMinutes));
    }

    public boolean isBlockedBy(AlertStatus status) {
        return gate != null && gate.blocks(status);
    }
}
