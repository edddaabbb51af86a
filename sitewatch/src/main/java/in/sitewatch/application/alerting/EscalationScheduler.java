package in.sitewatch.application.alerting;

import in.sitewatch.domain.alert.Alert;
import in.sitewatch.domain.rule.AlertRule;
import in.sitewatch.domain.rule.EscalationRule;
import in.sitewatch.infrastructure.metrics.AlertingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Periodic pass that walks open alerts up the escalation ladders of their matching rules.
 *
 * Progress is tracked per (alert, rule) so two rules with ladders escalate
 * independently; the alert itself records the highest level any rule reached.
 * Each pass advances a pair by at most one step. Passes never overlap, whether
 * started by the timer or on demand.
 */
public final class EscalationScheduler {
    private static final Logger log = LoggerFactory.getLogger(EscalationScheduler.class);

    private final AlertStore store;
    private final RuleRegistry rules;
    private final NotificationDispatcher dispatcher;
    private final Clock clock;
    private final AlertingMetrics metrics;
    private final Duration retention;
    private final Map<ProgressKey, Integer> progress = new ConcurrentHashMap<>();

    private record ProgressKey(String alertId, String ruleId) {}

    public EscalationScheduler(AlertStore store, RuleRegistry rules, NotificationDispatcher dispatcher,
                               Clock clock, AlertingMetrics metrics, Duration retention) {
        this.store = store;
        this.rules = rules;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.metrics = metrics;
        this.retention = retention;
    }

    /**
     * Run one escalation pass, then purge expired resolved alerts.
     *
     * @return number of escalation steps fired
     */
    public synchronized int processEscalations() {
        Instant now = clock.instant();
        int escalated = 0;

        for (Alert alert : store.getActiveAlerts()) {
            for (AlertRule rule : rules.findMatchingRules(alert)) {
                if (!rule.hasEscalation()) {
                    continue;
                }
                try {
                    if (advance(alert, rule, now)) {
                        escalated++;
                    }
                } catch (Exception e) {
                    log.error("[ESCALATION] Failed to escalate {} for rule {}: {}",
                        alert.getId(), rule.id(), e.getMessage(), e);
                }
            }
        }

        purgeExpired();
        if (escalated > 0) {
            log.info("[ESCALATION] Pass complete: {} escalations", escalated);
        }
        return escalated;
    }

    /**
     * Remove resolved alerts older than the retention window and forget their progress.
     *
     * @return number of alerts removed
     */
    public synchronized int purgeExpired() {
        int removed = store.purgeResolvedBefore(clock.instant().minus(retention));
        progress.keySet().removeIf(key -> !store.contains(key.alertId()));
        metrics.updateAlertCounts(store.getStatistics());
        if (removed > 0) {
            log.info("[ESCALATION] Purged {} resolved alerts past {}h retention", removed, retention.toHours());
        }
        return removed;
    }

    /**
     * Highest ladder level the rule has fired for the alert, 0 if none.
     */
    public int reachedLevel(String alertId, String ruleId) {
        return progress.getOrDefault(new ProgressKey(alertId, ruleId), 0);
    }

    private boolean advance(Alert alert, AlertRule rule, Instant now) {
        ProgressKey key = new ProgressKey(alert.getId(), rule.id());
        Optional<EscalationRule> next = rule.nextEscalationAfter(progress.getOrDefault(key, 0));
        if (next.isEmpty()) {
            return false;
        }

        EscalationRule step = next.get();
        if (now.isBefore(step.dueAt(alert.getCreatedAt()))) {
            return false;
        }

        // status may have moved since the snapshot was taken
        Optional<Alert> current = store.getAlert(alert.getId());
        if (current.isEmpty() || !current.get().isActiveAt(now)) {
            return false;
        }
        if (step.isBlockedBy(current.get().getStatus())) {
            log.debug("[ESCALATION] Level {} of rule {} gated ({}) for {}",
                step.level(), rule.id(), step.gate(), alert.getId());
            return false;
        }

        progress.put(key, step.level());
        Alert escalatedAlert = store.escalate(alert.getId(), step.level()).orElse(current.get());
        metrics.recordEscalation(rule.id(), step.level());
        log.warn("[ESCALATION] Alert {} escalated to level {} by rule {} ({})",
            alert.getId(), step.level(), rule.id(), alert.getTitle());

        dispatcher.dispatchEscalation(escalatedAlert, rule, step);
        return true;
    }
}
