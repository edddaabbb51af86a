package in.sitewatch.application.alerting;

import in.sitewatch.application.port.output.MetricsSource;
import in.sitewatch.domain.rule.AlertCondition;
import in.sitewatch.domain.rule.AlertRule;
import in.sitewatch.infrastructure.metrics.AlertingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Periodic pass that samples each enabled rule's metric and raises an alert when
 * the condition has been breached often enough in a row.
 *
 * A failing rule is logged and skipped; it never stops the pass. A rule counts as
 * due up to half a pass period early, so timer jitter never skips a whole pass.
 */
public final class ConditionEvaluator {
    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    static final String SOURCE = "rule-engine";

    private final RuleRegistry rules;
    private final MetricsSource metricsSource;
    private final AlertEmitter emitter;
    private final Clock clock;
    private final AlertingMetrics metrics;
    private final Duration tickTolerance;
    private final Map<String, RuleState> states = new ConcurrentHashMap<>();

    private static final class RuleState {
        private Instant lastEvaluatedAt;
        private Instant cooldownUntil;
        private int streak;
    }

    public ConditionEvaluator(RuleRegistry rules, MetricsSource metricsSource, AlertEmitter emitter,
                              Clock clock, AlertingMetrics metrics, Duration passInterval) {
        this.rules = rules;
        this.metricsSource = metricsSource;
        this.emitter = emitter;
        this.clock = clock;
        this.metrics = metrics;
        this.tickTolerance = passInterval.dividedBy(2);
    }

    /**
     * Evaluate every enabled rule that is due.
     *
     * @return number of rules that fired
     */
    public synchronized int evaluateRules() {
        Instant now = clock.instant();
        List<AlertRule> enabled = rules.getEnabledRules();
        int fired = 0;

        for (AlertRule rule : enabled) {
            RuleState state = states.computeIfAbsent(rule.id(), id -> new RuleState());
            try {
                if (evaluate(rule, state, now)) {
                    fired++;
                }
            } catch (RuleEvaluationException e) {
                state.streak = 0;
                metrics.recordEvaluationFailure(rule.id());
                log.error("[EVALUATOR] Failed to evaluate rule {}: {}", rule.name(), e.getMessage());
            }
        }

        Set<String> live = enabled.stream().map(AlertRule::id).collect(Collectors.toSet());
        states.keySet().retainAll(live);
        return fired;
    }

    /**
     * Breaches counted so far toward the rule's consecutive-failure threshold.
     */
    public int currentStreak(String ruleId) {
        RuleState state = states.get(ruleId);
        return state != null ? state.streak : 0;
    }

    private boolean evaluate(AlertRule rule, RuleState state, Instant now) {
        AlertCondition condition = rule.condition();

        if (state.lastEvaluatedAt != null) {
            Instant due = state.lastEvaluatedAt
                .plus(Duration.ofMinutes(condition.evaluationIntervalMinutes()))
                .minus(tickTolerance);
            if (now.isBefore(due)) {
                return false;
            }
        }
        state.lastEvaluatedAt = now;

        if (state.cooldownUntil != null && now.isBefore(state.cooldownUntil)) {
            log.debug("[EVALUATOR] Rule {} cooling down until {}", rule.id(), state.cooldownUntil);
            return false;
        }

        Object value;
        boolean breached;
        try {
            value = metricsSource.sample(condition.metric(), condition.timeWindowMinutes());
            if (value == null) {
                log.debug("[EVALUATOR] No data for {} (rule {})", condition.metric(), rule.id());
                state.streak = 0;
                return false;
            }
            breached = condition.isBreached(value);
        } catch (RuntimeException e) {
            throw new RuleEvaluationException(rule.id(), condition.metric(), e.getMessage(), e);
        }

        if (!breached) {
            state.streak = 0;
            return false;
        }

        state.streak++;
        if (state.streak < condition.consecutiveFailures()) {
            log.debug("[EVALUATOR] Rule {} breached {}/{}",
                rule.id(), state.streak, condition.consecutiveFailures());
            return false;
        }

        state.streak = 0;
        if (rule.suppressDurationMinutes() > 0) {
            state.cooldownUntil = now.plus(Duration.ofMinutes(rule.suppressDurationMinutes()));
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("ruleId", rule.id());
        metadata.put("value", value);
        metadata.putAll(rule.metadata());

        String alertId = emitter.emit("Rule triggered: " + rule.name(), rule.description(), rule.severity(),
            SOURCE, rule.tags(), metadata);
        metrics.recordRuleTriggered(rule.id());
        log.info("[EVALUATOR] Rule {} fired ({} {} {}, value={}) -> {}",
            rule.id(), condition.metric(), condition.operator().wireName(), condition.threshold(), value, alertId);
        return true;
    }
}
