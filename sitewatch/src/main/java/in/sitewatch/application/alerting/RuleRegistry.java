package in.sitewatch.application.alerting;

import in.sitewatch.domain.alert.Alert;
import in.sitewatch.domain.rule.AlertRule;
import in.sitewatch.domain.rule.RuleValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keyed collection of alert rules, in registration order.
 */
public final class RuleRegistry {
    private static final Logger log = LoggerFactory.getLogger(RuleRegistry.class);

    private final Map<String, AlertRule> rules = new LinkedHashMap<>();

    /**
     * Register a rule, replacing any rule with the same id.
     *
     * @throws RuleValidationException if the rule is malformed
     */
    public synchronized void addRule(AlertRule rule) {
        rule.validate();
        AlertRule previous = rules.put(rule.id(), rule);
        if (previous != null) {
            log.info("[RULES] Alert rule replaced: {} ({})", rule.name(), rule.id());
        } else {
            log.info("[RULES] Alert rule added: {} ({})", rule.name(), rule.id());
        }
    }

    public synchronized boolean removeRule(String ruleId) {
        AlertRule removed = rules.remove(ruleId);
        if (removed != null) {
            log.info("[RULES] Alert rule removed: {}", ruleId);
            return true;
        }
        return false;
    }

    /**
     * Replace an existing rule.
     *
     * @return false if no rule with that id is registered
     * @throws RuleValidationException if the replacement is malformed
     */
    public synchronized boolean updateRule(AlertRule rule) {
        if (!rules.containsKey(rule.id())) {
            return false;
        }
        rule.validate();
        rules.put(rule.id(), rule);
        log.info("[RULES] Alert rule updated: {} ({})", rule.name(), rule.id());
        return true;
    }

    public synchronized Optional<AlertRule> getRule(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    public synchronized List<AlertRule> getRules() {
        return new ArrayList<>(rules.values());
    }

    public synchronized List<AlertRule> getEnabledRules() {
        return rules.values().stream().filter(AlertRule::enabled).toList();
    }

    /**
     * Enabled rules the alert matches, in registration order.
     */
    public synchronized List<AlertRule> findMatchingRules(Alert alert) {
        return rules.values().stream()
            .filter(AlertRule::enabled)
            .filter(rule -> matches(alert, rule))
            .toList();
    }

    public synchronized int size() {
        return rules.size();
    }

    /**
     * Severity floor plus OR tag filter.
     */
    public static boolean matches(Alert alert, AlertRule rule) {
        return rule.matches(alert);
    }
}
