package in.sitewatch.domain.rule;

import in.sitewatch.domain.alert.Alert;
import in.sitewatch.domain.alert.AlertSeverity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A named policy binding a condition to a severity floor, channel routing and an
 * escalation ladder.
 */
public record AlertRule(
    String id,
    String name,
    String description,
    AlertCondition condition,
    AlertSeverity severity,                // floor for matching
    List<ChannelConfig> channels,
    boolean enabled,
    Set<String> tags,                      // OR filter; empty matches every alert
    int suppressDurationMinutes,           // cooldown after the rule engine fires
    List<EscalationRule> escalationRules,
    Map<String, Object> metadata
) {
    public AlertRule {
        channels = channels != null ? List.copyOf(channels) : List.of();
        tags = tags != null ? Collections.unmodifiableSet(new LinkedHashSet<>(tags)) : Set.of();
        escalationRules = escalationRules != null ? List.copyOf(escalationRules) : List.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    /**
     * True iff the alert's severity reaches this rule's floor and, when the rule has
     * tags, the alert carries at least one of them.
     */
    public boolean matches(Alert alert) {
        if (!alert.getSeverity().isAtLeast(severity)) {
            return false;
        }
        if (tags.isEmpty()) {
            return true;
        }
        for (String tag : tags) {
            if (alert.getTags().contains(tag)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasEscalation() {
        return !escalationRules.isEmpty();
    }

    /**
     * The ladder step following {@code reachedLevel}, i.e. the first step whose level is higher.
     */
    public Optional<EscalationRule> nextEscalationAfter(int reachedLevel) {
        for (EscalationRule step : escalationRules) {
            if (step.level() > reachedLevel) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }

    public Optional<EscalationRule> escalationForLevel(int level) {
        for (EscalationRule step : escalationRules) {
            if (step.level() == level) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }

    /**
     * Structural validation, run when the rule is registered.
     *
     * @throws RuleValidationException on the first problem found
     */
    public void validate() {
        String ruleId = id != null ? id : "<missing>";
        if (id == null || id.isBlank()) {
            throw new RuleValidationException(ruleId, "Rule id is required");
        }
        if (name == null || name.isBlank()) {
            throw new RuleValidationException(ruleId, "Rule name is required");
        }
        if (severity == null) {
            throw new RuleValidationException(ruleId, "Rule severity is required");
        }
        if (condition == null) {
            throw new RuleValidationException(ruleId, "Rule condition is required");
        }
        if (suppressDurationMinutes < 0) {
            throw new RuleValidationException(ruleId, "Suppress duration must not be negative");
        }

        validateChannels(ruleId, channels, "channels");

        int previousLevel = 0;
        for (EscalationRule step : escalationRules) {
            if (step.level() != previousLevel + 1) {
                throw new RuleValidationException(ruleId, String.format(
                    "Escalation levels must increase by one from 1, found %d after %d",
                    step.level(), previousLevel));
            }
            if (step.delayMinutes() < 0) {
                throw new RuleValidationException(ruleId, "Escalation delay must not be negative");
            }
            validateChannels(ruleId, step.channels(), "escalation level " + step.level());
            previousLevel = step.level();
        }
    }

    private static void validateChannels(String ruleId, List<ChannelConfig> configs, String where) {
        for (ChannelConfig config : configs) {
            if (config.settings().type() != config.type()) {
                throw new RuleValidationException(ruleId, String.format(
                    "%s: %s channel carries %s settings", where, config.type(), config.settings().type()));
            }
            if (!config.enabled()) {
                continue;
            }
            try {
                config.settings().validate();
            } catch (IllegalArgumentException e) {
                throw new RuleValidationException(ruleId,
                    String.format("%s: invalid %s channel: %s", where, config.type().wireName(), e.getMessage()), e);
            }
        }
    }

    public AlertRule withEnabled(boolean enabled) {
        return toBuilder().enabled(enabled).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .name(name)
            .description(description)
            .condition(condition)
            .severity(severity)
            .channels(channels)
            .enabled(enabled)
            .tags(tags)
            .suppressDurationMinutes(suppressDurationMinutes)
            .escalationRules(escalationRules)
            .metadata(metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String description = "";
        private AlertCondition condition;
        private AlertSeverity severity = AlertSeverity.INFO;
        private List<ChannelConfig> channels = new ArrayList<>();
        private boolean enabled = true;
        private Set<String> tags = new LinkedHashSet<>();
        private int suppressDurationMinutes;
        private List<EscalationRule> escalationRules = new ArrayList<>();
        private Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder condition(AlertCondition condition) {
            this.condition = condition;
            return this;
        }

        public Builder severity(AlertSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder channel(ChannelConfig channel) {
            this.channels.add(channel);
            return this;
        }

        public Builder channels(List<ChannelConfig> channels) {
            this.channels = new ArrayList<>(channels);
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags = new LinkedHashSet<>(tags);
            return this;
        }

        public Builder suppressDurationMinutes(int minutes) {
            this.suppressDurationMinutes = minutes;
            return this;
        }

        public Builder escalation(EscalationRule step) {
            this.escalationRules.add(step);
            return this;
        }

        public Builder escalationRules(List<EscalationRule> escalationRules) {
            this.escalationRules = new ArrayList<>(escalationRules);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = new LinkedHashMap<>(metadata);
            return this;
        }

        public AlertRule build() {
            return new AlertRule(id, name, description, condition, severity, channels, enabled,
                tags, suppressDurationMinutes, escalationRules, metadata);
        }
    }
}
