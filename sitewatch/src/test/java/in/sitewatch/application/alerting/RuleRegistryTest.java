package in.sitewatch.application.alerting;

import in.sitewatch.domain.alert.Alert;
import in.sitewatch.domain.alert.AlertSeverity;
import in.sitewatch.domain.rule.AlertRule;
import in.sitewatch.domain.rule.RuleValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RuleRegistryTest {

    private RuleRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RuleRegistry();
    }

    private static Alert alert(AlertSeverity severity, String... tags) {
        return Alert.builder()
            .id("alert_1_aaaaaaaaa")
            .title("t")
            .severity(severity)
            .source("s")
            .tags(Set.of(tags))
            .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
            .build();
    }

    @Test
    void addRuleOverwritesOnSameId() {
        registry.addRule(TestRules.rule("r1", AlertSeverity.INFO).build());
        registry.addRule(TestRules.rule("r1", AlertSeverity.ERROR).name("Renamed").build());

        assertEquals(1, registry.size());
        assertEquals("Renamed", registry.getRule("r1").orElseThrow().name());
    }

    @Test
    void updateRequiresExistingRule() {
        assertFalse(registry.updateRule(TestRules.rule("r1", AlertSeverity.INFO).build()));

        registry.addRule(TestRules.rule("r1", AlertSeverity.INFO).build());
        assertTrue(registry.updateRule(TestRules.rule("r1", AlertSeverity.CRITICAL).build()));
        assertEquals(AlertSeverity.CRITICAL, registry.getRule("r1").orElseThrow().severity());
    }

    @Test
    void removeRule() {
        registry.addRule(TestRules.rule("r1", AlertSeverity.INFO).build());

        assertTrue(registry.removeRule("r1"));
        assertFalse(registry.removeRule("r1"));
        assertTrue(registry.getRule("r1").isEmpty());
    }

    @Test
    void invalidRuleIsNotRegistered() {
        AlertRule broken = TestRules.rule("broken", AlertSeverity.INFO)
            .escalation(TestRules.step(2, 10, null, TestRules.sms()))
            .build();

        assertThrows(RuleValidationException.class, () -> registry.addRule(broken));
        assertEquals(0, registry.size());
    }

    @Test
    void invalidUpdateLeavesPreviousRule() {
        registry.addRule(TestRules.rule("r1", AlertSeverity.INFO).build());
        AlertRule broken = TestRules.rule("r1", AlertSeverity.INFO).name("").build();

        assertThrows(RuleValidationException.class, () -> registry.updateRule(broken));
        assertEquals("r1", registry.getRule("r1").orElseThrow().name());
    }

    @Test
    void matchingHonoursSeverityFloor() {
        AlertRule errorsAndUp = TestRules.rule("r1", AlertSeverity.ERROR).build();

        assertFalse(RuleRegistry.matches(alert(AlertSeverity.WARNING), errorsAndUp));
        assertTrue(RuleRegistry.matches(alert(AlertSeverity.ERROR), errorsAndUp));
        assertTrue(RuleRegistry.matches(alert(AlertSeverity.CRITICAL), errorsAndUp));
    }

    @Test
    void findMatchingRulesSkipsDisabledAndKeepsOrder() {
        registry.addRule(TestRules.rule("infra", AlertSeverity.INFO).tag("infra").build());
        registry.addRule(TestRules.rule("api", AlertSeverity.INFO).tag("api").build());
        registry.addRule(TestRules.rule("all", AlertSeverity.INFO).build());
        registry.addRule(TestRules.rule("off", AlertSeverity.INFO).enabled(false).build());

        List<AlertRule> matching = registry.findMatchingRules(alert(AlertSeverity.ERROR, "infra"));

        assertEquals(List.of("infra", "all"), matching.stream().map(AlertRule::id).toList());
        assertEquals(3, registry.getEnabledRules().size());
        assertEquals(4, registry.getRules().size());
    }
}
