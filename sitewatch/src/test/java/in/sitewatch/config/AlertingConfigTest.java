package in.sitewatch.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AlertingConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("ALERTING_MAX_ALERTS");
        System.clearProperty("ALERTING_ENABLE_ESCALATION");
    }

    @Test
    void defaults() {
        AlertingConfig config = AlertingConfig.defaults();

        assertTrue(config.enabled());
        assertEquals(Duration.ofMinutes(1), config.evaluationInterval());
        assertEquals(Duration.ofMinutes(1), config.escalationInterval());
        assertEquals(1000, config.maxAlerts());
        assertEquals(60, config.defaultSuppressionMinutes());
        assertTrue(config.enableEscalation());
        assertTrue(config.enableDeduplication());
        assertEquals(Duration.ofHours(24), config.retention());
    }

    @Test
    void environmentOverridesDefaults() {
        System.setProperty("ALERTING_MAX_ALERTS", "250");
        System.setProperty("ALERTING_ENABLE_ESCALATION", "false");

        AlertingConfig config = AlertingConfig.fromEnv();

        assertEquals(250, config.maxAlerts());
        assertFalse(config.enableEscalation());
    }

    @Test
    void rejectsInvalidValues() {
        AlertingConfig d = AlertingConfig.defaults();

        assertThrows(IllegalArgumentException.class, () -> d.withMaxAlerts(0));
        assertThrows(IllegalArgumentException.class, () -> new AlertingConfig(true, Duration.ZERO,
            d.escalationInterval(), 10, 60, true, true, d.retention()));
    }

    @Test
    void copiesWithChanges() {
        AlertingConfig config = AlertingConfig.defaults().withEscalation(false).withDeduplication(false);

        assertFalse(config.enableEscalation());
        assertFalse(config.enableDeduplication());
        assertEquals(1000, config.maxAlerts());
    }
}
