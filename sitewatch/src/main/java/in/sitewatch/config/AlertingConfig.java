package in.sitewatch.config;

import in.sitewatch.util.Env;

import java.time.Duration;

/**
 * Engine-wide settings for the alerting facade.
 */
public record AlertingConfig(
    boolean enabled,                   // false = alerts are stored but timers never start
    Duration evaluationInterval,       // rule evaluation timer period
    Duration escalationInterval,       // escalation pass timer period
    int maxAlerts,                     // store size that triggers old-alert cleanup
    int defaultSuppressionMinutes,     // used by suppressAlert(id)
    boolean enableEscalation,
    boolean enableDeduplication,
    Duration retention                 // how long resolved alerts are kept
) {
    public AlertingConfig {
        if (evaluationInterval == null || evaluationInterval.isZero() || evaluationInterval.isNegative()) {
            throw new IllegalArgumentException("Evaluation interval must be positive");
        }
        if (escalationInterval == null || escalationInterval.isZero() || escalationInterval.isNegative()) {
            throw new IllegalArgumentException("Escalation interval must be positive");
        }
        if (maxAlerts <= 0) {
            throw new IllegalArgumentException("Max alerts must be positive");
        }
        if (defaultSuppressionMinutes < 0) {
            throw new IllegalArgumentException("Default suppression must not be negative");
        }
        if (retention == null || retention.isNegative()) {
            throw new IllegalArgumentException("Retention must not be negative");
        }
    }

    /**
     * Default configuration.
     */
    public static AlertingConfig defaults() {
        return new AlertingConfig(
            true,
            Duration.ofSeconds(60),  // Evaluate rules every minute
            Duration.ofSeconds(60),  // Check escalations every minute
            1000,                    // Keep up to 1000 alerts before cleanup
            60,                      // Suppress for an hour by default
            true,
            true,
            Duration.ofHours(24)     // Keep resolved alerts for a day
        );
    }

    /**
     * Defaults overridden by ALERTING_* environment variables.
     */
    public static AlertingConfig fromEnv() {
        AlertingConfig d = defaults();
        return new AlertingConfig(
            Env.getBool("ALERTING_ENABLED", d.enabled()),
            Duration.ofSeconds(Env.getInt("ALERTING_EVALUATION_INTERVAL_SECONDS", (int) d.evaluationInterval().toSeconds())),
            Duration.ofSeconds(Env.getInt("ALERTING_ESCALATION_INTERVAL_SECONDS", (int) d.escalationInterval().toSeconds())),
            Env.getInt("ALERTING_MAX_ALERTS", d.maxAlerts()),
            Env.getInt("ALERTING_DEFAULT_SUPPRESSION_MINUTES", d.defaultSuppressionMinutes()),
            Env.getBool("ALERTING_ENABLE_ESCALATION", d.enableEscalation()),
            Env.getBool("ALERTING_ENABLE_DEDUPLICATION", d.enableDeduplication()),
            Duration.ofHours(Env.getInt("ALERTING_RETENTION_HOURS", (int) d.retention().toHours()))
        );
    }

    public AlertingConfig withEscalation(boolean enableEscalation) {
        return new AlertingConfig(enabled, evaluationInterval, escalationInterval, maxAlerts,
            defaultSuppressionMinutes, enableEscalation, enableDeduplication, retention);
    }

    public AlertingConfig withDeduplication(boolean enableDeduplication) {
        return new AlertingConfig(enabled, evaluationInterval, escalationInterval, maxAlerts,
            defaultSuppressionMinutes, enableEscalation, enableDeduplication, retention);
    }

    public AlertingConfig withMaxAlerts(int maxAlerts) {
        return new AlertingConfig(enabled, evaluationInterval, escalationInterval, maxAlerts,
            defaultSuppressionMinutes, enableEscalation, enableDeduplication, retention);
    }
}
