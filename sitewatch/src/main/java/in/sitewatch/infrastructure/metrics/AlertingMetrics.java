package in.sitewatch.infrastructure.metrics;

import in.sitewatch.domain.alert.AlertSeverity;
import in.sitewatch.domain.alert.AlertStatistics;
import in.sitewatch.domain.rule.ChannelType;

/**
 * Alerting engine metrics interface.
 *
 * Implementations can publish to Prometheus, Grafana, CloudWatch, etc.
 *
 * Key metrics:
 * - Alerts created / deduplicated by severity
 * - Notification success/failure per channel
 * - Retries scheduled and deliveries dropped after exhausting retries
 * - Escalations per rule
 * - Rule evaluation failures
 */
public interface AlertingMetrics {

    /**
     * Record a newly stored alert.
     */
    void recordAlertCreated(AlertSeverity severity);

    /**
     * Record an alert signal collapsed into an existing alert.
     */
    void recordAlertDeduplicated(AlertSeverity severity);

    /**
     * Record a send attempt.
     *
     * @param channelType channel the send went through
     * @param success whether the handler returned normally
     * @param escalation whether this was an escalation send
     */
    void recordDelivery(ChannelType channelType, boolean success, boolean escalation);

    /**
     * Record a retry being scheduled.
     */
    void recordRetryScheduled(ChannelType channelType);

    /**
     * Record a notification dropped after its retry budget was spent.
     */
    void recordDeliveryDropped(ChannelType channelType);

    /**
     * Record an escalation step firing.
     */
    void recordEscalation(String ruleId, int level);

    /**
     * Record a rule firing from the condition evaluator.
     */
    void recordRuleTriggered(String ruleId);

    /**
     * Record a rule evaluation failure.
     */
    void recordEvaluationFailure(String ruleId);

    /**
     * Publish current store counts.
     */
    void updateAlertCounts(AlertStatistics statistics);

    /**
     * Metrics sink that discards everything.
     */
    static AlertingMetrics noop() {
        return NoopAlertingMetrics.INSTANCE;
    }
}
