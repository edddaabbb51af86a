package in.sitewatch.infrastructure.metrics;

import in.sitewatch.domain.alert.AlertSeverity;
import in.sitewatch.domain.alert.AlertStatistics;
import in.sitewatch.domain.rule.ChannelType;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Prometheus implementation of AlertingMetrics interface.
 *
 * Key Metrics:
 * - alerts_created_total{severity} - Alerts stored
 * - alerts_deduplicated_total{severity} - Signals collapsed into an existing alert
 * - alert_notifications_total{channel, status, kind} - Send attempts
 * - alert_notification_retries_total{channel} - Retries scheduled
 * - alert_notifications_dropped_total{channel} - Sends abandoned after retries
 * - alert_escalations_total{rule, level} - Escalation steps fired
 * - alert_rule_triggers_total{rule} - Rule engine firings
 * - alert_rule_evaluation_failures_total{rule} - Rule evaluation errors
 * - alerts_current{status} / alerts_current_by_severity{severity} - Store counts
 */
public class PrometheusAlertingMetrics implements AlertingMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusAlertingMetrics.class);

    private final CollectorRegistry registry;

    private final Counter alertsCreated;
    private final Counter alertsDeduplicated;
    private final Counter notifications;
    private final Counter retries;
    private final Counter dropped;
    private final Counter escalations;
    private final Counter ruleTriggers;
    private final Counter evaluationFailures;
    private final Gauge currentByStatus;
    private final Gauge currentBySeverity;

    public PrometheusAlertingMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusAlertingMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.alertsCreated = Counter.build()
            .name("alerts_created_total")
            .help("Total number of alerts stored")
            .labelNames("severity")
            .register(registry);

        this.alertsDeduplicated = Counter.build()
            .name("alerts_deduplicated_total")
            .help("Total number of alert signals collapsed into an existing alert")
            .labelNames("severity")
            .register(registry);

        this.notifications = Counter.build()
            .name("alert_notifications_total")
            .help("Total number of notification send attempts")
            .labelNames("channel", "status", "kind")
            .register(registry);

        this.retries = Counter.build()
            .name("alert_notification_retries_total")
            .help("Total number of notification retries scheduled")
            .labelNames("channel")
            .register(registry);

        this.dropped = Counter.build()
            .name("alert_notifications_dropped_total")
            .help("Total number of notifications dropped after exhausting retries")
            .labelNames("channel")
            .register(registry);

        this.escalations = Counter.build()
            .name("alert_escalations_total")
            .help("Total number of escalation steps fired")
            .labelNames("rule", "level")
            .register(registry);

        this.ruleTriggers = Counter.build()
            .name("alert_rule_triggers_total")
            .help("Total number of rule engine firings")
            .labelNames("rule")
            .register(registry);

        this.evaluationFailures = Counter.build()
            .name("alert_rule_evaluation_failures_total")
            .help("Total number of rule evaluation failures")
            .labelNames("rule")
            .register(registry);

        this.currentByStatus = Gauge.build()
            .name("alerts_current")
            .help("Alerts currently held in the store by status")
            .labelNames("status")
            .register(registry);

        this.currentBySeverity = Gauge.build()
            .name("alerts_current_by_severity")
            .help("Alerts currently held in the store by severity")
            .labelNames("severity")
            .register(registry);

        log.info("[PrometheusAlertingMetrics] Initialized");
    }

    @Override
    public void recordAlertCreated(AlertSeverity severity) {
        alertsCreated.labels(severity.wireName()).inc();
    }

    @Override
    public void recordAlertDeduplicated(AlertSeverity severity) {
        alertsDeduplicated.labels(severity.wireName()).inc();
    }

    @Override
    public void recordDelivery(ChannelType channelType, boolean success, boolean escalation) {
        notifications.labels(
            channelType.wireName(),
            success ? "success" : "failure",
            escalation ? "escalation" : "initial"
        ).inc();
    }

    @Override
    public void recordRetryScheduled(ChannelType channelType) {
        retries.labels(channelType.wireName()).inc();
    }

    @Override
    public void recordDeliveryDropped(ChannelType channelType) {
        dropped.labels(channelType.wireName()).inc();
    }

    @Override
    public void recordEscalation(String ruleId, int level) {
        escalations.labels(ruleId, String.valueOf(level)).inc();
    }

    @Override
    public void recordRuleTriggered(String ruleId) {
        ruleTriggers.labels(ruleId).inc();
    }

    @Override
    public void recordEvaluationFailure(String ruleId) {
        evaluationFailures.labels(ruleId).inc();
    }

    @Override
    public void updateAlertCounts(AlertStatistics statistics) {
        currentByStatus.labels("active").set(statistics.active());
        currentByStatus.labels("acknowledged").set(statistics.acknowledged());
        currentByStatus.labels("resolved").set(statistics.resolved());
        currentByStatus.labels("suppressed").set(statistics.suppressed());
        for (Map.Entry<AlertSeverity, Integer> entry : statistics.bySeverity().entrySet()) {
            currentBySeverity.labels(entry.getKey().wireName()).set(entry.getValue());
        }
    }

    /**
     * Get the Prometheus registry for the /metrics endpoint.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
