package in.sitewatch.infrastructure.metrics;

import in.sitewatch.domain.alert.AlertSeverity;
import in.sitewatch.domain.alert.AlertStatistics;
import in.sitewatch.domain.rule.ChannelType;

final class NoopAlertingMetrics implements AlertingMetrics {
    static final NoopAlertingMetrics INSTANCE = new NoopAlertingMetrics();

    private NoopAlertingMetrics() {}

    @Override
    public void recordAlertCreated(AlertSeverity severity) {}

    @Override
    public void recordAlertDeduplicated(AlertSeverity severity) {}

    @Override
    public void recordDelivery(ChannelType channelType, boolean success, boolean escalation) {}

    @Override
    public void recordRetryScheduled(ChannelType channelType) {}

    @Override
    public void recordDeliveryDropped(ChannelType channelType) {}

    @Override
    public void recordEscalation(String ruleId, int level) {}

    @Override
    public void recordRuleTriggered(String ruleId) {}

    @Override
    public void recordEvaluationFailure(String ruleId) {}

    @Override
    public void updateAlertCounts(AlertStatistics statistics) {}
}
