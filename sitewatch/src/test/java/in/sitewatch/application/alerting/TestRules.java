package in.sitewatch.application.alerting;

import in.sitewatch.domain.alert.AlertSeverity;
import in.sitewatch.domain.channel.ChannelSettings;
import in.sitewatch.domain.rule.AlertCondition;
import in.sitewatch.domain.rule.AlertRule;
import in.sitewatch.domain.rule.ChannelConfig;
import in.sitewatch.domain.rule.ChannelType;
import in.sitewatch.domain.rule.ConditionOperator;
import in.sitewatch.domain.rule.EscalationGate;
import in.sitewatch.domain.rule.EscalationRule;
import in.sitewatch.domain.rule.RetryPolicy;

import java.util.List;

/**
 * Rule fixtures shared by the alerting tests.
 */
public final class TestRules {

    public static AlertCondition condition(String metric, ConditionOperator operator, Object threshold) {
        return new AlertCondition(metric, operator, threshold, 5, 0, 1);
    }

    public static AlertRule.Builder rule(String id, AlertSeverity severity) {
        return AlertRule.builder()
            .id(id)
            .name(id)
            .description("Test rule " + id)
            .severity(severity)
            .condition(condition("error.count", ConditionOperator.GTE, 5));
    }

    public static ChannelConfig webhook(RetryPolicy policy) {
        return ChannelConfig.of(ChannelType.WEBHOOK, new ChannelSettings.Webhook("http://localhost/hook"), policy);
    }

    public static ChannelConfig chat(RetryPolicy policy) {
        return ChannelConfig.of(ChannelType.CHAT, new ChannelSettings.Chat("http://localhost/chat", "#alerts"), policy);
    }

    public static ChannelConfig sms() {
        return ChannelConfig.of(ChannelType.SMS, new ChannelSettings.Sms(List.of("+1234567890")), RetryPolicy.none());
    }

    public static EscalationRule step(int level, int delayMinutes, EscalationGate gate, ChannelConfig... channels) {
        return new EscalationRule(level, delayMinutes, List.of(channels), gate);
    }

    /**
     * Retry policy with a millisecond-scale delay and no backoff.
     */
    public static RetryPolicy fastRetries(int maxRetries) {
        return new RetryPolicy(maxRetries, 0.0005, 1.0);
    }

    private TestRules() {}
}
