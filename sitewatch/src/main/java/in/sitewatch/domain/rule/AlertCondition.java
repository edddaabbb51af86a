package in.sitewatch.domain.rule;

/**
 * Metric condition evaluated by the rule engine.
 */
public record AlertCondition(
    String metric,
    ConditionOperator operator,
    Object threshold,              // Number or String
    int timeWindowMinutes,         // sampling window handed to the metrics source
    int evaluationIntervalMinutes, // minimum gap between evaluations of this rule
    int consecutiveFailures        // breaches in a row required before firing
) {
    public AlertCondition {
        if (metric == null || metric.isBlank()) {
            throw new IllegalArgumentException("Condition metric is required");
        }
        if (operator == null) {
            throw new IllegalArgumentException("Condition operator is required");
        }
        if (timeWindowMinutes < 0 || evaluationIntervalMinutes < 0) {
            throw new IllegalArgumentException("Condition windows must not be negative");
        }
        consecutiveFailures = Math.max(1, consecutiveFailures);
    }

    public boolean isBreached(Object sampledValue) {
        return operator.test(sampledValue, threshold);
    }
}
