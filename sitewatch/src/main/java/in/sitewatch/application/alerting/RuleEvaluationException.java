package in.sitewatch.application.alerting;

/**
 * Exception thrown when a rule's condition cannot be evaluated.
 */
public class RuleEvaluationException extends RuntimeException {

    private final String ruleId;
    private final String metric;

    public RuleEvaluationException(String ruleId, String metric, String message, Throwable cause) {
        super(String.format("[rule:%s] %s: %s", ruleId, metric, message), cause);
        this.ruleId = ruleId;
        this.metric = metric;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getMetric() {
        return metric;
    }
}
