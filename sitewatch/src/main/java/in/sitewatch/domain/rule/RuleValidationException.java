package in.sitewatch.domain.rule;

/**
 * Exception thrown when a rule definition is malformed.
 */
public class RuleValidationException extends RuntimeException {

    private final String ruleId;

    public RuleValidationException(String ruleId, String message) {
        super(String.format("[rule:%s] %s", ruleId, message));
        this.ruleId = ruleId;
    }

    public RuleValidationException(String ruleId, String message, Throwable cause) {
        super(String.format("[rule:%s] %s", ruleId, message), cause);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
