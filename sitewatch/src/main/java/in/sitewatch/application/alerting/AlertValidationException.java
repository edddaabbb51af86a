package in.sitewatch.application.alerting;

/**
 * Exception thrown when createAlert receives malformed input.
 */
public class AlertValidationException extends RuntimeException {

    private final String field;

    public AlertValidationException(String field, String message) {
        super(String.format("Invalid alert %s: %s", field, message));
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
