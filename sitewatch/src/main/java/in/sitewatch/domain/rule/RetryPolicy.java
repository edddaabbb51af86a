package in.sitewatch.domain.rule;

import java.time.Duration;

/**
 * Retry policy with exponential backoff for a single channel.
 *
 * The delay before retry {@code n} (0-based, taken from the alert's shared retry
 * counter) is {@code retryDelayMinutes * backoffMultiplier^n}.
 */
public record RetryPolicy(
    int maxRetries,
    double retryDelayMinutes,
    double backoffMultiplier
) {
    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries must not be negative");
        }
        if (retryDelayMinutes < 0) {
            throw new IllegalArgumentException("Retry delay must not be negative");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be at least 1.0");
        }
    }

    /**
     * Policy that never retries.
     */
    public static RetryPolicy none() {
        return new RetryPolicy(0, 0, 1.0);
    }

    /**
     * Default used when a rule file omits the policy.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 5, 2.0);
    }

    /**
     * Check if another retry attempt should be made.
     *
     * @param retryCount retries already spent on the alert
     */
    public boolean shouldRetry(int retryCount) {
        return retryCount < maxRetries;
    }

    /**
     * Get the delay before the next retry attempt.
     *
     * @param retryCount retries already spent on the alert
     */
    public Duration delayFor(int retryCount) {
        double millis = retryDelayMinutes * 60_000d * Math.pow(backoffMultiplier, retryCount);
        return Duration.ofMillis(Math.round(millis));
    }
}
