package in.sitewatch.application.port.output;

/**
 * Source of sampled metric values for rule conditions.
 *
 * Implemented by the collaborator that aggregates raw signals (APM, health checks,
 * web vitals). The alerting core only reads from it.
 */
@FunctionalInterface
public interface MetricsSource {

    /**
     * Sample a metric over a trailing window.
     *
     * @param metric metric name, e.g. {@code error.count}
     * @param timeWindowMinutes trailing window to aggregate over
     * @return a Number or String value; null when the metric has no data
     */
    Object sample(String metric, int timeWindowMinutes);
}
