package io.foreman.api.health;

/**
 * A threshold breach with an operator-facing recommendation.
 *
 * @param metric       the metric that breached, e.g. {@code pool_utilization} or {@code failure_rate_guardian_review}
 * @param currentValue the observed value
 * @param threshold    the threshold that was crossed
 */
public record Alert(
        AlertSeverity severity,
        String metric,
        double currentValue,
        double threshold,
        String message,
        String recommendation
) {
    public boolean isCritical() {
        return severity == AlertSeverity.CRITICAL;
    }
}
