package io.foreman.api.health;

import java.util.List;
import java.util.Map;

/**
 * Result of one health assessment.
 * Recommendations are ordered critical first, then warnings, then informational hints.
 */
public record HealthReport(
        HealthStatus status,
        List<Alert> alerts,
        Map<String, Object> metricsSummary,
        List<String> recommendations
) {
    public HealthReport {
        alerts = List.copyOf(alerts);
        metricsSummary = Map.copyOf(metricsSummary);
        recommendations = List.copyOf(recommendations);
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
