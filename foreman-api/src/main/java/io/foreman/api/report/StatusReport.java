package io.foreman.api.report;

import io.foreman.api.health.HealthReport;
import io.foreman.api.metrics.PoolMetrics;
import io.foreman.api.resilience.CircuitBreakerMetrics;
import io.foreman.api.scaling.ScalingDecision;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the pool published by the supervisor.
 */
public record StatusReport(
        Instant capturedAt,
        PoolMetrics metrics,
        HealthReport health,
        List<ScalingDecision> recentScalingDecisions,
        List<CircuitBreakerMetrics> circuitBreakers
) {
    public StatusReport {
        recentScalingDecisions = List.copyOf(recentScalingDecisions);
        circuitBreakers = List.copyOf(circuitBreakers);
    }
}
