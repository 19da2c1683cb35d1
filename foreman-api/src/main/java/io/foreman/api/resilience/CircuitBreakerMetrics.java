package io.foreman.api.resilience;

/**
 * Point-in-time view of a circuit breaker.
 *
 * @param failureRate failures divided by the number of outcomes in the recent-calls window
 * @param recentCalls number of outcomes currently in that window
 */
public record CircuitBreakerMetrics(
        String name,
        CircuitState state,
        int failureCount,
        int successCount,
        double failureRate,
        int recentCalls
) {}
