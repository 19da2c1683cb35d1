package io.foreman.api.resilience;

import java.time.Duration;

/**
 * Configuration for a circuit breaker.
 */
public final class CircuitBreakerConfig {

    private int failureThreshold = 5;
    private int successThreshold = 2;
    private Duration timeout = Duration.ofSeconds(60);
    private int windowSize = 10;

    private CircuitBreakerConfig() {}

    public static CircuitBreakerConfig create() {
        return new CircuitBreakerConfig();
    }

    /**
     * Failures since the last transition to CLOSED that open the circuit.
     */
    public CircuitBreakerConfig failureThreshold(int failureThreshold) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got " + failureThreshold);
        }
        this.failureThreshold = failureThreshold;
        return this;
    }

    /**
     * Consecutive HALF_OPEN successes that close the circuit again.
     */
    public CircuitBreakerConfig successThreshold(int successThreshold) {
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1, got " + successThreshold);
        }
        this.successThreshold = successThreshold;
        return this;
    }

    /**
     * Time after the last failure before an OPEN circuit lets a probe through.
     */
    public CircuitBreakerConfig timeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0, got " + timeout);
        }
        this.timeout = timeout;
        return this;
    }

    /**
     * Number of recent outcomes kept for failure-rate reporting.
     */
    public CircuitBreakerConfig windowSize(int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got " + windowSize);
        }
        this.windowSize = windowSize;
        return this;
    }

    public int failureThreshold() { return failureThreshold; }
    public int successThreshold() { return successThreshold; }
    public Duration timeout() { return timeout; }
    public int windowSize() { return windowSize; }
}
