package io.foreman.core.resilience;

import java.time.Duration;

/**
 * Thrown instead of invoking the protected operation while a circuit is open.
 */
public class CircuitBreakerOpenException extends RuntimeException {

    private final String breakerName;
    private final Duration retryAfter;

    public CircuitBreakerOpenException(String breakerName, Duration retryAfter) {
        super("Circuit breaker '" + breakerName + "' is OPEN, retry after " + retryAfter.toMillis() + "ms");
        this.breakerName = breakerName;
        this.retryAfter = retryAfter;
    }

    public String breakerName() {
        return breakerName;
    }

    /**
     * @return time left until the breaker lets a probe through, never negative
     */
    public Duration retryAfter() {
        return retryAfter;
    }
}
