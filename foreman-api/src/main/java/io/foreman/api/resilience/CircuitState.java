package io.foreman.api.resilience;

/**
 * Circuit breaker states.
 * <pre>
 * CLOSED --(failure threshold reached)--> OPEN
 * OPEN --(timeout elapsed since last failure)--> HALF_OPEN
 * HALF_OPEN --(success threshold reached)--> CLOSED
 * HALF_OPEN --(any failure)--> OPEN
 * </pre>
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
