package io.foreman.api.scaling;

/**
 * Which rule produced a scaling decision.
 */
public enum ScalingTrigger {
    UTILIZATION,
    QUEUE_DEPTH,
    LATENCY,
    COOLDOWN,
    NONE
}
