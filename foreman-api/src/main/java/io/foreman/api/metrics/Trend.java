package io.foreman.api.metrics;

/**
 * Coarse direction of a sampled quantity (queue depth, throughput).
 */
public enum Trend {
    INCREASING,
    STABLE,
    DECREASING
}
