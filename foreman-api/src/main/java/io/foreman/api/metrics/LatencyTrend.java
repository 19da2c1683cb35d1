package io.foreman.api.metrics;

/**
 * Direction of workflow latency. Lower latency is {@link #IMPROVING}.
 */
public enum LatencyTrend {
    IMPROVING,
    STABLE,
    DEGRADING
}
