package io.foreman.api.pool;

import java.time.Duration;

/**
 * Configuration for the supervisor loop that feeds, scales and watches a pool.
 */
public final class SupervisorConfig {

    private Duration evaluationInterval = Duration.ofSeconds(5);
    private boolean autoscalingEnabled = true;
    private int reportedScalingDecisions = 10;

    private SupervisorConfig() {}

    public static SupervisorConfig create() {
        return new SupervisorConfig();
    }

    public SupervisorConfig evaluationInterval(Duration evaluationInterval) {
        if (evaluationInterval == null || evaluationInterval.isZero() || evaluationInterval.isNegative()) {
            throw new IllegalArgumentException("evaluationInterval must be positive");
        }
        this.evaluationInterval = evaluationInterval;
        return this;
    }

    /**
     * When disabled, scaling decisions are still evaluated and reported but never applied.
     */
    public SupervisorConfig autoscalingEnabled(boolean autoscalingEnabled) {
        this.autoscalingEnabled = autoscalingEnabled;
        return this;
    }

    /**
     * How many recent scaling decisions each status report carries.
     */
    public SupervisorConfig reportedScalingDecisions(int reportedScalingDecisions) {
        if (reportedScalingDecisions < 0) {
            throw new IllegalArgumentException("reportedScalingDecisions must be >= 0");
        }
        this.reportedScalingDecisions = reportedScalingDecisions;
        return this;
    }

    public Duration evaluationInterval() { return evaluationInterval; }
    public boolean autoscalingEnabled() { return autoscalingEnabled; }
    public int reportedScalingDecisions() { return reportedScalingDecisions; }
}
