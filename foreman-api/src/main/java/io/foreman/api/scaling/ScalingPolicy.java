package io.foreman.api.scaling;

import java.time.Duration;

/**
 * Autoscaling policy.
 * Thresholds are fractions (0.85 means 85% utilization). Call {@link #validate()}
 * before use; the autoscaler does so in its constructor.
 */
public final class ScalingPolicy {

    private int minPoolSize = 2;
    private int maxPoolSize = 10;
    private double targetUtilization = 0.7;
    private double scaleUpThreshold = 0.85;
    private double scaleDownThreshold = 0.5;
    private Duration cooldown = Duration.ofSeconds(60);
    private int scaleUpIncrement = 2;
    private int scaleDownDecrement = 1;
    private int queueDepthThreshold = 10;
    private boolean latencyScaling = false;

    private ScalingPolicy() {}

    public static ScalingPolicy create() {
        return new ScalingPolicy();
    }

    public ScalingPolicy minPoolSize(int minPoolSize) {
        this.minPoolSize = minPoolSize;
        return this;
    }

    public ScalingPolicy maxPoolSize(int maxPoolSize) {
        this.maxPoolSize = maxPoolSize;
        return this;
    }

    public ScalingPolicy targetUtilization(double targetUtilization) {
        this.targetUtilization = targetUtilization;
        return this;
    }

    public ScalingPolicy scaleUpThreshold(double scaleUpThreshold) {
        this.scaleUpThreshold = scaleUpThreshold;
        return this;
    }

    public ScalingPolicy scaleDownThreshold(double scaleDownThreshold) {
        this.scaleDownThreshold = scaleDownThreshold;
        return this;
    }

    public ScalingPolicy cooldown(Duration cooldown) {
        this.cooldown = cooldown;
        return this;
    }

    public ScalingPolicy scaleUpIncrement(int scaleUpIncrement) {
        this.scaleUpIncrement = scaleUpIncrement;
        return this;
    }

    public ScalingPolicy scaleDownDecrement(int scaleDownDecrement) {
        this.scaleDownDecrement = scaleDownDecrement;
        return this;
    }

    public ScalingPolicy queueDepthThreshold(int queueDepthThreshold) {
        this.queueDepthThreshold = queueDepthThreshold;
        return this;
    }

    /**
     * Let a degrading latency trend with a long p95 tail scale the pool up.
     * Off by default, in which case the latency rule always yields MAINTAIN.
     */
    public ScalingPolicy latencyScaling(boolean latencyScaling) {
        this.latencyScaling = latencyScaling;
        return this;
    }

    /**
     * @throws IllegalArgumentException on the first violated constraint
     */
    public ScalingPolicy validate() {
        if (minPoolSize < 1) {
            throw new IllegalArgumentException("minPoolSize must be >= 1, got " + minPoolSize);
        }
        if (maxPoolSize < minPoolSize) {
            throw new IllegalArgumentException(
                    "maxPoolSize (" + maxPoolSize + ") must be >= minPoolSize (" + minPoolSize + ")");
        }
        if (!(targetUtilization > 0.0 && targetUtilization < 1.0)) {
            throw new IllegalArgumentException("targetUtilization must be within (0, 1), got " + targetUtilization);
        }
        if (!(scaleUpThreshold > 0.0 && scaleUpThreshold <= 1.0)) {
            throw new IllegalArgumentException("scaleUpThreshold must be within (0, 1], got " + scaleUpThreshold);
        }
        if (!(scaleDownThreshold >= 0.0 && scaleDownThreshold < 1.0)) {
            throw new IllegalArgumentException("scaleDownThreshold must be within [0, 1), got " + scaleDownThreshold);
        }
        if (scaleDownThreshold >= scaleUpThreshold) {
            throw new IllegalArgumentException("scaleDownThreshold (" + scaleDownThreshold
                    + ") must be < scaleUpThreshold (" + scaleUpThreshold + ")");
        }
        if (cooldown == null || cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must be >= 0, got " + cooldown);
        }
        if (scaleUpIncrement < 1) {
            throw new IllegalArgumentException("scaleUpIncrement must be >= 1, got " + scaleUpIncrement);
        }
        if (scaleDownDecrement < 1) {
            throw new IllegalArgumentException("scaleDownDecrement must be >= 1, got " + scaleDownDecrement);
        }
        if (queueDepthThreshold < 0) {
            throw new IllegalArgumentException("queueDepthThreshold must be >= 0, got " + queueDepthThreshold);
        }
        return this;
    }

    public int minPoolSize() { return minPoolSize; }
    public int maxPoolSize() { return maxPoolSize; }
    public double targetUtilization() { return targetUtilization; }
    public double scaleUpThreshold() { return scaleUpThreshold; }
    public double scaleDownThreshold() { return scaleDownThreshold; }
    public Duration cooldown() { return cooldown; }
    public int scaleUpIncrement() { return scaleUpIncrement; }
    public int scaleDownDecrement() { return scaleDownDecrement; }
    public int queueDepthThreshold() { return queueDepthThreshold; }
    public boolean latencyScaling() { return latencyScaling; }
}
