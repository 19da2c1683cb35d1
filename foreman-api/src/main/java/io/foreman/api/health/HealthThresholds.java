package io.foreman.api.health;

/**
 * Warning and critical thresholds for the health monitor.
 * <p>
 * Percentages are 0..100. For the success rate the alert fires when the observed value is
 * at or <em>below</em> the threshold, so its warning level must be above its critical level.
 * Every other metric alerts at or above its threshold.
 */
public final class HealthThresholds {

    private double utilizationWarningPct = 80.0;
    private double utilizationCriticalPct = 95.0;
    private double successRateWarningPct = 90.0;
    private double successRateCriticalPct = 75.0;
    private double p95LatencyWarningMs = 60_000.0;
    private double p95LatencyCriticalMs = 120_000.0;
    private int queueDepthWarning = 10;
    private int queueDepthCritical = 25;
    private double failureRateWarningPct = 10.0;
    private double failureRateCriticalPct = 25.0;

    private HealthThresholds() {}

    public static HealthThresholds create() {
        return new HealthThresholds();
    }

    public HealthThresholds utilization(double warningPct, double criticalPct) {
        this.utilizationWarningPct = warningPct;
        this.utilizationCriticalPct = criticalPct;
        return this;
    }

    public HealthThresholds successRate(double warningPct, double criticalPct) {
        this.successRateWarningPct = warningPct;
        this.successRateCriticalPct = criticalPct;
        return this;
    }

    public HealthThresholds p95Latency(double warningMs, double criticalMs) {
        this.p95LatencyWarningMs = warningMs;
        this.p95LatencyCriticalMs = criticalMs;
        return this;
    }

    public HealthThresholds queueDepth(int warning, int critical) {
        this.queueDepthWarning = warning;
        this.queueDepthCritical = critical;
        return this;
    }

    public HealthThresholds failureRate(double warningPct, double criticalPct) {
        this.failureRateWarningPct = warningPct;
        this.failureRateCriticalPct = criticalPct;
        return this;
    }

    /**
     * @throws IllegalArgumentException if a warning level is not strictly before its critical level,
     *                                  or a percentage or depth is out of range
     */
    public HealthThresholds validate() {
        if (utilizationWarningPct >= utilizationCriticalPct) {
            throw new IllegalArgumentException("utilization warning (" + utilizationWarningPct
                    + ") must be < critical (" + utilizationCriticalPct + ")");
        }
        if (successRateWarningPct <= successRateCriticalPct) {
            throw new IllegalArgumentException("success rate warning (" + successRateWarningPct
                    + ") must be > critical (" + successRateCriticalPct + ")");
        }
        if (p95LatencyWarningMs >= p95LatencyCriticalMs) {
            throw new IllegalArgumentException("p95 latency warning (" + p95LatencyWarningMs
                    + "ms) must be < critical (" + p95LatencyCriticalMs + "ms)");
        }
        if (queueDepthWarning >= queueDepthCritical) {
            throw new IllegalArgumentException("queue depth warning (" + queueDepthWarning
                    + ") must be < critical (" + queueDepthCritical + ")");
        }
        if (failureRateWarningPct >= failureRateCriticalPct) {
            throw new IllegalArgumentException("failure rate warning (" + failureRateWarningPct
                    + ") must be < critical (" + failureRateCriticalPct + ")");
        }
        requirePercent("utilization warning", utilizationWarningPct);
        requirePercent("utilization critical", utilizationCriticalPct);
        requirePercent("success rate warning", successRateWarningPct);
        requirePercent("success rate critical", successRateCriticalPct);
        requirePercent("failure rate warning", failureRateWarningPct);
        requirePercent("failure rate critical", failureRateCriticalPct);
        if (queueDepthWarning < 0) {
            throw new IllegalArgumentException("queue depth warning must be >= 0, got " + queueDepthWarning);
        }
        return this;
    }

    private static void requirePercent(String name, double value) {
        if (value < 0.0 || value > 100.0) {
            throw new IllegalArgumentException(name + " must be within 0-100, got " + value);
        }
    }

    public double utilizationWarningPct() { return utilizationWarningPct; }
    public double utilizationCriticalPct() { return utilizationCriticalPct; }
    public double successRateWarningPct() { return successRateWarningPct; }
    public double successRateCriticalPct() { return successRateCriticalPct; }
    public double p95LatencyWarningMs() { return p95LatencyWarningMs; }
    public double p95LatencyCriticalMs() { return p95LatencyCriticalMs; }
    public int queueDepthWarning() { return queueDepthWarning; }
    public int queueDepthCritical() { return queueDepthCritical; }
    public double failureRateWarningPct() { return failureRateWarningPct; }
    public double failureRateCriticalPct() { return failureRateCriticalPct; }
}
