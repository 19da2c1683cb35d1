package io.foreman.api.metrics;

import java.util.Map;

/**
 * Aggregate snapshot of pool state, windowed statistics and trends.
 * Cumulative counters cover the process lifetime; percentiles and phase failure rates
 * cover only the current sliding window.
 */
public record PoolMetrics(
        int poolSize,
        int activeCount,
        int availableSlots,
        double utilizationPct,
        double peakUtilizationPct,
        int queueDepth,
        Trend queueDepthTrend,
        long totalProcessed,
        long totalSucceeded,
        long totalFailed,
        double successRatePct,
        double p50DurationMs,
        double p95DurationMs,
        double p99DurationMs,
        double avgDurationMs,
        Map<String, Double> failureRateByPhase,
        double retrySuccessRatePct,
        Trend throughputTrend,
        LatencyTrend latencyTrend
) {
    public PoolMetrics {
        failureRateByPhase = failureRateByPhase == null ? Map.of() : Map.copyOf(failureRateByPhase);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder, mostly useful for feeding the autoscaler and health monitor
     * with hand-made snapshots.
     */
    public static final class Builder {
        private int poolSize = 10;
        private int activeCount;
        private Integer availableSlots;
        private double utilizationPct;
        private double peakUtilizationPct;
        private int queueDepth;
        private Trend queueDepthTrend = Trend.STABLE;
        private long totalProcessed;
        private long totalSucceeded;
        private long totalFailed;
        private double successRatePct = 100.0;
        private double p50DurationMs;
        private double p95DurationMs;
        private double p99DurationMs;
        private double avgDurationMs;
        private Map<String, Double> failureRateByPhase = Map.of();
        private double retrySuccessRatePct;
        private Trend throughputTrend = Trend.STABLE;
        private LatencyTrend latencyTrend = LatencyTrend.STABLE;

        private Builder() {}

        public Builder poolSize(int poolSize) { this.poolSize = poolSize; return this; }
        public Builder activeCount(int activeCount) { this.activeCount = activeCount; return this; }
        public Builder availableSlots(int availableSlots) { this.availableSlots = availableSlots; return this; }
        public Builder utilizationPct(double utilizationPct) { this.utilizationPct = utilizationPct; return this; }
        public Builder peakUtilizationPct(double peakUtilizationPct) { this.peakUtilizationPct = peakUtilizationPct; return this; }
        public Builder queueDepth(int queueDepth) { this.queueDepth = queueDepth; return this; }
        public Builder queueDepthTrend(Trend queueDepthTrend) { this.queueDepthTrend = queueDepthTrend; return this; }
        public Builder totalProcessed(long totalProcessed) { this.totalProcessed = totalProcessed; return this; }
        public Builder totalSucceeded(long totalSucceeded) { this.totalSucceeded = totalSucceeded; return this; }
        public Builder totalFailed(long totalFailed) { this.totalFailed = totalFailed; return this; }
        public Builder successRatePct(double successRatePct) { this.successRatePct = successRatePct; return this; }
        public Builder p50DurationMs(double p50DurationMs) { this.p50DurationMs = p50DurationMs; return this; }
        public Builder p95DurationMs(double p95DurationMs) { this.p95DurationMs = p95DurationMs; return this; }
        public Builder p99DurationMs(double p99DurationMs) { this.p99DurationMs = p99DurationMs; return this; }
        public Builder avgDurationMs(double avgDurationMs) { this.avgDurationMs = avgDurationMs; return this; }
        public Builder failureRateByPhase(Map<String, Double> failureRateByPhase) { this.failureRateByPhase = failureRateByPhase; return this; }
        public Builder retrySuccessRatePct(double retrySuccessRatePct) { this.retrySuccessRatePct = retrySuccessRatePct; return this; }
        public Builder throughputTrend(Trend throughputTrend) { this.throughputTrend = throughputTrend; return this; }
        public Builder latencyTrend(LatencyTrend latencyTrend) { this.latencyTrend = latencyTrend; return this; }

        public PoolMetrics build() {
            int slots = availableSlots != null ? availableSlots : poolSize - activeCount;
            return new PoolMetrics(poolSize, activeCount, slots, utilizationPct, peakUtilizationPct,
                    queueDepth, queueDepthTrend, totalProcessed, totalSucceeded, totalFailed,
                    successRatePct, p50DurationMs, p95DurationMs, p99DurationMs, avgDurationMs,
                    failureRateByPhase, retrySuccessRatePct, throughputTrend, latencyTrend);
        }
    }
}
