package io.foreman.core.metrics;

import io.foreman.api.metrics.LatencyTrend;
import io.foreman.api.metrics.MetricsCollector;
import io.foreman.api.metrics.PoolMetrics;
import io.foreman.api.metrics.Trend;
import io.foreman.api.metrics.WorkflowRecord;
import io.foreman.api.workflow.WorkflowPhase;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Metrics collector over a sliding window of recent workflows.
 * <p>
 * Keeps the last {@code windowSize} workflow records for percentiles, phase failure rates and
 * trends, plus lifetime counters that are never evicted. Every record is also published to a
 * Micrometer registry under {@code foreman.workflows} and {@code foreman.workflow.duration}.
 */
public class SlidingWindowMetricsCollector implements MetricsCollector {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowMetricsCollector.class);

    static final int DEFAULT_WINDOW_SIZE = 100;
    static final int QUEUE_HISTORY_SIZE = 20;

    private static final int QUEUE_TREND_MIN_SAMPLES = 5;
    private static final int THROUGHPUT_TREND_MIN_RECORDS = 20;
    private static final int LATENCY_TREND_MIN_RECORDS = 10;
    private static final Duration THROUGHPUT_RECENT_WINDOW = Duration.ofMinutes(5);

    private final int windowSize;
    private final Clock clock;
    private final MeterRegistry registry;
    private final Deque<WorkflowRecord> window = new ArrayDeque<>();
    private final Deque<Integer> queueDepthHistory = new ArrayDeque<>();

    private final Counter succeededCounter;
    private final Counter failedCounter;
    private final Counter retriedCounter;
    private final Timer durationTimer;

    private long totalProcessed;
    private long totalSucceeded;
    private long totalFailed;
    private long totalRetryAttempts;
    private long totalRetrySuccesses;
    private volatile double peakUtilization;

    private long generation;
    private long cachedGeneration = -1;
    private double[] cachedPercentiles;

    public SlidingWindowMetricsCollector() {
        this(DEFAULT_WINDOW_SIZE);
    }

    public SlidingWindowMetricsCollector(int windowSize) {
        this(windowSize, new SimpleMeterRegistry(), Clock.systemUTC());
    }

    public SlidingWindowMetricsCollector(int windowSize, MeterRegistry registry, Clock clock) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive, got " + windowSize);
        }
        this.windowSize = windowSize;
        this.registry = registry;
        this.clock = clock;

        this.succeededCounter = Counter.builder("foreman.workflows")
                .tag("outcome", "success")
                .register(registry);
        this.failedCounter = Counter.builder("foreman.workflows")
                .tag("outcome", "failure")
                .register(registry);
        this.retriedCounter = Counter.builder("foreman.workflows.retried")
                .register(registry);
        this.durationTimer = Timer.builder("foreman.workflow.duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
        Gauge.builder("foreman.pool.utilization.peak", this, c -> c.peakUtilization)
                .register(registry);
    }

    @Override
    public synchronized void recordWorkflow(String workflowId, double durationMs, boolean success,
                                            WorkflowPhase phase, int retryCount) {
        window.addLast(new WorkflowRecord(workflowId, durationMs, success, phase, retryCount, clock.instant()));
        if (window.size() > windowSize) {
            window.removeFirst();
        }
        generation++;

        totalProcessed++;
        if (success) {
            totalSucceeded++;
            succeededCounter.increment();
        } else {
            totalFailed++;
            failedCounter.increment();
        }
        if (retryCount > 0) {
            totalRetryAttempts++;
            retriedCounter.increment();
            if (success) {
                totalRetrySuccesses++;
            }
        }
        durationTimer.record(Math.round(durationMs), TimeUnit.MILLISECONDS);
        log.trace("Recorded workflow {}: success={}, {}ms, phase={}", workflowId, success, durationMs, phase);
    }

    @Override
    public synchronized void recordQueueDepth(int depth) {
        queueDepthHistory.addLast(depth);
        if (queueDepthHistory.size() > QUEUE_HISTORY_SIZE) {
            queueDepthHistory.removeFirst();
        }
    }

    @Override
    public synchronized PoolMetrics metrics(int poolSize, int activeCount, int queueDepth) {
        double utilization = poolSize > 0 ? (double) activeCount / poolSize * 100.0 : 0.0;
        if (utilization > peakUtilization) {
            peakUtilization = utilization;
        }
        recordQueueDepth(queueDepth);

        double[] percentiles = percentiles();
        double successRate = totalProcessed > 0 ? (double) totalSucceeded / totalProcessed * 100.0 : 0.0;
        double retrySuccessRate = totalRetryAttempts > 0
                ? (double) totalRetrySuccesses / totalRetryAttempts * 100.0
                : 0.0;

        return new PoolMetrics(
                poolSize,
                activeCount,
                poolSize - activeCount,
                utilization,
                peakUtilization,
                queueDepth,
                queueTrend(),
                totalProcessed,
                totalSucceeded,
                totalFailed,
                successRate,
                percentiles[0],
                percentiles[1],
                percentiles[2],
                percentiles[3],
                failureRateByPhase(),
                retrySuccessRate,
                throughputTrend(),
                latencyTrend()
        );
    }

    @Override
    public synchronized void resetPeakUtilization() {
        peakUtilization = 0.0;
    }

    @Override
    public int windowSize() {
        return windowSize;
    }

    public MeterRegistry registry() {
        return registry;
    }

    /**
     * @return the records currently in the window, oldest first
     */
    public synchronized List<WorkflowRecord> recentWorkflows() {
        return List.copyOf(window);
    }

    /**
     * p50, p95, p99 and mean of the window, recomputed only when a record was added since the last call.
     */
    private double[] percentiles() {
        if (window.isEmpty()) {
            return new double[]{0.0, 0.0, 0.0, 0.0};
        }
        if (cachedPercentiles != null && cachedGeneration == generation) {
            return cachedPercentiles;
        }
        double[] sorted = window.stream().mapToDouble(WorkflowRecord::durationMs).sorted().toArray();
        int n = sorted.length;
        double p50 = n % 2 == 1 ? sorted[n / 2] : (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
        double p95 = sorted[Math.min((int) (n * 0.95), n - 1)];
        double p99 = sorted[Math.min((int) (n * 0.99), n - 1)];
        double avg = Arrays.stream(sorted).average().orElse(0.0);

        cachedPercentiles = new double[]{p50, p95, p99, avg};
        cachedGeneration = generation;
        return cachedPercentiles;
    }

    private Map<String, Double> failureRateByPhase() {
        Map<String, int[]> counts = new LinkedHashMap<>();
        for (WorkflowRecord record : window) {
            String phase = record.phase() == null ? "unknown" : record.phase().key();
            int[] totals = counts.computeIfAbsent(phase, k -> new int[2]);
            totals[0]++;
            if (!record.success()) {
                totals[1]++;
            }
        }
        Map<String, Double> rates = new LinkedHashMap<>();
        counts.forEach((phase, totals) -> rates.put(phase, (double) totals[1] / totals[0] * 100.0));
        return rates;
    }

    private Trend queueTrend() {
        if (queueDepthHistory.size() < QUEUE_TREND_MIN_SAMPLES) {
            return Trend.STABLE;
        }
        List<Integer> samples = new ArrayList<>(queueDepthHistory);
        int mid = samples.size() / 2;
        double older = samples.subList(0, mid).stream().mapToInt(Integer::intValue).average().orElse(0.0);
        double recent = samples.subList(mid, samples.size()).stream().mapToInt(Integer::intValue).average().orElse(0.0);

        if (recent > older * 1.2) {
            return Trend.INCREASING;
        } else if (recent < older * 0.8) {
            return Trend.DECREASING;
        }
        return Trend.STABLE;
    }

    private Trend throughputTrend() {
        if (window.size() < THROUGHPUT_TREND_MIN_RECORDS) {
            return Trend.STABLE;
        }
        Instant cutoff = clock.instant().minus(THROUGHPUT_RECENT_WINDOW);
        long recentCount = window.stream().filter(r -> !r.timestamp().isBefore(cutoff)).count();
        long olderCount = window.size() - recentCount;

        // both sides per minute over the same five-minute span
        double recentRate = recentCount / 5.0;
        double olderRate = olderCount / 5.0;

        if (recentRate > olderRate * 1.3) {
            return Trend.INCREASING;
        } else if (recentRate < olderRate * 0.7 && olderRate > 0) {
            return Trend.DECREASING;
        }
        return Trend.STABLE;
    }

    private LatencyTrend latencyTrend() {
        if (window.size() < LATENCY_TREND_MIN_RECORDS) {
            return LatencyTrend.STABLE;
        }
        double[] durations = window.stream().mapToDouble(WorkflowRecord::durationMs).toArray();
        int mid = durations.length / 2;
        double older = Arrays.stream(durations, 0, mid).average().orElse(0.0);
        double recent = Arrays.stream(durations, mid, durations.length).average().orElse(0.0);

        if (recent > older * 1.15) {
            return LatencyTrend.DEGRADING;
        } else if (recent < older * 0.85) {
            return LatencyTrend.IMPROVING;
        }
        return LatencyTrend.STABLE;
    }
}
