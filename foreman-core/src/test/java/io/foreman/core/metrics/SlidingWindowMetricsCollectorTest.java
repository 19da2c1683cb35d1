package io.foreman.core.metrics;

import io.foreman.api.metrics.LatencyTrend;
import io.foreman.api.metrics.PoolMetrics;
import io.foreman.api.metrics.Trend;
import io.foreman.api.workflow.WorkflowPhase;
import io.foreman.core.MutableClock;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SlidingWindowMetricsCollectorTest {

    private SimpleMeterRegistry registry;
    private MutableClock clock;
    private SlidingWindowMetricsCollector collector;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        clock = new MutableClock();
        collector = new SlidingWindowMetricsCollector(100, registry, clock);
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    private void record(String id, double durationMs, boolean success) {
        collector.recordWorkflow(id, durationMs, success, WorkflowPhase.COMPLETE, 0);
    }

    // --- Construction ---

    @Test
    void shouldCreateWithDefaults() {
        var defaultCollector = new SlidingWindowMetricsCollector();
        assertThat(defaultCollector.windowSize()).isEqualTo(100);
        assertThat(defaultCollector.registry()).isNotNull();
    }

    @Test
    void shouldRejectNonPositiveWindow() {
        assertThatThrownBy(() -> new SlidingWindowMetricsCollector(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // --- Empty window ---

    @Test
    void shouldReportZerosForEmptyWindow() {
        PoolMetrics metrics = collector.metrics(5, 0, 0);

        assertThat(metrics.p50DurationMs()).isZero();
        assertThat(metrics.p95DurationMs()).isZero();
        assertThat(metrics.p99DurationMs()).isZero();
        assertThat(metrics.avgDurationMs()).isZero();
        assertThat(metrics.successRatePct()).isZero();
        assertThat(metrics.retrySuccessRatePct()).isZero();
        assertThat(metrics.failureRateByPhase()).isEmpty();
        assertThat(metrics.queueDepthTrend()).isEqualTo(Trend.STABLE);
        assertThat(metrics.throughputTrend()).isEqualTo(Trend.STABLE);
        assertThat(metrics.latencyTrend()).isEqualTo(LatencyTrend.STABLE);
    }

    // --- Utilization ---

    @Test
    void shouldComputeUtilizationAndSlots() {
        PoolMetrics metrics = collector.metrics(4, 3, 0);

        assertThat(metrics.utilizationPct()).isCloseTo(75.0, within(1e-9));
        assertThat(metrics.availableSlots()).isEqualTo(1);
        assertThat(metrics.poolSize()).isEqualTo(4);
    }

    @Test
    void shouldReportZeroUtilizationForEmptyPool() {
        assertThat(collector.metrics(0, 0, 0).utilizationPct()).isZero();
    }

    @Test
    void shouldTrackPeakUtilizationUntilReset() {
        collector.metrics(10, 9, 0);
        PoolMetrics later = collector.metrics(10, 2, 0);
        assertThat(later.peakUtilizationPct()).isCloseTo(90.0, within(1e-9));

        collector.resetPeakUtilization();
        assertThat(collector.metrics(10, 2, 0).peakUtilizationPct()).isCloseTo(20.0, within(1e-9));
    }

    // --- Percentiles ---

    @Test
    void shouldEvictOldestRecordsBeyondWindow() {
        for (int i = 1; i <= 101; i++) {
            record("wf-" + i, i, true);
        }

        PoolMetrics metrics = collector.metrics(10, 0, 0);
        assertThat(collector.recentWorkflows()).hasSize(100);
        assertThat(collector.recentWorkflows().get(0).workflowId()).isEqualTo("wf-2");

        // window holds durations 2..101
        assertThat(metrics.p50DurationMs()).isCloseTo(51.5, within(1e-9));
        assertThat(metrics.p95DurationMs()).isCloseTo(97.0, within(1e-9));
        assertThat(metrics.p99DurationMs()).isCloseTo(101.0, within(1e-9));
        assertThat(metrics.avgDurationMs()).isCloseTo(51.5, within(1e-9));
        assertThat(metrics.totalProcessed()).isEqualTo(101);
    }

    @Test
    void shouldUseMiddleValueForOddCount() {
        record("a", 30, true);
        record("b", 10, true);
        record("c", 20, true);

        PoolMetrics metrics = collector.metrics(10, 0, 0);
        assertThat(metrics.p50DurationMs()).isEqualTo(20.0);
        assertThat(metrics.p95DurationMs()).isEqualTo(30.0);
        assertThat(metrics.p99DurationMs()).isEqualTo(30.0);
    }

    @Test
    void shouldRefreshPercentilesAfterNewRecord() {
        record("a", 100, true);
        assertThat(collector.metrics(10, 0, 0).p50DurationMs()).isEqualTo(100.0);

        record("b", 300, true);
        assertThat(collector.metrics(10, 0, 0).p50DurationMs()).isEqualTo(200.0);
    }

    // --- Counters ---

    @Test
    void shouldKeepCumulativeCountersAndSuccessRate() {
        record("a", 10, true);
        record("b", 10, true);
        record("c", 10, true);
        record("d", 10, false);

        PoolMetrics metrics = collector.metrics(10, 0, 0);
        assertThat(metrics.totalSucceeded()).isEqualTo(3);
        assertThat(metrics.totalFailed()).isEqualTo(1);
        assertThat(metrics.successRatePct()).isCloseTo(75.0, within(1e-9));
    }

    @Test
    void shouldComputeRetrySuccessRateOnlyFromRetriedWorkflows() {
        collector.recordWorkflow("a", 10, true, WorkflowPhase.COMPLETE, 0);
        collector.recordWorkflow("b", 10, true, WorkflowPhase.COMPLETE, 2);
        collector.recordWorkflow("c", 10, false, WorkflowPhase.GUARDIAN_REVIEW, 3);

        assertThat(collector.metrics(10, 0, 0).retrySuccessRatePct()).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void shouldComputeFailureRateByPhase() {
        collector.recordWorkflow("a", 10, false, WorkflowPhase.GUARDIAN_REVIEW, 0);
        collector.recordWorkflow("b", 10, true, WorkflowPhase.GUARDIAN_REVIEW, 0);
        collector.recordWorkflow("c", 10, true, WorkflowPhase.COMPLETE, 0);
        collector.recordWorkflow("d", 10, false, null, 0);

        PoolMetrics metrics = collector.metrics(10, 0, 0);
        assertThat(metrics.failureRateByPhase())
                .containsEntry("guardian_review", 50.0)
                .containsEntry("complete", 0.0)
                .containsEntry("unknown", 100.0);
    }

    // --- Trends ---

    @Test
    void shouldDetectIncreasingQueueTrend() {
        for (int depth : new int[]{1, 1, 2, 8, 9}) {
            collector.recordQueueDepth(depth);
        }
        assertThat(collector.metrics(10, 0, 10).queueDepthTrend()).isEqualTo(Trend.INCREASING);
    }

    @Test
    void shouldDetectDecreasingQueueTrend() {
        for (int depth : new int[]{20, 20, 18, 5, 4}) {
            collector.recordQueueDepth(depth);
        }
        assertThat(collector.metrics(10, 0, 2).queueDepthTrend()).isEqualTo(Trend.DECREASING);
    }

    @Test
    void shouldStayStableWithFewQueueSamples() {
        collector.recordQueueDepth(0);
        collector.recordQueueDepth(50);
        assertThat(collector.metrics(10, 0, 100).queueDepthTrend()).isEqualTo(Trend.STABLE);
    }

    @Test
    void shouldDetectDegradingAndImprovingLatency() {
        for (int i = 0; i < 5; i++) {
            record("fast-" + i, 100, true);
        }
        for (int i = 0; i < 5; i++) {
            record("slow-" + i, 200, true);
        }
        assertThat(collector.metrics(10, 0, 0).latencyTrend()).isEqualTo(LatencyTrend.DEGRADING);

        var other = new SlidingWindowMetricsCollector(100, new SimpleMeterRegistry(), clock);
        for (int i = 0; i < 5; i++) {
            other.recordWorkflow("slow-" + i, 200, true, null, 0);
        }
        for (int i = 0; i < 5; i++) {
            other.recordWorkflow("fast-" + i, 100, true, null, 0);
        }
        assertThat(other.metrics(10, 0, 0).latencyTrend()).isEqualTo(LatencyTrend.IMPROVING);
    }

    @Test
    void shouldDetectDecreasingThroughput() {
        for (int i = 0; i < 20; i++) {
            record("old-" + i, 10, true);
        }
        clock.advance(Duration.ofMinutes(10));
        for (int i = 0; i < 5; i++) {
            record("new-" + i, 10, true);
        }
        assertThat(collector.metrics(10, 0, 0).throughputTrend()).isEqualTo(Trend.DECREASING);
    }

    @Test
    void shouldDetectIncreasingThroughput() {
        for (int i = 0; i < 5; i++) {
            record("old-" + i, 10, true);
        }
        clock.advance(Duration.ofMinutes(10));
        for (int i = 0; i < 20; i++) {
            record("new-" + i, 10, true);
        }
        assertThat(collector.metrics(10, 0, 0).throughputTrend()).isEqualTo(Trend.INCREASING);
    }

    // --- Micrometer ---

    @Test
    void shouldPublishMeters() {
        record("a", 150, true);
        record("b", 50, false);
        collector.recordWorkflow("c", 10, true, WorkflowPhase.COMPLETE, 1);
        collector.metrics(4, 2, 0);

        Counter success = registry.find("foreman.workflows").tag("outcome", "success").counter();
        Counter failure = registry.find("foreman.workflows").tag("outcome", "failure").counter();
        Counter retried = registry.find("foreman.workflows.retried").counter();
        Timer timer = registry.find("foreman.workflow.duration").timer();
        Gauge peak = registry.find("foreman.pool.utilization.peak").gauge();

        assertThat(success.count()).isEqualTo(2.0);
        assertThat(failure.count()).isEqualTo(1.0);
        assertThat(retried.count()).isEqualTo(1.0);
        assertThat(timer.count()).isEqualTo(3);
        assertThat(peak.value()).isEqualTo(50.0);
    }
}
