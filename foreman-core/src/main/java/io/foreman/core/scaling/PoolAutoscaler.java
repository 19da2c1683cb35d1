package io.foreman.core.scaling;

import io.foreman.api.metrics.LatencyTrend;
import io.foreman.api.metrics.PoolMetrics;
import io.foreman.api.metrics.Trend;
import io.foreman.api.scaling.ScalingDecision;
import io.foreman.api.scaling.ScalingDirection;
import io.foreman.api.scaling.ScalingPolicy;
import io.foreman.api.scaling.ScalingStats;
import io.foreman.api.scaling.ScalingTrigger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Recommends pool size changes from a metrics snapshot.
 * <p>
 * Rules are evaluated in order queue depth, utilization, latency; the first that asks for a
 * change wins and starts the cooldown. A rule that would move past the policy bounds yields
 * MAINTAIN instead. The latency rule only fires when the policy enables latency scaling. The autoscaler only decides, applying the new size is the caller's job.
 */
public class PoolAutoscaler {

    private static final Logger log = LoggerFactory.getLogger(PoolAutoscaler.class);

    static final int MAX_HISTORY = 100;

    private final ScalingPolicy policy;
    private final Clock clock;
    private final MeterRegistry registry;
    private final Deque<ScalingDecision> history = new ArrayDeque<>();

    private Instant lastScalingAction;

    public PoolAutoscaler() {
        this(ScalingPolicy.create());
    }

    public PoolAutoscaler(ScalingPolicy policy) {
        this(policy, new SimpleMeterRegistry(), Clock.systemUTC());
    }

    public PoolAutoscaler(ScalingPolicy policy, MeterRegistry registry, Clock clock) {
        this.policy = policy.validate();
        this.registry = registry;
        this.clock = clock;
    }

    public ScalingPolicy policy() {
        return policy;
    }

    /**
     * Decide whether the pool should grow, shrink or stay as is.
     *
     * @param metrics         the current snapshot
     * @param currentPoolSize the pool's current concurrency limit
     */
    public synchronized ScalingDecision evaluateScaling(PoolMetrics metrics, int currentPoolSize) {
        Instant now = clock.instant();
        if (inCooldown(now)) {
            return ScalingDecision.maintain(currentPoolSize, "Cooldown period active", ScalingTrigger.COOLDOWN, now);
        }

        List<ScalingDecision> candidates = List.of(
                evaluateQueueDepth(metrics, currentPoolSize, now),
                evaluateUtilization(metrics, currentPoolSize, now),
                evaluateLatency(metrics, currentPoolSize, now));

        for (ScalingDecision decision : candidates) {
            if (!decision.isMaintain()) {
                record(decision);
                return decision;
            }
        }
        return ScalingDecision.maintain(currentPoolSize, "Metrics within acceptable range", ScalingTrigger.NONE, now);
    }

    /**
     * @return up to {@code limit} most recent recorded decisions, oldest first
     */
    public synchronized List<ScalingDecision> scalingHistory(int limit) {
        List<ScalingDecision> all = new ArrayList<>(history);
        return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    public synchronized ScalingStats scalingStats() {
        int ups = 0;
        int downs = 0;
        for (ScalingDecision decision : history) {
            if (decision.direction() == ScalingDirection.SCALE_UP) {
                ups++;
            } else if (decision.direction() == ScalingDirection.SCALE_DOWN) {
                downs++;
            }
        }
        double remaining = 0.0;
        if (lastScalingAction != null) {
            Duration elapsed = Duration.between(lastScalingAction, clock.instant());
            remaining = Math.max(0.0, (policy.cooldown().toMillis() - elapsed.toMillis()) / 1000.0);
        }
        return new ScalingStats(ups + downs, ups, downs, lastScalingAction, remaining,
                policy.minPoolSize(), policy.maxPoolSize(), policy.targetUtilization());
    }

    private ScalingDecision evaluateQueueDepth(PoolMetrics metrics, int current, Instant now) {
        int depth = metrics.queueDepth();
        if (depth >= policy.queueDepthThreshold() && metrics.queueDepthTrend() == Trend.INCREASING) {
            return scaleUp(current, ScalingTrigger.QUEUE_DEPTH, now,
                    "Queue depth " + depth + " >= " + policy.queueDepthThreshold() + " and increasing");
        }
        if (depth == 0 && metrics.queueDepthTrend() == Trend.STABLE) {
            return scaleDown(current, ScalingTrigger.QUEUE_DEPTH, now, "Queue empty and stable");
        }
        return ScalingDecision.maintain(current,
                "Queue depth " + depth + " within acceptable range", ScalingTrigger.QUEUE_DEPTH, now);
    }

    private ScalingDecision evaluateUtilization(PoolMetrics metrics, int current, Instant now) {
        double utilization = metrics.utilizationPct() / 100.0;
        if (utilization >= policy.scaleUpThreshold()) {
            return scaleUp(current, ScalingTrigger.UTILIZATION, now,
                    "High utilization: " + percent(utilization) + " >= " + percent(policy.scaleUpThreshold()));
        }
        if (utilization <= policy.scaleDownThreshold()) {
            return scaleDown(current, ScalingTrigger.UTILIZATION, now,
                    "Low utilization: " + percent(utilization) + " <= " + percent(policy.scaleDownThreshold()));
        }
        return ScalingDecision.maintain(current,
                "Utilization within target range: " + percent(utilization), ScalingTrigger.UTILIZATION, now);
    }

    private ScalingDecision evaluateLatency(PoolMetrics metrics, int current, Instant now) {
        double p95 = metrics.p95DurationMs();
        double p50 = metrics.p50DurationMs();
        if (policy.latencyScaling()
                && metrics.latencyTrend() == LatencyTrend.DEGRADING && p95 > 0 && p95 > p50 * 2) {
            return scaleUp(current, ScalingTrigger.LATENCY, now,
                    String.format(Locale.ROOT, "Increasing latency: P95=%.0fms, P50=%.0fms", p95, p50));
        }
        return ScalingDecision.maintain(current, "Latency within acceptable range", ScalingTrigger.LATENCY, now);
    }

    private ScalingDecision scaleUp(int current, ScalingTrigger trigger, Instant now, String reason) {
        if (current >= policy.maxPoolSize()) {
            return ScalingDecision.maintain(current, "At max pool size (" + policy.maxPoolSize() + ")", trigger, now);
        }
        int target = Math.min(current + policy.scaleUpIncrement(), policy.maxPoolSize());
        return new ScalingDecision(ScalingDirection.SCALE_UP, current, target, reason, trigger, now);
    }

    private ScalingDecision scaleDown(int current, ScalingTrigger trigger, Instant now, String reason) {
        if (current <= policy.minPoolSize()) {
            return ScalingDecision.maintain(current, "At min pool size (" + policy.minPoolSize() + ")", trigger, now);
        }
        int target = Math.max(current - policy.scaleDownDecrement(), policy.minPoolSize());
        return new ScalingDecision(ScalingDirection.SCALE_DOWN, current, target, reason, trigger, now);
    }

    private boolean inCooldown(Instant now) {
        return lastScalingAction != null
                && Duration.between(lastScalingAction, now).compareTo(policy.cooldown()) < 0;
    }

    private void record(ScalingDecision decision) {
        lastScalingAction = decision.timestamp();
        history.addLast(decision);
        while (history.size() > MAX_HISTORY) {
            history.removeFirst();
        }
        Counter.builder("foreman.scaling.decisions")
                .tag("direction", decision.direction().name().toLowerCase(Locale.ROOT))
                .tag("trigger", decision.triggeredBy().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
        log.info("Scaling decision {}: {} -> {} ({}, triggered by {})", decision.direction(),
                decision.currentSize(), decision.targetSize(), decision.reason(), decision.triggeredBy());
    }

    private static String percent(double fraction) {
        return String.format(Locale.ROOT, "%.1f%%", fraction * 100.0);
    }
}
