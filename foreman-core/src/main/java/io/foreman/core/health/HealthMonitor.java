package io.foreman.core.health;

import io.foreman.api.health.Alert;
import io.foreman.api.health.AlertSeverity;
import io.foreman.api.health.HealthReport;
import io.foreman.api.health.HealthStatus;
import io.foreman.api.health.HealthThresholds;
import io.foreman.api.metrics.LatencyTrend;
import io.foreman.api.metrics.PoolMetrics;
import io.foreman.api.metrics.Trend;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a metrics snapshot into alerts and operator recommendations.
 * Stateless apart from its thresholds; safe to share.
 */
public class HealthMonitor {

    private final HealthThresholds thresholds;

    public HealthMonitor() {
        this(HealthThresholds.create());
    }

    public HealthMonitor(HealthThresholds thresholds) {
        this.thresholds = thresholds.validate();
    }

    public HealthThresholds thresholds() {
        return thresholds;
    }

    public HealthReport assessHealth(PoolMetrics metrics) {
        List<Alert> alerts = new ArrayList<>();
        checkUtilization(metrics, alerts);
        checkSuccessRate(metrics, alerts);
        checkLatency(metrics, alerts);
        checkQueueDepth(metrics, alerts);
        checkFailurePatterns(metrics, alerts);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("pool_utilization_pct", metrics.utilizationPct());
        summary.put("success_rate", metrics.successRatePct());
        summary.put("p95_latency_ms", metrics.p95DurationMs());
        summary.put("queue_depth", metrics.queueDepth());
        summary.put("queue_trend", metrics.queueDepthTrend());
        summary.put("latency_trend", metrics.latencyTrend());

        return new HealthReport(status(alerts), alerts, summary, recommendations(alerts, metrics));
    }

    private void checkUtilization(PoolMetrics metrics, List<Alert> alerts) {
        double util = metrics.utilizationPct();
        if (util >= thresholds.utilizationCriticalPct()) {
            alerts.add(new Alert(AlertSeverity.CRITICAL, "pool_utilization", util, thresholds.utilizationCriticalPct(),
                    format("Pool utilization critical: %.1f%% (threshold: %.1f%%)", util, thresholds.utilizationCriticalPct()),
                    "Increase max_concurrent or investigate stuck workflows"));
        } else if (util >= thresholds.utilizationWarningPct()) {
            alerts.add(new Alert(AlertSeverity.WARNING, "pool_utilization", util, thresholds.utilizationWarningPct(),
                    format("Pool utilization high: %.1f%% (threshold: %.1f%%)", util, thresholds.utilizationWarningPct()),
                    "Monitor closely - consider scaling up if sustained"));
        }
    }

    private void checkSuccessRate(PoolMetrics metrics, List<Alert> alerts) {
        double rate = metrics.successRatePct();
        if (rate <= thresholds.successRateCriticalPct()) {
            alerts.add(new Alert(AlertSeverity.CRITICAL, "success_rate", rate, thresholds.successRateCriticalPct(),
                    format("Success rate critical: %.1f%% (threshold: %.1f%%)", rate, thresholds.successRateCriticalPct()),
                    "Investigate recent failures - check logs for error patterns"));
        } else if (rate <= thresholds.successRateWarningPct()) {
            alerts.add(new Alert(AlertSeverity.WARNING, "success_rate", rate, thresholds.successRateWarningPct(),
                    format("Success rate low: %.1f%% (threshold: %.1f%%)", rate, thresholds.successRateWarningPct()),
                    "Review failure patterns - may indicate quality issues"));
        }
    }

    private void checkLatency(PoolMetrics metrics, List<Alert> alerts) {
        double p95 = metrics.p95DurationMs();
        if (p95 >= thresholds.p95LatencyCriticalMs()) {
            alerts.add(new Alert(AlertSeverity.CRITICAL, "p95_latency", p95, thresholds.p95LatencyCriticalMs(),
                    format("P95 latency critical: %.0fms (threshold: %.0fms)", p95, thresholds.p95LatencyCriticalMs()),
                    "Investigate slow workflows - check for resource contention"));
        } else if (p95 >= thresholds.p95LatencyWarningMs()) {
            alerts.add(new Alert(AlertSeverity.WARNING, "p95_latency", p95, thresholds.p95LatencyWarningMs(),
                    format("P95 latency high: %.0fms (threshold: %.0fms)", p95, thresholds.p95LatencyWarningMs()),
                    "Monitor latency trend - optimize slow operations if sustained"));
        }
    }

    private void checkQueueDepth(PoolMetrics metrics, List<Alert> alerts) {
        int depth = metrics.queueDepth();
        if (depth >= thresholds.queueDepthCritical()) {
            alerts.add(new Alert(AlertSeverity.CRITICAL, "queue_depth", depth, thresholds.queueDepthCritical(),
                    "Queue depth critical: " + depth + " (threshold: " + thresholds.queueDepthCritical() + ")",
                    "Scale up immediately or pause task submission"));
        } else if (depth >= thresholds.queueDepthWarning() && metrics.queueDepthTrend() == Trend.INCREASING) {
            alerts.add(new Alert(AlertSeverity.WARNING, "queue_depth", depth, thresholds.queueDepthWarning(),
                    "Queue depth increasing: " + depth + " (threshold: " + thresholds.queueDepthWarning() + ")",
                    "Monitor queue trend - may need capacity increase"));
        }
    }

    private void checkFailurePatterns(PoolMetrics metrics, List<Alert> alerts) {
        metrics.failureRateByPhase().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> {
                    String phase = entry.getKey();
                    double rate = entry.getValue();
                    if (rate >= thresholds.failureRateCriticalPct()) {
                        alerts.add(new Alert(AlertSeverity.CRITICAL, "failure_rate_" + phase, rate,
                                thresholds.failureRateCriticalPct(),
                                format("High failure rate in %s: %.1f%%", phase, rate),
                                "Investigate " + phase + " phase - check agent configuration"));
                    } else if (rate >= thresholds.failureRateWarningPct()) {
                        alerts.add(new Alert(AlertSeverity.WARNING, "failure_rate_" + phase, rate,
                                thresholds.failureRateWarningPct(),
                                format("Elevated failure rate in %s: %.1f%%", phase, rate),
                                "Review " + phase + " phase execution logs"));
                    }
                });
    }

    private static HealthStatus status(List<Alert> alerts) {
        if (alerts.stream().anyMatch(Alert::isCritical)) {
            return HealthStatus.CRITICAL;
        }
        return alerts.isEmpty() ? HealthStatus.HEALTHY : HealthStatus.WARNING;
    }

    private static List<String> recommendations(List<Alert> alerts, PoolMetrics metrics) {
        List<String> recommendations = new ArrayList<>();
        alerts.stream()
                .sorted(Comparator.comparingInt((Alert alert) -> alert.isCritical() ? 0 : 1))
                .forEach(alert -> recommendations.add("[" + alert.severity() + "] " + alert.recommendation()));

        boolean latencyAlert = alerts.stream().anyMatch(a -> a.metric().contains("latency"));
        if (metrics.latencyTrend() == LatencyTrend.DEGRADING && !latencyAlert) {
            recommendations.add("[INFO] Latency trending upward - consider profiling workflows");
        }
        boolean utilizationAlert = alerts.stream().anyMatch(a -> a.metric().contains("utilization"));
        if (metrics.throughputTrend() == Trend.DECREASING && !utilizationAlert) {
            recommendations.add("[INFO] Throughput decreasing - check for bottlenecks");
        }
        return recommendations;
    }

    private static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }
}
