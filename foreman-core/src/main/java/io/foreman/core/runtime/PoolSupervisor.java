package io.foreman.core.runtime;

import io.foreman.api.health.Alert;
import io.foreman.api.health.HealthReport;
import io.foreman.api.health.HealthStatus;
import io.foreman.api.metrics.PoolMetrics;
import io.foreman.api.metrics.WorkflowRecord;
import io.foreman.api.pool.ExecutionPool;
import io.foreman.api.pool.SupervisorConfig;
import io.foreman.api.report.StatusReport;
import io.foreman.api.report.StatusWriter;
import io.foreman.api.scaling.ScalingDecision;
import io.foreman.api.schedule.ScheduledTask;
import io.foreman.core.health.HealthMonitor;
import io.foreman.core.pool.PoolSaturatedException;
import io.foreman.core.pool.PoolUnavailableException;
import io.foreman.core.resilience.CircuitBreakerRegistry;
import io.foreman.core.scaling.PoolAutoscaler;
import io.foreman.core.schedule.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Control loop around an execution pool.
 * <p>
 * Every evaluation interval it moves scheduled tasks into the pool while slots are free,
 * takes a metrics snapshot with the scheduler backlog as queue depth, applies the
 * autoscaler's decision, assesses health and publishes a status report.
 */
public class PoolSupervisor {

    private static final Logger log = LoggerFactory.getLogger(PoolSupervisor.class);

    private enum State { NEW, RUNNING, STOPPED }

    private final ExecutionPool pool;
    private final TaskScheduler scheduler;
    private final PoolAutoscaler autoscaler;
    private final HealthMonitor healthMonitor;
    private final CircuitBreakerRegistry breakers;
    private final StatusWriter statusWriter;
    private final SupervisorConfig config;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private final AtomicReference<StatusReport> lastReport = new AtomicReference<>();
    private final Map<String, Instant> dispatchedDeadlines = new ConcurrentHashMap<>();
    private volatile HealthStatus lastStatus = HealthStatus.HEALTHY;
    private ScheduledExecutorService loop;

    /**
     * @param statusWriter may be null when no status output is wanted
     */
    public PoolSupervisor(ExecutionPool pool, TaskScheduler scheduler, PoolAutoscaler autoscaler,
                          HealthMonitor healthMonitor, CircuitBreakerRegistry breakers,
                          StatusWriter statusWriter, SupervisorConfig config) {
        this(pool, scheduler, autoscaler, healthMonitor, breakers, statusWriter, config, Clock.systemUTC());
    }

    public PoolSupervisor(ExecutionPool pool, TaskScheduler scheduler, PoolAutoscaler autoscaler,
                          HealthMonitor healthMonitor, CircuitBreakerRegistry breakers,
                          StatusWriter statusWriter, SupervisorConfig config, Clock clock) {
        this.pool = pool;
        this.scheduler = scheduler;
        this.autoscaler = autoscaler;
        this.healthMonitor = healthMonitor;
        this.breakers = breakers;
        this.statusWriter = statusWriter;
        this.config = config;
        this.clock = clock;
        pool.onRecord(this::onWorkflowFinished);
    }

    /**
     * Start the pool and the evaluation loop.
     */
    public void start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            throw new IllegalStateException("Supervisor already started");
        }
        pool.start();
        loop = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "foreman-supervisor");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = config.evaluationInterval().toMillis();
        loop.scheduleAtFixedRate(() -> {
            try {
                tick();
            } catch (Exception e) {
                log.error("Error in supervisor tick", e);
            }
        }, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Supervisor started, evaluating every {}ms", intervalMs);
    }

    /**
     * Stop the loop, wait for the pool to drain and publish a final report.
     * Tasks still waiting in the scheduler are left there.
     */
    public void stop() {
        if (!state.compareAndSet(State.RUNNING, State.STOPPED)) {
            return;
        }
        loop.shutdown();
        try {
            loop.awaitTermination(config.evaluationInterval().toMillis() * 2, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        pool.stop();
        publish(pool.enhancedMetrics(scheduler.size()));
        if (statusWriter != null) {
            statusWriter.close();
        }
        log.info("Supervisor stopped, {} tasks left in scheduler", scheduler.size());
    }

    /**
     * Queue a task for dispatch on the next tick.
     *
     * @return false if the task id is already queued
     */
    public boolean enqueue(ScheduledTask task) {
        return scheduler.add(task);
    }

    /**
     * Run one evaluation: dispatch, measure, scale, assess, report.
     *
     * @return the published report
     */
    public StatusReport tick() {
        int dispatched = dispatch();
        PoolMetrics metrics = pool.enhancedMetrics(scheduler.size());

        ScalingDecision decision = autoscaler.evaluateScaling(metrics, pool.maxConcurrent());
        if (!decision.isMaintain() && config.autoscalingEnabled()) {
            pool.resize(decision.targetSize());
        }
        if (dispatched > 0) {
            log.debug("Dispatched {} tasks, {} still queued", dispatched, scheduler.size());
        }
        return publish(metrics);
    }

    public StatusReport lastReport() {
        return lastReport.get();
    }

    public TaskScheduler scheduler() {
        return scheduler;
    }

    private int dispatch() {
        int dispatched = 0;
        double avgMs = 0.0;
        StatusReport previous = lastReport.get();
        if (previous != null) {
            avgMs = previous.metrics().avgDurationMs();
        }
        while (pool.availableSlots() > 0) {
            double utilization = (double) pool.activeCount() / pool.maxConcurrent();
            ScheduledTask task = scheduler.next(utilization, avgMs);
            if (task == null) {
                break;
            }
            try {
                pool.submit(task.taskId());
                if (task.deadline() != null) {
                    dispatchedDeadlines.put(task.taskId(), task.deadline());
                }
                dispatched++;
            } catch (PoolSaturatedException | PoolUnavailableException e) {
                scheduler.requeue(task);
                log.debug("Dispatch paused: {}", e.getMessage());
                break;
            } catch (IllegalArgumentException e) {
                scheduler.requeue(task);
                log.warn("Task {} is still running, keeping it queued", task.taskId());
                break;
            }
        }
        return dispatched;
    }

    private StatusReport publish(PoolMetrics metrics) {
        HealthReport health = healthMonitor.assessHealth(metrics);
        logHealth(health);

        StatusReport report = new StatusReport(
                clock.instant(),
                metrics,
                health,
                autoscaler.scalingHistory(config.reportedScalingDecisions()),
                breakers.metrics());
        lastReport.set(report);
        if (statusWriter != null) {
            statusWriter.writeStatus(report);
        }
        return report;
    }

    private void logHealth(HealthReport health) {
        if (health.status() != lastStatus) {
            log.info("Pool health changed from {} to {}", lastStatus, health.status());
            lastStatus = health.status();
        }
        List<Alert> alerts = health.alerts();
        for (Alert alert : alerts) {
            if (alert.isCritical()) {
                log.error("{} - {}", alert.message(), alert.recommendation());
            } else {
                log.warn("{} - {}", alert.message(), alert.recommendation());
            }
        }
    }

    private void onWorkflowFinished(WorkflowRecord record) {
        Instant deadline = dispatchedDeadlines.remove(record.workflowId());
        boolean missed = deadline != null && record.timestamp().isAfter(deadline);
        scheduler.markCompleted(record.workflowId(), missed);
        if (statusWriter != null) {
            statusWriter.writeRecord(record);
        }
    }
}
