package io.foreman.core.runtime;

import io.foreman.api.pool.PoolConfig;
import io.foreman.api.pool.SupervisorConfig;
import io.foreman.api.report.StatusReport;
import io.foreman.api.resilience.RetryConfig;
import io.foreman.api.scaling.ScalingDirection;
import io.foreman.api.schedule.Priority;
import io.foreman.api.schedule.ScheduledTask;
import io.foreman.api.schedule.SchedulingStrategy;
import io.foreman.api.task.TaskRecord;
import io.foreman.api.workflow.WorkflowExecutor;
import io.foreman.api.workflow.WorkflowPhase;
import io.foreman.api.workflow.WorkflowResult;
import io.foreman.core.health.HealthMonitor;
import io.foreman.core.metrics.SlidingWindowMetricsCollector;
import io.foreman.core.pool.DefaultExecutionPool;
import io.foreman.core.report.JsonStatusWriter;
import io.foreman.core.resilience.CircuitBreakerRegistry;
import io.foreman.core.resilience.RetryPolicy;
import io.foreman.core.scaling.PoolAutoscaler;
import io.foreman.core.schedule.TaskScheduler;
import io.foreman.core.store.InMemoryTaskStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class PoolSupervisorTest {

    @TempDir
    Path tempDir;

    private final InMemoryTaskStore store = new InMemoryTaskStore();
    private final CountDownLatch release = new CountDownLatch(1);
    private DefaultExecutionPool pool;
    private PoolSupervisor supervisor;

    @AfterEach
    void tearDown() {
        release.countDown();
        if (supervisor != null) {
            supervisor.stop();
        }
        if (pool != null) {
            pool.stop();
        }
    }

    private PoolSupervisor supervisor(int maxConcurrent, WorkflowExecutor executor, TaskScheduler scheduler,
                                      JsonStatusWriter writer, SupervisorConfig config) {
        pool = new DefaultExecutionPool(
                PoolConfig.create().maxConcurrent(maxConcurrent),
                store,
                executor,
                new RetryPolicy(RetryConfig.create().maxRetries(0), duration -> {}),
                new CircuitBreakerRegistry(),
                new SlidingWindowMetricsCollector());
        supervisor = new PoolSupervisor(pool, scheduler, new PoolAutoscaler(), new HealthMonitor(),
                new CircuitBreakerRegistry(), writer, config);
        return supervisor;
    }

    private WorkflowExecutor blocking() {
        return (task, maxIterations) -> {
            release.await(10, TimeUnit.SECONDS);
            return WorkflowResult.of(WorkflowPhase.COMPLETE);
        };
    }

    private void enqueue(String... ids) {
        for (String id : ids) {
            store.register(TaskRecord.of(id, "Feature " + id, "https://example.test/" + id));
            supervisor.enqueue(ScheduledTask.of(id, Priority.NORMAL, Instant.now()));
        }
    }

    // --- Tick ---

    @Test
    void shouldDispatchWhileSlotsAreFree() {
        supervisor(2, blocking(), new TaskScheduler(SchedulingStrategy.FIFO), null,
                SupervisorConfig.create().autoscalingEnabled(false));
        enqueue("t1", "t2", "t3");
        pool.start();

        StatusReport report = supervisor.tick();

        assertThat(pool.activeTaskIds()).containsExactlyInAnyOrder("t1", "t2");
        assertThat(supervisor.scheduler().size()).isEqualTo(1);
        assertThat(report.metrics().queueDepth()).isEqualTo(1);
        assertThat(report.metrics().utilizationPct()).isEqualTo(100.0);
    }

    @Test
    void shouldApplyScaleUpDecision() {
        supervisor(2, blocking(), new TaskScheduler(SchedulingStrategy.FIFO), null, SupervisorConfig.create());
        enqueue("t1", "t2", "t3");
        pool.start();

        StatusReport report = supervisor.tick();

        assertThat(pool.maxConcurrent()).isEqualTo(4);
        assertThat(report.recentScalingDecisions()).singleElement().satisfies(decision -> {
            assertThat(decision.direction()).isEqualTo(ScalingDirection.SCALE_UP);
            assertThat(decision.targetSize()).isEqualTo(4);
        });

        supervisor.tick();

        assertThat(pool.activeTaskIds()).containsExactlyInAnyOrder("t1", "t2", "t3");
        assertThat(supervisor.scheduler().size()).isZero();
    }

    @Test
    void shouldOnlyReportDecisionsWhenAutoscalingDisabled() {
        supervisor(2, blocking(), new TaskScheduler(SchedulingStrategy.FIFO), null,
                SupervisorConfig.create().autoscalingEnabled(false));
        enqueue("t1", "t2", "t3");
        pool.start();

        StatusReport report = supervisor.tick();

        assertThat(pool.maxConcurrent()).isEqualTo(2);
        assertThat(report.recentScalingDecisions()).hasSize(1);
    }

    @Test
    void shouldCountCompletionsAndDeadlineMisses() {
        supervisor(2, (task, maxIterations) -> WorkflowResult.of(WorkflowPhase.COMPLETE),
                new TaskScheduler(SchedulingStrategy.FIFO), null, SupervisorConfig.create());
        store.register(TaskRecord.of("late", "Late feature", "https://example.test/late"));
        store.register(TaskRecord.of("ok", "Fine feature", "https://example.test/ok"));
        Instant now = Instant.now();
        supervisor.enqueue(ScheduledTask.withDeadline("late", Priority.HIGH, now, now.minusSeconds(60)));
        supervisor.enqueue(ScheduledTask.withDeadline("ok", Priority.HIGH, now, now.plusSeconds(3600)));
        pool.start();

        supervisor.tick();

        await().atMost(Duration.ofSeconds(5))
                .until(() -> supervisor.scheduler().stats().totalCompleted() == 2);
        assertThat(supervisor.scheduler().stats().deadlineMisses()).isEqualTo(1);
        assertThat(supervisor.scheduler().stats().deadlineMissRate()).isEqualTo(0.5);
    }

    @Test
    void shouldWriteStatusReportAndRecords() throws Exception {
        JsonStatusWriter writer = new JsonStatusWriter(tempDir.resolve("status.json"));
        supervisor(2, (task, maxIterations) -> WorkflowResult.of(WorkflowPhase.COMPLETE),
                new TaskScheduler(SchedulingStrategy.PRIORITY), writer, SupervisorConfig.create());
        enqueue("t1");
        pool.start();

        supervisor.tick();

        assertThat(writer.statusFile()).exists();
        await().atMost(Duration.ofSeconds(5)).until(() -> Files.exists(writer.streamFile())
                && Files.readAllLines(writer.streamFile()).size() == 1);
        assertThat(Files.readString(writer.statusFile())).contains("\"health\"");
    }

    // --- Lifecycle ---

    @Test
    void shouldDrainQueueWhenRunning() {
        supervisor(2, (task, maxIterations) -> WorkflowResult.of(WorkflowPhase.COMPLETE),
                new TaskScheduler(), null,
                SupervisorConfig.create().evaluationInterval(Duration.ofMillis(50)));
        enqueue("t1", "t2", "t3", "t4", "t5");

        supervisor.start();

        await().atMost(Duration.ofSeconds(5))
                .until(() -> supervisor.scheduler().stats().totalCompleted() == 5);
        supervisor.stop();
        assertThat(supervisor.lastReport().metrics().totalProcessed()).isEqualTo(5);
        assertThat(supervisor.lastReport().metrics().successRatePct()).isEqualTo(100.0);
        assertThat(supervisor.lastReport().health().isHealthy()).isTrue();
    }

    @Test
    void shouldRejectSecondStart() {
        supervisor(1, blocking(), new TaskScheduler(), null, SupervisorConfig.create());
        supervisor.start();

        assertThatThrownBy(() -> supervisor.start()).isInstanceOf(IllegalStateException.class);
    }
}
