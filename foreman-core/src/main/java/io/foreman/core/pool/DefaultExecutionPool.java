package io.foreman.core.pool;

import io.foreman.api.metrics.MetricsCollector;
import io.foreman.api.metrics.PoolMetrics;
import io.foreman.api.metrics.WorkflowRecord;
import io.foreman.api.pool.ExecutionPool;
import io.foreman.api.pool.PoolConfig;
import io.foreman.api.task.DeadLetterEntry;
import io.foreman.api.task.TaskRecord;
import io.foreman.api.task.TaskStore;
import io.foreman.api.workflow.WorkflowExecutor;
import io.foreman.api.workflow.WorkflowOutcome;
import io.foreman.api.workflow.WorkflowPhase;
import io.foreman.core.resilience.CircuitBreaker;
import io.foreman.core.resilience.CircuitBreakerRegistry;
import io.foreman.core.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Execution pool that spawns one background unit per submission and lets at most
 * {@code maxConcurrent} of them run the workflow at a time.
 * <p>
 * Each unit fetches its task, runs the workflow through the retry policy and the shared
 * circuit breaker, then records the outcome in the task store (or the dead-letter queue)
 * and exactly one {@link WorkflowRecord} in the metrics collector. The retry count carried by
 * records and dead-letter entries is the number of workflow attempts made.
 */
public class DefaultExecutionPool implements ExecutionPool {

    private static final Logger log = LoggerFactory.getLogger(DefaultExecutionPool.class);

    private enum State { NEW, RUNNING, STOPPING, STOPPED }

    private final PoolConfig config;
    private final TaskStore taskStore;
    private final WorkflowExecutor workflowExecutor;
    private final RetryPolicy retryPolicy;
    private final CircuitBreakerRegistry breakers;
    private final MetricsCollector metricsCollector;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private final ResizableSemaphore semaphore;
    private final Set<String> activeTaskIds = ConcurrentHashMap.newKeySet();
    private final AtomicInteger activeCount = new AtomicInteger(0);
    private final AtomicLong totalProcessed = new AtomicLong(0);
    private final AtomicLong totalSucceeded = new AtomicLong(0);
    private final AtomicLong totalFailed = new AtomicLong(0);
    private final List<Consumer<WorkflowRecord>> recordListeners = new CopyOnWriteArrayList<>();

    private volatile int maxConcurrent;
    private volatile ExecutorService executor;

    public DefaultExecutionPool(PoolConfig config, TaskStore taskStore, WorkflowExecutor workflowExecutor,
                                RetryPolicy retryPolicy, CircuitBreakerRegistry breakers,
                                MetricsCollector metricsCollector) {
        this(config, taskStore, workflowExecutor, retryPolicy, breakers, metricsCollector, Clock.systemUTC());
    }

    public DefaultExecutionPool(PoolConfig config, TaskStore taskStore, WorkflowExecutor workflowExecutor,
                                RetryPolicy retryPolicy, CircuitBreakerRegistry breakers,
                                MetricsCollector metricsCollector, Clock clock) {
        this.config = config;
        this.taskStore = taskStore;
        this.workflowExecutor = workflowExecutor;
        this.retryPolicy = retryPolicy;
        this.breakers = breakers;
        this.metricsCollector = metricsCollector;
        this.clock = clock;
        this.maxConcurrent = config.maxConcurrent();
        this.semaphore = new ResizableSemaphore(config.maxConcurrent());
    }

    @Override
    public void start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING) && !state.compareAndSet(State.STOPPED, State.RUNNING)) {
            log.debug("Pool already started");
            return;
        }
        ThreadFactory threadFactory = config.threadFactory() != null ? config.threadFactory() : workerThreadFactory();
        executor = Executors.newCachedThreadPool(threadFactory);
        log.info("Execution pool started with max {} concurrent workflows", maxConcurrent);
    }

    @Override
    public void stop() {
        if (!state.compareAndSet(State.RUNNING, State.STOPPING)) {
            log.debug("Pool not running, nothing to stop");
            return;
        }
        log.info("Stopping execution pool, waiting for {} active workflows", activeCount.get());
        executor.shutdown();
        try {
            while (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.info("Still waiting for {} active workflows: {}", activeCount.get(), activeTaskIds);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {} active workflows", activeCount.get());
        }
        state.set(State.STOPPED);
        log.info("Execution pool stopped. Processed: {}, Succeeded: {}, Failed: {}",
                totalProcessed.get(), totalSucceeded.get(), totalFailed.get());
    }

    @Override
    public void submit(String taskId) {
        if (state.get() != State.RUNNING) {
            throw new PoolUnavailableException("Execution pool is not running (state " + state.get() + ")");
        }
        int limit = config.maxPendingSubmissions();
        if (limit > 0 && activeCount.get() >= limit) {
            throw new PoolSaturatedException(limit);
        }
        if (!activeTaskIds.add(taskId)) {
            throw new IllegalArgumentException("Task " + taskId + " is already in flight");
        }
        activeCount.incrementAndGet();
        try {
            executor.execute(() -> runTask(taskId));
        } catch (RejectedExecutionException e) {
            activeCount.decrementAndGet();
            activeTaskIds.remove(taskId);
            throw new PoolUnavailableException("Execution pool is shutting down");
        }
        log.debug("Submitted task {} ({} active)", taskId, activeCount.get());
    }

    @Override
    public int activeCount() {
        return activeCount.get();
    }

    @Override
    public int maxConcurrent() {
        return maxConcurrent;
    }

    @Override
    public int availableSlots() {
        return maxConcurrent - activeCount.get();
    }

    @Override
    public synchronized void resize(int newMaxConcurrent) {
        if (newMaxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive, got " + newMaxConcurrent);
        }
        int delta = newMaxConcurrent - maxConcurrent;
        if (delta > 0) {
            semaphore.release(delta);
        } else if (delta < 0) {
            semaphore.shrink(-delta);
        }
        log.info("Execution pool resized from {} to {}", maxConcurrent, newMaxConcurrent);
        maxConcurrent = newMaxConcurrent;
    }

    @Override
    public Set<String> activeTaskIds() {
        return Set.copyOf(activeTaskIds);
    }

    @Override
    public Map<String, Object> metrics() {
        long processed = totalProcessed.get();
        long succeeded = totalSucceeded.get();
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("max_concurrent", maxConcurrent);
        metrics.put("active_workflows", activeCount.get());
        metrics.put("available_slots", availableSlots());
        metrics.put("total_processed", processed);
        metrics.put("total_succeeded", succeeded);
        metrics.put("total_failed", totalFailed.get());
        metrics.put("success_rate", processed > 0 ? (double) succeeded / processed * 100.0 : 0.0);
        return metrics;
    }

    @Override
    public PoolMetrics enhancedMetrics(int queueDepth) {
        return metricsCollector.metrics(maxConcurrent, activeCount.get(), queueDepth);
    }

    @Override
    public void onRecord(Consumer<WorkflowRecord> listener) {
        recordListeners.add(listener);
    }

    public MetricsCollector metricsCollector() {
        return metricsCollector;
    }

    private void runTask(String taskId) {
        boolean acquired = false;
        long startNanos = 0L;
        boolean success = false;
        WorkflowPhase phase = null;
        TaskRecord task = null;
        AtomicInteger attempts = new AtomicInteger();
        try {
            semaphore.acquire();
            acquired = true;
            startNanos = System.nanoTime();

            Optional<TaskRecord> found = taskStore.get(taskId);
            if (found.isEmpty()) {
                log.warn("Task {} not found in task store", taskId);
                fail(taskId, null, "Task not found", 0, null, Map.of());
                return;
            }
            task = found.get();
            taskStore.markRunning(taskId);

            TaskRecord current = task;
            WorkflowOutcome outcome = retryPolicy.executeOutcome(() -> {
                attempts.incrementAndGet();
                CircuitBreaker breaker = breakers.getOrCreate(config.breakerName());
                return breaker.call(() -> WorkflowOutcome.of(workflowExecutor.execute(current, config.maxIterations())));
            });
            phase = outcome.phase();

            if (outcome instanceof WorkflowOutcome.Completed completed) {
                success = true;
                taskStore.markCompleted(taskId, phase, completed.result().fields());
                log.debug("Task {} completed after {} attempts", taskId, attempts.get());
            } else {
                fail(taskId, task, failureReason(outcome, attempts.get()), attempts.get(), phase, workflowState(outcome));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Task {} interrupted after {} attempts", taskId, attempts.get());
            fail(taskId, task, "Interrupted", attempts.get(), phase, Map.of());
        } catch (RuntimeException e) {
            log.error("Bookkeeping failed for task {}", taskId, e);
        } finally {
            double durationMs = acquired ? (System.nanoTime() - startNanos) / 1_000_000.0 : 0.0;
            finish(taskId, durationMs, success, phase, attempts.get());
            if (acquired) {
                semaphore.release();
            }
        }
    }

    private void fail(String taskId, TaskRecord task, String reason, int retryCount,
                      WorkflowPhase phase, Map<String, Object> workflowState) {
        Instant now = clock.instant();
        DeadLetterEntry entry = new DeadLetterEntry(
                taskId,
                task != null ? task.featureDescription() : null,
                task != null ? task.targetUrl() : null,
                reason,
                retryCount,
                workflowState,
                task != null ? task.createdAt() : now,
                phase,
                now);
        safely(taskId, () -> taskStore.deadLetters().add(entry));
        safely(taskId, () -> taskStore.markFailed(taskId, phase, reason));
        log.warn("Task {} failed permanently after {} attempts: {}", taskId, retryCount, reason);
    }

    private void finish(String taskId, double durationMs, boolean success, WorkflowPhase phase, int retryCount) {
        totalProcessed.incrementAndGet();
        if (success) {
            totalSucceeded.incrementAndGet();
        } else {
            totalFailed.incrementAndGet();
        }
        try {
            metricsCollector.recordWorkflow(taskId, durationMs, success, phase, retryCount);
            if (!recordListeners.isEmpty()) {
                WorkflowRecord record = new WorkflowRecord(taskId, durationMs, success, phase, retryCount, clock.instant());
                recordListeners.forEach(listener -> listener.accept(record));
            }
        } catch (RuntimeException e) {
            log.error("Failed to record metrics for task {}", taskId, e);
        } finally {
            activeTaskIds.remove(taskId);
            activeCount.decrementAndGet();
        }
    }

    private static void safely(String taskId, Runnable bookkeeping) {
        try {
            bookkeeping.run();
        } catch (RuntimeException e) {
            log.error("Bookkeeping failed for task {}", taskId, e);
        }
    }

    private static String failureReason(WorkflowOutcome outcome, int attempts) {
        if (outcome instanceof WorkflowOutcome.Failed failed) {
            Throwable error = failed.error();
            return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        }
        return "Workflow ended in phase " + outcome.phase() + " after " + attempts + " attempts";
    }

    private static Map<String, Object> workflowState(WorkflowOutcome outcome) {
        if (outcome instanceof WorkflowOutcome.Incomplete incomplete) {
            Map<String, Object> state = new LinkedHashMap<>(incomplete.result().fields());
            state.put("current_phase", incomplete.phase().name());
            return state;
        }
        if (outcome instanceof WorkflowOutcome.Failed failed) {
            return Map.of("error_type", failed.error().getClass().getName());
        }
        return Map.of();
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "foreman-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
