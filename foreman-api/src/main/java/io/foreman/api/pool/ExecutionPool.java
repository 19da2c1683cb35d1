package io.foreman.api.pool;

import io.foreman.api.metrics.PoolMetrics;
import io.foreman.api.metrics.WorkflowRecord;

import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Bounded-concurrency pool that runs workflow tasks in the background.
 * <p>
 * At most {@link #maxConcurrent()} tasks execute at once. Submissions beyond that wait
 * for a slot but still count as active, so {@link #availableSlots()} may go negative.
 */
public interface ExecutionPool {

    /**
     * Start accepting submissions. Calling it twice is a no-op.
     */
    void start();

    /**
     * Stop accepting submissions and wait for every submitted task to finish.
     * In-flight work is never cancelled and there is no timeout.
     */
    void stop();

    /**
     * Schedule a task for background execution and return immediately.
     *
     * @param taskId id of a task known to the task store
     * @throws IllegalStateException if the pool is not running
     * @throws java.util.concurrent.RejectedExecutionException if a submission limit is configured and reached
     */
    void submit(String taskId);

    /**
     * @return submitted tasks that have not finished yet, including those waiting for a slot
     */
    int activeCount();

    /**
     * @return the current concurrency limit
     */
    int maxConcurrent();

    /**
     * @return {@code maxConcurrent() - activeCount()}
     */
    int availableSlots();

    /**
     * Change the concurrency limit. Running tasks are not interrupted when shrinking;
     * new tasks wait until the active count drops below the new limit.
     */
    void resize(int newMaxConcurrent);

    /**
     * @return ids of the tasks currently submitted and unfinished
     */
    Set<String> activeTaskIds();

    /**
     * @return basic counters: max_concurrent, active_workflows, available_slots,
     * total_processed, total_succeeded, total_failed, success_rate
     */
    Map<String, Object> metrics();

    /**
     * @param queueDepth the number of tasks waiting upstream of the pool
     * @return the full metrics snapshot
     */
    PoolMetrics enhancedMetrics(int queueDepth);

    /**
     * Register a callback invoked once per finished submission, after the record reached the
     * metrics collector. Callbacks run on the worker thread.
     */
    void onRecord(Consumer<WorkflowRecord> listener);
}
