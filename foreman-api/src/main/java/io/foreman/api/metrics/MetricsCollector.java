package io.foreman.api.metrics;

import io.foreman.api.workflow.WorkflowPhase;

/**
 * Sliding-window recorder of finished workflows.
 * Produces {@link PoolMetrics} snapshots on demand.
 */
public interface MetricsCollector {

    /**
     * Record a finished submission.
     *
     * @param workflowId  the task id
     * @param durationMs  wall time from slot acquisition to completion
     * @param success     whether the workflow completed
     * @param phase       the phase reached, or null when unknown
     * @param retryCount  number of retries beyond the first attempt
     */
    void recordWorkflow(String workflowId, double durationMs, boolean success, WorkflowPhase phase, int retryCount);

    /**
     * Record a queue-depth sample for trend detection.
     */
    void recordQueueDepth(int depth);

    /**
     * Compute a full snapshot. Also updates the peak utilization and records {@code queueDepth}
     * as a trend sample.
     */
    PoolMetrics metrics(int poolSize, int activeCount, int queueDepth);

    /**
     * Reset the monotonic peak utilization to zero.
     */
    void resetPeakUtilization();

    /**
     * @return capacity of the sliding window
     */
    int windowSize();
}
