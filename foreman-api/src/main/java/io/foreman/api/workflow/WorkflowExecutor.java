package io.foreman.api.workflow;

import io.foreman.api.task.TaskRecord;

/**
 * Runs the actual workflow/agent logic for one task.
 * Implementations may block; the execution pool calls them from a worker thread.
 */
@FunctionalInterface
public interface WorkflowExecutor {

    /**
     * Drive the workflow for a task until it reaches a terminal phase or runs out of iterations.
     *
     * @param task          the task to execute
     * @param maxIterations upper bound on phase transitions for this attempt
     * @return the phase reached plus result fields
     * @throws Exception any failure; the pool's retry loop decides what happens next
     */
    WorkflowResult execute(TaskRecord task, int maxIterations) throws Exception;
}
