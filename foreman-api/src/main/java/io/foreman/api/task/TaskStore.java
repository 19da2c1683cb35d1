package io.foreman.api.task;

import io.foreman.api.workflow.WorkflowPhase;

import java.util.Map;
import java.util.Optional;

/**
 * Durable task queue consumed by the execution pool.
 * <p>
 * Every operation must be idempotent per task id and tolerate being called again
 * after a process restart.
 */
public interface TaskStore {

    /**
     * @return the task with the given id, or empty if the store does not know it
     */
    Optional<TaskRecord> get(String taskId);

    /**
     * Mark a task as picked up by a worker.
     */
    void markRunning(String taskId);

    /**
     * Persist the completed state of a task.
     *
     * @param phase  the phase the workflow finished in
     * @param result arbitrary result fields (artifacts, PR ids, ...)
     */
    void markCompleted(String taskId, WorkflowPhase phase, Map<String, Object> result);

    /**
     * Persist the failed state of a task.
     *
     * @param phase the last phase reached, may be null when the workflow never reported one
     * @param error human-readable failure reason
     */
    void markFailed(String taskId, WorkflowPhase phase, String error);

    /**
     * @return the dead-letter queue that receives permanently failed tasks
     */
    DeadLetterQueue deadLetters();
}
