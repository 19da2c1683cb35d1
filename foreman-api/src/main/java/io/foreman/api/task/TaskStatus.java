package io.foreman.api.task;

/**
 * Lifecycle of a task as tracked by the task store.
 */
public enum TaskStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED
}
