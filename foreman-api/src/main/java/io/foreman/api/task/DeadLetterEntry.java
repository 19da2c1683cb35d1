package io.foreman.api.task;

import io.foreman.api.workflow.WorkflowPhase;

import java.time.Instant;
import java.util.Map;

/**
 * A permanently failed task, kept for offline inspection and replay.
 */
public record DeadLetterEntry(
        String taskId,
        String featureDescription,
        String targetUrl,
        String failureReason,
        int retryCount,
        Map<String, Object> workflowState,
        Instant createdAt,
        WorkflowPhase lastErrorPhase,
        Instant deadLetteredAt
) {
    public DeadLetterEntry {
        workflowState = workflowState == null ? Map.of() : Map.copyOf(workflowState);
    }
}
