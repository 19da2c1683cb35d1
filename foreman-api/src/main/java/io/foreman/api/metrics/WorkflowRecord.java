package io.foreman.api.metrics;

import io.foreman.api.workflow.WorkflowPhase;

import java.time.Instant;

/**
 * One finished submission (success or exhausted failure).
 * Exactly one record exists per submission, never one per retry attempt.
 */
public record WorkflowRecord(
        String workflowId,
        double durationMs,
        boolean success,
        WorkflowPhase phase,
        int retryCount,
        Instant timestamp
) {}
