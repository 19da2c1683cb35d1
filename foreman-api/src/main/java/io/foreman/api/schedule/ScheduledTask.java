package io.foreman.api.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A task waiting for a pool slot.
 *
 * @param deadline            optional, null when the task has none
 * @param estimatedDurationMs optional hint, null when unknown
 */
public record ScheduledTask(
        String taskId,
        Priority priority,
        Instant createdAt,
        Instant deadline,
        Double estimatedDurationMs,
        Map<String, Object> attributes
) {
    public ScheduledTask {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("Task id must not be blank");
        }
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(createdAt, "createdAt");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static ScheduledTask of(String taskId, Priority priority, Instant createdAt) {
        return new ScheduledTask(taskId, priority, createdAt, null, null, Map.of());
    }

    public static ScheduledTask withDeadline(String taskId, Priority priority, Instant createdAt, Instant deadline) {
        return new ScheduledTask(taskId, priority, createdAt, deadline, null, Map.of());
    }

    public ScheduledTask withPriority(Priority newPriority) {
        return new ScheduledTask(taskId, newPriority, createdAt, deadline, estimatedDurationMs, attributes);
    }

    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }

    /**
     * @return time left until the deadline (negative once passed), or null without a deadline
     */
    public Duration timeToDeadline(Instant now) {
        return deadline == null ? null : Duration.between(now, deadline);
    }

    public boolean isOverdue(Instant now) {
        return deadline != null && now.isAfter(deadline);
    }
}
