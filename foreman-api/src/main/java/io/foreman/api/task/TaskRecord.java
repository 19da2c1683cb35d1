package io.foreman.api.task;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of work known to the task store.
 * The description and target are what a dead-letter entry carries for forensic replay.
 */
public record TaskRecord(
        String id,
        String featureDescription,
        String targetUrl,
        Instant createdAt,
        Map<String, Object> attributes
) {
    public TaskRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id must not be blank");
        }
        Objects.requireNonNull(createdAt, "createdAt");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static TaskRecord of(String id, String featureDescription, String targetUrl) {
        return new TaskRecord(id, featureDescription, targetUrl, Instant.now(), Map.of());
    }
}
