package io.foreman.api.workflow;

import java.util.Map;
import java.util.Objects;

/**
 * What the workflow executor reports back: the phase it stopped in plus arbitrary
 * JSON-serializable result fields.
 */
public record WorkflowResult(WorkflowPhase currentPhase, Map<String, Object> fields) {

    public WorkflowResult {
        Objects.requireNonNull(currentPhase, "currentPhase");
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public static WorkflowResult of(WorkflowPhase phase) {
        return new WorkflowResult(phase, Map.of());
    }

    public boolean isComplete() {
        return currentPhase.isComplete();
    }
}
