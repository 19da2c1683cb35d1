package io.foreman.api.workflow;

import java.util.Objects;

/**
 * Tagged result of one workflow attempt.
 * The retry loop branches on the variant instead of catching an error that only means "try again".
 */
public sealed interface WorkflowOutcome {

    /**
     * @return the phase this attempt ended in, or null if none was reported
     */
    WorkflowPhase phase();

    default boolean isCompleted() {
        return this instanceof Completed;
    }

    /**
     * Map an executor result onto an outcome: COMPLETE is success, any other phase is incomplete.
     */
    static WorkflowOutcome of(WorkflowResult result) {
        if (result.isComplete()) {
            return new Completed(result);
        }
        return new Incomplete(result);
    }

    /**
     * The workflow reached {@link WorkflowPhase#COMPLETE}.
     */
    record Completed(WorkflowResult result) implements WorkflowOutcome {
        public Completed {
            Objects.requireNonNull(result, "result");
        }

        @Override
        public WorkflowPhase phase() {
            return result.currentPhase();
        }
    }

    /**
     * The workflow stopped in a phase other than COMPLETE.
     */
    record Incomplete(WorkflowResult result) implements WorkflowOutcome {
        public Incomplete {
            Objects.requireNonNull(result, "result");
        }

        @Override
        public WorkflowPhase phase() {
            return result.currentPhase();
        }
    }

    /**
     * The attempt raised an error (executor failure or circuit-breaker rejection).
     */
    record Failed(Throwable error, WorkflowPhase phase) implements WorkflowOutcome {
        public Failed {
            Objects.requireNonNull(error, "error");
        }

        public Failed(Throwable error) {
            this(error, null);
        }
    }
}
