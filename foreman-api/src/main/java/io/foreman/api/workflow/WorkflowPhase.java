package io.foreman.api.workflow;

import java.util.Locale;

/**
 * Ordered phases of an autonomous workflow.
 * {@link #COMPLETE} is the only successful terminal phase.
 */
public enum WorkflowPhase {
    E2E_TEST_GENERATION,
    CODE_IMPLEMENTATION,
    GUARDIAN_REVIEW,
    STAGING_DEPLOYMENT,
    E2E_VALIDATION,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    public boolean isComplete() {
        return this == COMPLETE;
    }

    /**
     * @return lower-case name used in metric keys, e.g. {@code code_implementation}
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
