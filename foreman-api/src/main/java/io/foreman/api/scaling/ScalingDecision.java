package io.foreman.api.scaling;

import java.time.Instant;

/**
 * Autoscaling decision with its rationale.
 */
public record ScalingDecision(
        ScalingDirection direction,
        int currentSize,
        int targetSize,
        String reason,
        ScalingTrigger triggeredBy,
        Instant timestamp
) {
    public static ScalingDecision maintain(int currentSize, String reason, ScalingTrigger triggeredBy, Instant timestamp) {
        return new ScalingDecision(ScalingDirection.MAINTAIN, currentSize, currentSize, reason, triggeredBy, timestamp);
    }

    public boolean isMaintain() {
        return direction == ScalingDirection.MAINTAIN;
    }
}
