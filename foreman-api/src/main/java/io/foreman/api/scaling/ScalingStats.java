package io.foreman.api.scaling;

import java.time.Instant;

/**
 * Summary of recorded scaling actions.
 *
 * @param lastScalingAction timestamp of the last recorded action, null if none yet
 */
public record ScalingStats(
        int totalScalingActions,
        int scaleUps,
        int scaleDowns,
        Instant lastScalingAction,
        double cooldownSecondsRemaining,
        int minPoolSize,
        int maxPoolSize,
        double targetUtilization
) {}
