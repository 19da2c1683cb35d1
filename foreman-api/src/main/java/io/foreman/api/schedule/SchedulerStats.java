package io.foreman.api.schedule;

import java.util.Map;

/**
 * @param deadlineMissRate deadline misses per completed task, 0 when nothing completed yet
 */
public record SchedulerStats(
        long totalScheduled,
        long totalCompleted,
        long deadlineMisses,
        int currentlyQueued,
        Map<Priority, Integer> queueDepths,
        double deadlineMissRate
) {
    public SchedulerStats {
        queueDepths = Map.copyOf(queueDepths);
    }
}
