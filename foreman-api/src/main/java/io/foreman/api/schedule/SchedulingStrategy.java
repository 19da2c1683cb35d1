package io.foreman.api.schedule;

public enum SchedulingStrategy {
    /** Oldest task first, regardless of priority. */
    FIFO,
    /** Highest priority first, with starvation boosts for aged tasks. */
    PRIORITY,
    /** Earliest deadline first, falling back to {@link #PRIORITY} when no task has a deadline. */
    EDF,
    /** Chooses between the other strategies based on pool utilization. */
    ADAPTIVE
}
