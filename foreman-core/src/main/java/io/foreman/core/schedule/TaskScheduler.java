package io.foreman.core.schedule;

import io.foreman.api.schedule.Priority;
import io.foreman.api.schedule.ScheduledTask;
import io.foreman.api.schedule.SchedulerStats;
import io.foreman.api.schedule.SchedulingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Pending-task queue in front of the execution pool.
 * <p>
 * Tasks wait in one FIFO queue per priority. Which task leaves next depends on the strategy;
 * see {@link SchedulingStrategy}. Under PRIORITY, tasks that waited longer than the starvation
 * threshold are promoted one level (LOW to NORMAL, and NORMAL to HIGH after 1.5 times the threshold).
 */
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    static final Duration DEFAULT_STARVATION_THRESHOLD = Duration.ofSeconds(300);
    private static final Duration URGENT_DEADLINE = Duration.ofSeconds(60);

    private final SchedulingStrategy strategy;
    private final Duration starvationThreshold;
    private final Clock clock;

    private final Map<Priority, Deque<ScheduledTask>> queues = new EnumMap<>(Priority.class);
    private final Map<String, ScheduledTask> tasks = new HashMap<>();
    private final PriorityQueue<DeadlineEntry> deadlines =
            new PriorityQueue<>(Comparator.comparing(DeadlineEntry::deadline));

    private long totalScheduled;
    private long totalCompleted;
    private long deadlineMisses;

    public TaskScheduler() {
        this(SchedulingStrategy.ADAPTIVE);
    }

    public TaskScheduler(SchedulingStrategy strategy) {
        this(strategy, DEFAULT_STARVATION_THRESHOLD, Clock.systemUTC());
    }

    public TaskScheduler(SchedulingStrategy strategy, Duration starvationThreshold, Clock clock) {
        if (starvationThreshold.isNegative()) {
            throw new IllegalArgumentException("starvationThreshold must be >= 0, got " + starvationThreshold);
        }
        this.strategy = strategy;
        this.starvationThreshold = starvationThreshold;
        this.clock = clock;
        for (Priority priority : Priority.values()) {
            queues.put(priority, new ArrayDeque<>());
        }
    }

    public SchedulingStrategy strategy() {
        return strategy;
    }

    /**
     * Queue a task. A task id that is already queued is ignored.
     *
     * @return true if the task was queued
     */
    public synchronized boolean add(ScheduledTask task) {
        if (!enqueue(task, false)) {
            return false;
        }
        totalScheduled++;
        log.debug("Scheduled task {} (priority={}, deadline={}, queued={})",
                task.taskId(), task.priority(), task.deadline(), tasks.size());
        return true;
    }

    /**
     * Put back a task that was taken but could not be dispatched, ahead of its priority queue.
     * Not counted as newly scheduled.
     */
    public synchronized boolean requeue(ScheduledTask task) {
        return enqueue(task, true);
    }

    /**
     * Take the next task according to the strategy.
     *
     * @param utilization    current pool utilization as a fraction, only used by ADAPTIVE
     * @param avgExecutionMs average workflow duration, reserved for load-aware strategies
     * @return the task to run next, or null if none should run now
     */
    public synchronized ScheduledTask next(double utilization, double avgExecutionMs) {
        return switch (strategy) {
            case FIFO -> nextFifo();
            case PRIORITY -> nextByPriority();
            case EDF -> nextByDeadline();
            case ADAPTIVE -> nextAdaptive(utilization);
        };
    }

    /**
     * @return true if the task was queued and is now removed
     */
    public synchronized boolean remove(String taskId) {
        ScheduledTask task = tasks.get(taskId);
        if (task == null) {
            return false;
        }
        take(task);
        log.debug("Removed task {} from scheduler", taskId);
        return true;
    }

    public synchronized int size() {
        return tasks.size();
    }

    public synchronized Map<Priority, Integer> queueDepths() {
        Map<Priority, Integer> depths = new EnumMap<>(Priority.class);
        queues.forEach((priority, queue) -> depths.put(priority, queue.size()));
        return depths;
    }

    /**
     * Count a task as finished for the scheduling statistics.
     */
    public synchronized void markCompleted(String taskId, boolean missedDeadline) {
        totalCompleted++;
        if (missedDeadline) {
            deadlineMisses++;
            log.debug("Task {} completed after its deadline", taskId);
        }
    }

    public synchronized SchedulerStats stats() {
        double missRate = totalCompleted > 0 ? (double) deadlineMisses / totalCompleted : 0.0;
        return new SchedulerStats(totalScheduled, totalCompleted, deadlineMisses, tasks.size(), queueDepths(), missRate);
    }

    /**
     * @return every queued task, highest priority first
     */
    public synchronized List<ScheduledTask> pending() {
        List<ScheduledTask> pending = new ArrayList<>(tasks.size());
        queues.values().forEach(pending::addAll);
        return pending;
    }

    public synchronized void clear() {
        queues.values().forEach(Deque::clear);
        tasks.clear();
        deadlines.clear();
        log.info("Cleared all scheduled tasks");
    }

    private boolean enqueue(ScheduledTask task, boolean front) {
        if (tasks.containsKey(task.taskId())) {
            log.warn("Task {} already scheduled", task.taskId());
            return false;
        }
        if (front) {
            queues.get(task.priority()).addFirst(task);
        } else {
            queues.get(task.priority()).addLast(task);
        }
        tasks.put(task.taskId(), task);
        if (task.deadline() != null) {
            deadlines.add(new DeadlineEntry(task.deadline(), task.taskId()));
        }
        return true;
    }

    private ScheduledTask nextFifo() {
        ScheduledTask oldest = null;
        for (Deque<ScheduledTask> queue : queues.values()) {
            ScheduledTask head = queue.peekFirst();
            if (head != null && (oldest == null || head.createdAt().isBefore(oldest.createdAt()))) {
                oldest = head;
            }
        }
        return oldest == null ? null : take(oldest);
    }

    private ScheduledTask nextByPriority() {
        preventStarvation();
        for (Priority priority : Priority.values()) {
            ScheduledTask head = queues.get(priority).peekFirst();
            if (head != null) {
                return take(head);
            }
        }
        return null;
    }

    private ScheduledTask nextByDeadline() {
        while (!deadlines.isEmpty()) {
            DeadlineEntry entry = deadlines.poll();
            ScheduledTask task = tasks.get(entry.taskId());
            if (task == null || !entry.deadline().equals(task.deadline())) {
                continue; // no longer queued
            }
            take(task);
            Instant now = clock.instant();
            if (task.isOverdue(now)) {
                deadlineMisses++;
                log.warn("Task {} missed deadline by {}ms", task.taskId(),
                        Duration.between(task.deadline(), now).toMillis());
            }
            return task;
        }
        return nextByPriority();
    }

    private ScheduledTask nextAdaptive(double utilization) {
        if (utilization > 0.8) {
            ScheduledTask critical = queues.get(Priority.CRITICAL).peekFirst();
            if (critical != null) {
                return take(critical);
            }
            ScheduledTask urgent = mostUrgent(URGENT_DEADLINE);
            if (urgent != null) {
                return take(urgent);
            }
            ScheduledTask high = queues.get(Priority.HIGH).peekFirst();
            return high == null ? null : take(high);
        } else if (utilization > 0.5) {
            return nextByDeadline();
        }
        return nextByPriority();
    }

    private ScheduledTask mostUrgent(Duration within) {
        Instant now = clock.instant();
        ScheduledTask urgent = null;
        Duration closest = null;
        for (Deque<ScheduledTask> queue : queues.values()) {
            for (ScheduledTask task : queue) {
                Duration left = task.timeToDeadline(now);
                if (left != null && left.compareTo(within) <= 0 && (closest == null || left.compareTo(closest) < 0)) {
                    urgent = task;
                    closest = left;
                }
            }
        }
        return urgent;
    }

    private void preventStarvation() {
        Instant now = clock.instant();
        promote(Priority.LOW, Priority.NORMAL, starvationThreshold, now);
        promote(Priority.NORMAL, Priority.HIGH,
                Duration.ofMillis(Math.round(starvationThreshold.toMillis() * 1.5)), now);
    }

    private void promote(Priority from, Priority to, Duration threshold, Instant now) {
        Iterator<ScheduledTask> it = queues.get(from).iterator();
        while (it.hasNext()) {
            ScheduledTask task = it.next();
            if (task.age(now).compareTo(threshold) > 0) {
                it.remove();
                ScheduledTask boosted = task.withPriority(to);
                queues.get(to).addLast(boosted);
                tasks.put(boosted.taskId(), boosted);
                log.info("Boosted task {} from {} to {} (starvation prevention)", task.taskId(), from, to);
            }
        }
    }

    private ScheduledTask take(ScheduledTask task) {
        queues.get(task.priority()).removeIf(t -> t.taskId().equals(task.taskId()));
        tasks.remove(task.taskId());
        if (task.deadline() != null) {
            deadlines.remove(new DeadlineEntry(task.deadline(), task.taskId()));
        }
        return task;
    }

    /**
     * @return number of entries in the deadline heap
     */
    synchronized int trackedDeadlines() {
        return deadlines.size();
    }

    private record DeadlineEntry(Instant deadline, String taskId) {}
}
