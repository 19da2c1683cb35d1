package io.foreman.core.store;

import io.foreman.api.task.DeadLetterQueue;
import io.foreman.api.task.TaskRecord;
import io.foreman.api.task.TaskStatus;
import io.foreman.api.task.TaskStore;
import io.foreman.api.workflow.WorkflowPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Task store backed by concurrent maps. Nothing survives the process.
 */
public class InMemoryTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskStore.class);

    private final Map<String, TaskRecord> tasks = new ConcurrentHashMap<>();
    private final Map<String, TaskState> states = new ConcurrentHashMap<>();
    private final InMemoryDeadLetterQueue deadLetters = new InMemoryDeadLetterQueue();

    /**
     * Register a task so the pool can find it. Registering an id again replaces the task
     * and puts it back in QUEUED.
     */
    public void register(TaskRecord task) {
        tasks.put(task.id(), task);
        states.put(task.id(), new TaskState(TaskStatus.QUEUED, null, Map.of(), null));
    }

    @Override
    public Optional<TaskRecord> get(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public void markRunning(String taskId) {
        update(taskId, new TaskState(TaskStatus.RUNNING, null, Map.of(), null));
    }

    @Override
    public void markCompleted(String taskId, WorkflowPhase phase, Map<String, Object> result) {
        update(taskId, new TaskState(TaskStatus.COMPLETED, phase, result, null));
    }

    @Override
    public void markFailed(String taskId, WorkflowPhase phase, String error) {
        update(taskId, new TaskState(TaskStatus.FAILED, phase, Map.of(), error));
    }

    @Override
    public DeadLetterQueue deadLetters() {
        return deadLetters;
    }

    public Optional<TaskStatus> status(String taskId) {
        return state(taskId).map(TaskState::status);
    }

    public Optional<TaskState> state(String taskId) {
        return Optional.ofNullable(states.get(taskId));
    }

    private void update(String taskId, TaskState state) {
        if (!tasks.containsKey(taskId)) {
            log.warn("Ignoring {} for unknown task {}", state.status(), taskId);
            return;
        }
        states.put(taskId, state);
        log.debug("Task {} is now {}", taskId, state.status());
    }

    /**
     * Last known state of a task.
     *
     * @param phase  the phase reported with the last transition, null before the task finished
     * @param result result fields of a completed task
     * @param error  failure reason of a failed task
     */
    public record TaskState(TaskStatus status, WorkflowPhase phase, Map<String, Object> result, String error) {
        public TaskState {
            result = result == null ? Map.of() : Map.copyOf(result);
        }
    }
}
