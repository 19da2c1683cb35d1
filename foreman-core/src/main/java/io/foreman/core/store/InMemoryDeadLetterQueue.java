package io.foreman.core.store;

import io.foreman.api.task.DeadLetterEntry;
import io.foreman.api.task.DeadLetterQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Dead-letter queue kept in memory, newest entry first.
 */
public class InMemoryDeadLetterQueue implements DeadLetterQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDeadLetterQueue.class);

    // insertion order; re-adding an id moves it to the end
    private final LinkedHashMap<String, DeadLetterEntry> entries = new LinkedHashMap<>();

    @Override
    public synchronized void add(DeadLetterEntry entry) {
        entries.remove(entry.taskId());
        entries.put(entry.taskId(), entry);
        log.info("Task {} moved to dead-letter queue: {}", entry.taskId(), entry.failureReason());
    }

    @Override
    public synchronized Optional<DeadLetterEntry> get(String taskId) {
        return Optional.ofNullable(entries.get(taskId));
    }

    @Override
    public synchronized List<DeadLetterEntry> list(int limit, int offset) {
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must be >= 0");
        }
        List<DeadLetterEntry> newestFirst = new ArrayList<>(entries.values());
        Collections.reverse(newestFirst);
        int from = Math.min(offset, newestFirst.size());
        int to = (int) Math.min((long) from + limit, newestFirst.size());
        return List.copyOf(newestFirst.subList(from, to));
    }

    @Override
    public synchronized boolean remove(String taskId) {
        return entries.remove(taskId) != null;
    }

    @Override
    public synchronized int count() {
        return entries.size();
    }
}
