package io.foreman.api.task;

import java.util.List;
import java.util.Optional;

/**
 * Store of tasks that exhausted every retry.
 * Entries are never re-attempted automatically.
 */
public interface DeadLetterQueue {

    /**
     * Add an entry. Adding the same task id twice replaces the earlier entry.
     */
    void add(DeadLetterEntry entry);

    /**
     * @return the entry for the task, if present
     */
    Optional<DeadLetterEntry> get(String taskId);

    /**
     * @return entries newest first, skipping {@code offset} and returning at most {@code limit}
     */
    List<DeadLetterEntry> list(int limit, int offset);

    /**
     * @return true if an entry was removed
     */
    boolean remove(String taskId);

    /**
     * @return the number of entries
     */
    int count();
}
