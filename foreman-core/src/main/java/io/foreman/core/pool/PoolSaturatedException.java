package io.foreman.core.pool;

import java.util.concurrent.RejectedExecutionException;

/**
 * Thrown when a pool with a submission limit already holds that many unfinished tasks.
 */
public class PoolSaturatedException extends RejectedExecutionException {

    private final int limit;

    public PoolSaturatedException(int limit) {
        super("Pool saturated: " + limit + " tasks already pending");
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
