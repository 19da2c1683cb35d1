package io.foreman.core.pool;

/**
 * Thrown when a task is submitted to a pool that is not running.
 */
public class PoolUnavailableException extends IllegalStateException {

    public PoolUnavailableException(String message) {
        super(message);
    }
}
