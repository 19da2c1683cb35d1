package io.foreman.api.pool;

import java.util.concurrent.ThreadFactory;

/**
 * Configuration for an execution pool.
 */
public final class PoolConfig {

    private int maxConcurrent = 5;
    private int maxIterations = 10;
    private int maxPendingSubmissions = 0; // 0 = unbounded
    private String breakerName = "workflow";
    private ThreadFactory threadFactory = null;

    private PoolConfig() {}

    public static PoolConfig create() {
        return new PoolConfig();
    }

    public PoolConfig maxConcurrent(int maxConcurrent) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive");
        }
        this.maxConcurrent = maxConcurrent;
        return this;
    }

    /**
     * Iteration budget handed to the workflow executor on every attempt.
     */
    public PoolConfig maxIterations(int maxIterations) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
        this.maxIterations = maxIterations;
        return this;
    }

    /**
     * Reject submissions once this many tasks are active. Zero disables the limit.
     */
    public PoolConfig maxPendingSubmissions(int maxPendingSubmissions) {
        if (maxPendingSubmissions < 0) {
            throw new IllegalArgumentException("maxPendingSubmissions must be >= 0");
        }
        this.maxPendingSubmissions = maxPendingSubmissions;
        return this;
    }

    /**
     * Name of the shared circuit breaker guarding the workflow executor.
     */
    public PoolConfig breakerName(String breakerName) {
        if (breakerName == null || breakerName.isBlank()) {
            throw new IllegalArgumentException("breakerName must not be blank");
        }
        this.breakerName = breakerName;
        return this;
    }

    /**
     * Provide a custom thread factory for the background units.
     */
    public PoolConfig threadFactory(ThreadFactory threadFactory) {
        this.threadFactory = threadFactory;
        return this;
    }

    public int maxConcurrent() { return maxConcurrent; }
    public int maxIterations() { return maxIterations; }
    public int maxPendingSubmissions() { return maxPendingSubmissions; }
    public String breakerName() { return breakerName; }
    public ThreadFactory threadFactory() { return threadFactory; }
}
