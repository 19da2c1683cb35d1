package io.foreman.api.resilience;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Configuration for bounded retry with backoff and jitter.
 * <p>
 * Single-field ranges are checked by each setter; {@link #validate()} checks the
 * relations between fields and is called when a retry policy is built.
 */
public final class RetryConfig {

    private int maxRetries = 3;
    private long baseDelayMs = 1000;
    private long maxDelayMs = 60_000;
    private BackoffStrategy backoffStrategy = BackoffStrategy.EXPONENTIAL;
    private double jitterFactor = 0.1;
    private Set<Class<? extends Throwable>> retryableErrors = null; // null = everything is retryable

    private RetryConfig() {}

    public static RetryConfig create() {
        return new RetryConfig();
    }

    public RetryConfig maxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        this.maxRetries = maxRetries;
        return this;
    }

    public RetryConfig baseDelayMs(long baseDelayMs) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0, got " + baseDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        return this;
    }

    public RetryConfig maxDelayMs(long maxDelayMs) {
        if (maxDelayMs < 0) {
            throw new IllegalArgumentException("maxDelayMs must be >= 0, got " + maxDelayMs);
        }
        this.maxDelayMs = maxDelayMs;
        return this;
    }

    public RetryConfig backoffStrategy(BackoffStrategy backoffStrategy) {
        if (backoffStrategy == null) {
            throw new IllegalArgumentException("backoffStrategy must not be null");
        }
        this.backoffStrategy = backoffStrategy;
        return this;
    }

    public RetryConfig jitterFactor(double jitterFactor) {
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1], got " + jitterFactor);
        }
        this.jitterFactor = jitterFactor;
        return this;
    }

    /**
     * Restrict retries to the given error kinds (and their subclasses).
     * Without this call every error is retryable.
     */
    @SafeVarargs
    public final RetryConfig retryOn(Class<? extends Throwable>... errorTypes) {
        return retryOn(List.of(errorTypes));
    }

    public RetryConfig retryOn(Collection<Class<? extends Throwable>> errorTypes) {
        this.retryableErrors = Set.copyOf(errorTypes);
        return this;
    }

    /**
     * @throws IllegalArgumentException if maxDelayMs is below baseDelayMs
     */
    public RetryConfig validate() {
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                    "maxDelayMs (" + maxDelayMs + ") must be >= baseDelayMs (" + baseDelayMs + ")");
        }
        return this;
    }

    /**
     * @return true if an error of this kind may be retried
     */
    public boolean isRetryable(Throwable error) {
        if (retryableErrors == null) {
            return true;
        }
        return retryableErrors.stream().anyMatch(type -> type.isInstance(error));
    }

    public int maxRetries() { return maxRetries; }
    public long baseDelayMs() { return baseDelayMs; }
    public long maxDelayMs() { return maxDelayMs; }
    public BackoffStrategy backoffStrategy() { return backoffStrategy; }
    public double jitterFactor() { return jitterFactor; }
    public Set<Class<? extends Throwable>> retryableErrors() { return retryableErrors; }
}
