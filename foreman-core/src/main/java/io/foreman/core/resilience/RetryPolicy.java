package io.foreman.core.resilience;

import io.foreman.api.resilience.RetryConfig;
import io.foreman.api.workflow.WorkflowOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retry with configurable backoff and jitter.
 * <p>
 * Runs at most {@code maxRetries + 1} attempts. The delay before the retry following
 * 1-indexed attempt {@code a} is {@code base * 2^(a-1)}, {@code base * a} or {@code base * fib(a)}
 * depending on the strategy, capped at {@code maxDelayMs}, then spread by
 * {@code delay * jitterFactor * U(-1, 1)} and floored at zero.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final RetryConfig config;
    private final Sleeper sleeper;

    public RetryPolicy() {
        this(RetryConfig.create());
    }

    public RetryPolicy(RetryConfig config) {
        this(config, Sleeper.THREAD);
    }

    public RetryPolicy(RetryConfig config, Sleeper sleeper) {
        this.config = config.validate();
        this.sleeper = sleeper;
    }

    public RetryConfig config() {
        return config;
    }

    /**
     * Call the operation until it returns, retrying errors the config allows.
     *
     * @return the first successful result
     * @throws Exception the last error once attempts are exhausted, or the first non-retryable one
     */
    public <T> T execute(Callable<T> operation) throws Exception {
        int maxAttempts = config.maxRetries() + 1;
        for (int attempt = 1; ; attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                if (!config.isRetryable(e)) {
                    log.debug("Non-retryable error on attempt {}: {}", attempt, e.toString());
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.debug("Retries exhausted after {} attempts: {}", attempt, e.toString());
                    throw e;
                }
                long delayMs = calculateDelayMs(attempt);
                log.debug("Attempt {}/{} failed ({}), retrying in {}ms", attempt, maxAttempts, e.getMessage(), delayMs);
                sleeper.sleep(Duration.ofMillis(delayMs));
            }
        }
    }

    /**
     * Outcome-based form of {@link #execute(Callable)}.
     * {@code Completed} returns immediately; {@code Incomplete} is always retried; {@code Failed}
     * is retried when its error is retryable. Exceptions thrown by the operation become {@code Failed}.
     *
     * @return the completed outcome, or the last outcome once attempts are exhausted
     * @throws InterruptedException if interrupted while waiting between attempts
     */
    public WorkflowOutcome executeOutcome(Callable<WorkflowOutcome> operation) throws InterruptedException {
        int maxAttempts = config.maxRetries() + 1;
        for (int attempt = 1; ; attempt++) {
            WorkflowOutcome outcome;
            try {
                outcome = operation.call();
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                outcome = new WorkflowOutcome.Failed(e);
            }

            if (outcome.isCompleted()) {
                return outcome;
            }
            if (outcome instanceof WorkflowOutcome.Failed failed && !config.isRetryable(failed.error())) {
                log.debug("Non-retryable failure on attempt {}: {}", attempt, failed.error().toString());
                return outcome;
            }
            if (attempt >= maxAttempts) {
                log.debug("Retries exhausted after {} attempts, last phase {}", attempt, outcome.phase());
                return outcome;
            }
            long delayMs = calculateDelayMs(attempt);
            log.debug("Attempt {}/{} ended in phase {}, retrying in {}ms", attempt, maxAttempts, outcome.phase(), delayMs);
            sleeper.sleep(Duration.ofMillis(delayMs));
        }
    }

    /**
     * @param attempt 1-indexed attempt that just failed
     * @return the delay in milliseconds before the next attempt, jitter included
     */
    public long calculateDelayMs(int attempt) {
        double delay = Math.min(baseDelayMs(attempt), config.maxDelayMs());
        if (config.jitterFactor() > 0) {
            double spread = ThreadLocalRandom.current().nextDouble(-1.0, 1.0);
            delay += delay * config.jitterFactor() * spread;
        }
        return Math.max(0L, Math.round(delay));
    }

    private double baseDelayMs(int attempt) {
        long base = config.baseDelayMs();
        return switch (config.backoffStrategy()) {
            case EXPONENTIAL -> base * Math.pow(2, attempt - 1);
            case LINEAR -> (double) base * attempt;
            case FIBONACCI -> (double) base * fibonacci(attempt);
        };
    }

    static long fibonacci(int n) {
        if (n > 92) {
            return Long.MAX_VALUE; // fib(93) overflows a long
        }
        long previous = 0;
        long current = 1;
        for (int i = 1; i < n; i++) {
            long next = previous + current;
            previous = current;
            current = next;
        }
        return current;
    }
}
