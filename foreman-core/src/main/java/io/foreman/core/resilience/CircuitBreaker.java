package io.foreman.core.resilience;

import io.foreman.api.resilience.CircuitBreakerConfig;
import io.foreman.api.resilience.CircuitBreakerMetrics;
import io.foreman.api.resilience.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Three-state circuit breaker guarding a downstream operation.
 * <p>
 * CLOSED opens once {@code failureThreshold} failures have accumulated since the circuit last
 * closed; successes in between do not reset that count. OPEN moves to HALF_OPEN lazily, the
 * first time the state is looked at after {@code timeout} has passed since the last failure.
 * HALF_OPEN closes after {@code successThreshold} consecutive successes and re-opens on any
 * failure. Every transition resets both counters.
 * <p>
 * All state lives behind this object's monitor, so a breaker can be shared by every worker
 * of a pool.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final Deque<Boolean> recentCalls;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureTime;

    public CircuitBreaker(String name) {
        this(name, CircuitBreakerConfig.create());
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name = name;
        this.config = config;
        this.clock = clock;
        this.recentCalls = new ArrayDeque<>(config.windowSize());
    }

    public String name() {
        return name;
    }

    /**
     * @return the current state, after applying a pending OPEN to HALF_OPEN transition
     */
    public synchronized CircuitState state() {
        refreshState();
        return state;
    }

    /**
     * Run the operation through the breaker.
     *
     * @throws CircuitBreakerOpenException if the circuit is open; the operation is not invoked
     * @throws Exception                   whatever the operation throws, unchanged
     */
    public <T> T call(Callable<T> operation) throws Exception {
        checkPermitted();
        T result;
        try {
            result = operation.call();
        } catch (Exception e) {
            onFailure();
            throw e;
        }
        onSuccess();
        return result;
    }

    /**
     * Asynchronous form of {@link #call(Callable)}. The outcome is recorded when the returned
     * stage completes. An open circuit yields a stage failed with {@link CircuitBreakerOpenException}.
     */
    public <T> CompletableFuture<T> callAsync(Supplier<? extends CompletionStage<T>> operation) {
        try {
            checkPermitted();
        } catch (CircuitBreakerOpenException e) {
            return CompletableFuture.failedFuture(e);
        }
        CompletionStage<T> stage;
        try {
            stage = operation.get();
        } catch (RuntimeException e) {
            onFailure();
            return CompletableFuture.failedFuture(e);
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            if (error != null) {
                onFailure();
                result.completeExceptionally(unwrap(error));
            } else {
                onSuccess();
                result.complete(value);
            }
        });
        return result;
    }

    /**
     * Force the circuit back to CLOSED and clear the counters. The outcome window is kept.
     */
    public synchronized void reset() {
        if (state != CircuitState.CLOSED) {
            log.info("Circuit breaker '{}' manually reset from {}", name, state);
        }
        transitionTo(CircuitState.CLOSED);
        lastFailureTime = null;
    }

    public synchronized CircuitBreakerMetrics metrics() {
        refreshState();
        long failures = recentCalls.stream().filter(success -> !success).count();
        double failureRate = recentCalls.isEmpty() ? 0.0 : (double) failures / recentCalls.size();
        return new CircuitBreakerMetrics(name, state, failureCount, successCount, failureRate, recentCalls.size());
    }

    private synchronized void checkPermitted() {
        refreshState();
        if (state == CircuitState.OPEN) {
            Duration elapsed = Duration.between(lastFailureTime, clock.instant());
            Duration remaining = config.timeout().minus(elapsed);
            throw new CircuitBreakerOpenException(name, remaining.isNegative() ? Duration.ZERO : remaining);
        }
    }

    synchronized void onSuccess() {
        record(true);
        if (state == CircuitState.HALF_OPEN) {
            successCount++;
            if (successCount >= config.successThreshold()) {
                transitionTo(CircuitState.CLOSED);
                log.info("Circuit breaker '{}' closed after successful probes", name);
            }
        }
    }

    synchronized void onFailure() {
        record(false);
        failureCount++;
        lastFailureTime = clock.instant();
        if (state == CircuitState.HALF_OPEN) {
            transitionTo(CircuitState.OPEN);
            log.warn("Circuit breaker '{}' re-opened, probe failed", name);
        } else if (state == CircuitState.CLOSED && failureCount >= config.failureThreshold()) {
            int failures = failureCount;
            transitionTo(CircuitState.OPEN);
            log.warn("Circuit breaker '{}' opened after {} failures", name, failures);
        }
    }

    private void refreshState() {
        if (state == CircuitState.OPEN && lastFailureTime != null
                && Duration.between(lastFailureTime, clock.instant()).compareTo(config.timeout()) >= 0) {
            transitionTo(CircuitState.HALF_OPEN);
            log.info("Circuit breaker '{}' half-open, allowing probe calls", name);
        }
    }

    private void transitionTo(CircuitState next) {
        state = next;
        failureCount = 0;
        successCount = 0;
    }

    private void record(boolean success) {
        if (recentCalls.size() == config.windowSize()) {
            recentCalls.removeFirst();
        }
        recentCalls.addLast(success);
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
