package io.foreman.core.resilience;

import io.foreman.api.resilience.CircuitBreakerConfig;
import io.foreman.api.resilience.CircuitBreakerMetrics;
import io.foreman.api.resilience.CircuitState;
import io.foreman.core.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        breaker = new CircuitBreaker("workflow", CircuitBreakerConfig.create()
                .failureThreshold(5)
                .successThreshold(2)
                .timeout(Duration.ofSeconds(60)), clock);
    }

    private void fail() {
        assertThatThrownBy(() -> breaker.call(() -> {
            throw new IOException("downstream unavailable");
        })).isInstanceOf(IOException.class);
    }

    private void tripOpen() {
        for (int i = 0; i < 5; i++) {
            fail();
        }
    }

    // --- CLOSED ---

    @Test
    void shouldStartClosed() {
        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.name()).isEqualTo("workflow");
    }

    @Test
    void shouldReturnResultWhenClosed() throws Exception {
        assertThat(breaker.call(() -> "ok")).isEqualTo("ok");
        assertThat(breaker.metrics().successCount()).isZero();
    }

    @Test
    void shouldRethrowOriginalFailure() {
        var error = new IllegalStateException("boom");
        assertThatThrownBy(() -> breaker.call(() -> {
            throw error;
        })).isSameAs(error);
        assertThat(breaker.metrics().failureCount()).isEqualTo(1);
    }

    @Test
    void shouldNotResetFailureCountOnSuccessWhileClosed() throws Exception {
        fail();
        fail();
        breaker.call(() -> "ok");
        fail();

        assertThat(breaker.metrics().failureCount()).isEqualTo(3);
        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
    }

    // --- OPEN ---

    @Test
    void shouldOpenAfterThresholdAndRejectWithoutInvoking() {
        tripOpen();
        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);

        AtomicInteger invocations = new AtomicInteger();
        assertThatThrownBy(() -> breaker.call(invocations::incrementAndGet))
                .isInstanceOf(CircuitBreakerOpenException.class)
                .hasMessageContaining("workflow");
        assertThat(invocations).hasValue(0);
    }

    @Test
    void shouldResetCountersOnTransition() {
        tripOpen();
        CircuitBreakerMetrics metrics = breaker.metrics();
        assertThat(metrics.state()).isEqualTo(CircuitState.OPEN);
        assertThat(metrics.failureCount()).isZero();
        assertThat(metrics.successCount()).isZero();
    }

    @Test
    void shouldReportRetryAfter() {
        tripOpen();
        clock.advance(Duration.ofSeconds(20));

        assertThatThrownBy(() -> breaker.call(() -> "never"))
                .isInstanceOfSatisfying(CircuitBreakerOpenException.class,
                        e -> assertThat(e.retryAfter()).isEqualTo(Duration.ofSeconds(40)));
    }

    @Test
    void shouldStayOpenBeforeTimeout() {
        tripOpen();
        clock.advance(Duration.ofSeconds(59));
        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
    }

    // --- HALF_OPEN ---

    @Test
    void shouldMoveToHalfOpenAfterTimeout() {
        tripOpen();
        clock.advance(Duration.ofSeconds(60));
        assertThat(breaker.state()).isEqualTo(CircuitState.HALF_OPEN);
    }

    @Test
    void shouldCloseAfterSuccessThreshold() throws Exception {
        tripOpen();
        clock.advance(Duration.ofSeconds(61));

        breaker.call(() -> "probe-1");
        assertThat(breaker.state()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(breaker.metrics().successCount()).isEqualTo(1);

        breaker.call(() -> "probe-2");
        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.metrics().successCount()).isZero();
    }

    @Test
    void shouldReopenOnHalfOpenFailure() {
        tripOpen();
        clock.advance(Duration.ofSeconds(61));
        assertThat(breaker.state()).isEqualTo(CircuitState.HALF_OPEN);

        fail();
        assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
        assertThatThrownBy(() -> breaker.call(() -> "rejected"))
                .isInstanceOf(CircuitBreakerOpenException.class);
    }

    // --- metrics / reset ---

    @Test
    void shouldComputeFailureRateOverWindow() throws Exception {
        breaker.call(() -> 1);
        breaker.call(() -> 2);
        fail();
        breaker.call(() -> 3);

        CircuitBreakerMetrics metrics = breaker.metrics();
        assertThat(metrics.recentCalls()).isEqualTo(4);
        assertThat(metrics.failureRate()).isCloseTo(0.25, within(1e-9));
    }

    @Test
    void shouldBoundOutcomeWindow() throws Exception {
        var small = new CircuitBreaker("small", CircuitBreakerConfig.create()
                .failureThreshold(100).windowSize(3), clock);
        small.call(() -> 1);
        small.call(() -> 2);
        small.call(() -> 3);
        small.call(() -> 4);

        assertThat(small.metrics().recentCalls()).isEqualTo(3);
        assertThat(small.metrics().failureRate()).isZero();
    }

    @Test
    void shouldReportZeroFailureRateWithoutCalls() {
        assertThat(breaker.metrics().failureRate()).isZero();
    }

    @Test
    void shouldResetToClosed() throws Exception {
        tripOpen();
        breaker.reset();

        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.call(() -> "ok")).isEqualTo("ok");
    }

    // --- async ---

    @Test
    void shouldRecordAsyncOutcomes() throws Exception {
        assertThat(breaker.callAsync(() -> CompletableFuture.completedFuture("ok")).get()).isEqualTo("ok");

        CompletableFuture<String> failed = breaker.callAsync(
                () -> CompletableFuture.failedFuture(new IOException("down")));
        assertThatThrownBy(failed::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IOException.class);
        assertThat(breaker.metrics().failureCount()).isEqualTo(1);
    }

    @Test
    void shouldRejectAsyncCallWhenOpen() {
        tripOpen();
        AtomicInteger invocations = new AtomicInteger();

        CompletableFuture<Integer> result = breaker.callAsync(
                () -> CompletableFuture.completedFuture(invocations.incrementAndGet()));

        assertThat(result).isCompletedExceptionally();
        assertThatThrownBy(result::get).hasCauseInstanceOf(CircuitBreakerOpenException.class);
        assertThat(invocations).hasValue(0);
    }

    // --- config ---

    @Test
    void shouldRejectInvalidConfig() {
        assertThatThrownBy(() -> CircuitBreakerConfig.create().failureThreshold(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CircuitBreakerConfig.create().timeout(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CircuitBreakerConfig.create().windowSize(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
