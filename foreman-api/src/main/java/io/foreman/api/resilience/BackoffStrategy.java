package io.foreman.api.resilience;

/**
 * How retry delays grow with the attempt number {@code a} (1-indexed).
 */
public enum BackoffStrategy {
    /** {@code base * 2^(a-1)} */
    EXPONENTIAL,
    /** {@code base * a} */
    LINEAR,
    /** {@code base * fib(a)} with {@code fib(1) = fib(2) = 1} */
    FIBONACCI
}
