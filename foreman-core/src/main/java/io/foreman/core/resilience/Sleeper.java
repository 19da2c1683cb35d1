package io.foreman.core.resilience;

import java.time.Duration;

/**
 * Blocking pause between retry attempts. Replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
