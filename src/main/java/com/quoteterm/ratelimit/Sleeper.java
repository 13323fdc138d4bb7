package com.quoteterm.ratelimit;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocking wait used by the token bucket. Swapped for a clock-advancing fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());

    void sleep(Duration duration) throws InterruptedException;
}
