package com.multiquery.retry;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocks the calling thread between attempts. Replaced in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = delay -> {
        if (delay != null && !delay.isZero() && !delay.isNegative()) {
            TimeUnit.MILLISECONDS.sleep(delay.toMillis());
        } else if (Thread.interrupted()) {
            throw new InterruptedException("interrupted before retry");
        }
    };

    void sleep(Duration delay) throws InterruptedException;
}
