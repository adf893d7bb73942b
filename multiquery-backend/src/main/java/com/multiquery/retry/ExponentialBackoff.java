package com.multiquery.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * {@code initialDelay * multiplier^(retry-1)}, capped at {@code maxDelay}.
 *
 * <p>With jitter enabled the delay is drawn uniformly from {@code [d/2, d]} ("equal jitter"), so
 * concurrent callers retrying the same backend spread out while still backing off.
 */
public class ExponentialBackoff implements BackoffSchedule {

    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final boolean jitter;
    private final DoubleSupplier random;

    public ExponentialBackoff(Duration initialDelay, double multiplier, Duration maxDelay, boolean jitter) {
        this(initialDelay, multiplier, maxDelay, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    ExponentialBackoff(Duration initialDelay, double multiplier, Duration maxDelay, boolean jitter, DoubleSupplier random) {
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be >= 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
        this.random = random;
    }

    @Override
    public Duration delayBeforeRetry(int retryNumber) {
        int exponent = Math.max(0, retryNumber - 1);
        double raw = initialDelay.toMillis() * Math.pow(multiplier, exponent);
        long cappedMs = (long) Math.min(raw, (double) maxDelay.toMillis());
        if (!jitter || cappedMs <= 0) {
            return Duration.ofMillis(cappedMs);
        }
        long half = cappedMs / 2;
        long jittered = half + (long) (random.getAsDouble() * (cappedMs - half));
        return Duration.ofMillis(Math.min(jittered, cappedMs));
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public boolean isJitter() {
        return jitter;
    }
}
