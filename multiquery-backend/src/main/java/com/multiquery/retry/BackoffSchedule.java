package com.multiquery.retry;

import java.time.Duration;

/**
 * Delay to wait before a retry.
 */
@FunctionalInterface
public interface BackoffSchedule {

    /**
     * @param retryNumber 1 for the first retry (the second attempt), 2 for the next, ...
     * @return delay before that retry, never negative
     */
    Duration delayBeforeRetry(int retryNumber);

    static BackoffSchedule fixed(Duration delay) {
        Duration d = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        return retryNumber -> d;
    }

    static BackoffSchedule none() {
        return fixed(Duration.ZERO);
    }
}
