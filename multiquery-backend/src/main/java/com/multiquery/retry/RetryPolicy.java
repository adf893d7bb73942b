package com.multiquery.retry;

import com.multiquery.connector.BackendConnector;
import com.multiquery.model.BackendId;
import com.multiquery.model.ErrorCategory;
import com.multiquery.model.QueryFailure;
import com.multiquery.model.QueryOutcome;
import com.multiquery.trace.QueryEvent;
import com.multiquery.trace.QueryEventSink;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded retry around a {@link BackendConnector} call.
 *
 * <p>A success is returned at once. A failure is retried only while the
 * {@link TransientErrorPredicate} accepts it and attempts remain; otherwise the last failure is
 * returned as the connector produced it, annotated with the number of attempts made. The number of
 * attempts depends only on the outcome sequence, the predicate and {@code maxAttempts}.
 *
 * <p>Exceptions thrown by a connector are not retried and propagate to the caller. An interrupted
 * thread makes no further attempt.
 */
@Slf4j
public class RetryPolicy {

    private final int maxAttempts;
    private final TransientErrorPredicate transientErrorPredicate;
    private final BackoffSchedule backoff;
    private final Sleeper sleeper;
    private final QueryEventSink eventSink;

    @Builder
    public RetryPolicy(
            int maxAttempts,
            TransientErrorPredicate transientErrorPredicate,
            BackoffSchedule backoff,
            Sleeper sleeper,
            QueryEventSink eventSink
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.transientErrorPredicate = transientErrorPredicate != null ? transientErrorPredicate : TransientErrorPredicate.byCategory();
        this.backoff = backoff != null ? backoff : BackoffSchedule.none();
        this.sleeper = sleeper != null ? sleeper : Sleeper.THREAD_SLEEP;
        this.eventSink = eventSink != null ? eventSink : QueryEventSink.noop();
    }

    /**
     * A policy that makes exactly one attempt.
     */
    public static RetryPolicy noRetry() {
        return RetryPolicy.builder().maxAttempts(1).build();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Run the query on the connector, retrying transient failures.
     *
     * @param connector backend connector
     * @param query query text
     * @return the first success, or the last failure
     */
    public QueryOutcome wrap(BackendConnector connector, String query) {
        BackendId backend = connector.getBackendId();
        for (int attempt = 1; ; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                log.debug("Backend {} task interrupted before attempt {}; stopping", backend, attempt);
                return QueryFailure.cancelled(backend, query, "interrupted before attempt " + attempt)
                        .withAttempts(attempt - 1);
            }
            QueryOutcome outcome = connector.execute(query);
            if (outcome == null) {
                return new QueryFailure("connector returned no outcome", backend, query, ErrorCategory.INTERNAL, attempt);
            }
            if (outcome.isSuccess()) {
                if (attempt > 1) {
                    log.info("Backend {} succeeded after {} attempts", backend, attempt);
                }
                return outcome;
            }

            QueryFailure failure = ((QueryFailure) outcome).withAttempts(attempt);
            if (!transientErrorPredicate.isTransient(failure)) {
                return failure;
            }
            if (attempt >= maxAttempts) {
                eventSink.emit(QueryEvent.warn("backend.retry_exhausted", fields(backend, attempt, null, failure)));
                return failure;
            }

            Duration delay = backoff.delayBeforeRetry(attempt);
            eventSink.emit(QueryEvent.info("backend.retry", fields(backend, attempt, delay, failure)));
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return QueryFailure.cancelled(backend, query, "interrupted while waiting to retry").withAttempts(attempt);
            }
        }
    }

    private Map<String, Object> fields(BackendId backend, int attempt, Duration delay, QueryFailure failure) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("backend", backend.getValue());
        fields.put("attempt", attempt);
        fields.put("max_attempts", maxAttempts);
        if (delay != null) {
            fields.put("delay_ms", delay.toMillis());
        }
        fields.put("error", failure.getErrorMessage());
        return fields;
    }
}
