package com.multiquery.retry;

import com.multiquery.model.BackendId;
import com.multiquery.model.ErrorCategory;
import com.multiquery.model.QueryFailure;
import com.multiquery.model.QueryOutcome;
import com.multiquery.support.RecordingEventSink;
import com.multiquery.support.ScriptedConnector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final List<Duration> sleeps = new ArrayList<>();

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private RetryPolicy policy(int maxAttempts, TransientErrorPredicate predicate, RecordingEventSink sink) {
        return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .transientErrorPredicate(predicate)
                .backoff(retry -> Duration.ofMillis(100L * retry))
                .sleeper(sleeps::add)
                .eventSink(sink)
                .build();
    }

    @Test
    void succeeds_whenTransientFailuresStayWithinBudget() {
        ScriptedConnector connector = new ScriptedConnector(BackendId.WAREHOUSE)
                .thenFail(ErrorCategory.TRANSIENT, "connection reset")
                .thenFail(ErrorCategory.TRANSIENT, "connection reset")
                .thenSucceed(2);

        QueryOutcome outcome = policy(3, TransientErrorPredicate.byCategory(), new RecordingEventSink())
                .wrap(connector, "SELECT 1");

        assertTrue(outcome.isSuccess());
        assertEquals(3, connector.getCalls());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
    }

    @Test
    void returnsLastFailure_whenBudgetIsOneShort() {
        ScriptedConnector connector = new ScriptedConnector(BackendId.WAREHOUSE)
                .thenFail(ErrorCategory.TRANSIENT, "timeout 1")
                .thenFail(ErrorCategory.TRANSIENT, "timeout 2")
                .thenSucceed(2);
        RecordingEventSink sink = new RecordingEventSink();

        QueryOutcome outcome = policy(2, TransientErrorPredicate.byCategory(), sink).wrap(connector, "SELECT 1");

        assertFalse(outcome.isSuccess());
        QueryFailure failure = (QueryFailure) outcome;
        assertEquals("timeout 2", failure.getErrorMessage());
        assertEquals(ErrorCategory.TRANSIENT, failure.getCategory());
        assertEquals(BackendId.WAREHOUSE, failure.getBackend());
        assertEquals(2, failure.getAttempts());
        assertEquals(2, connector.getCalls());
        assertEquals(1, sleeps.size());
        assertEquals(1, sink.named("backend.retry").size());
        assertEquals(1, sink.named("backend.retry_exhausted").size());
    }

    @Test
    void neverRetries_whenPredicateRejectsFailure() {
        ScriptedConnector connector = new ScriptedConnector(BackendId.RELATIONAL)
                .thenFail(ErrorCategory.PERMANENT, "syntax error at or near \"SELEC\"")
                .thenSucceed(1);

        QueryOutcome outcome = policy(5, TransientErrorPredicate.byCategory(), new RecordingEventSink())
                .wrap(connector, "SELEC 1");

        assertFalse(outcome.isSuccess());
        assertEquals(1, connector.getCalls());
        assertEquals(1, ((QueryFailure) outcome).getAttempts());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void neverRetries_withNeverPredicate_evenForTransientFailures() {
        ScriptedConnector connector = new ScriptedConnector(BackendId.RELATIONAL)
                .thenFail(ErrorCategory.TRANSIENT, "connection refused")
                .thenSucceed(1);

        QueryOutcome outcome = policy(5, TransientErrorPredicate.never(), new RecordingEventSink())
                .wrap(connector, "SELECT 1");

        assertFalse(outcome.isSuccess());
        assertEquals(1, connector.getCalls());
    }

    @Test
    void returnsImmediately_onFirstSuccess() {
        ScriptedConnector connector = new ScriptedConnector(BackendId.RELATIONAL).thenSucceed(3);

        QueryOutcome outcome = policy(3, TransientErrorPredicate.byCategory(), new RecordingEventSink())
                .wrap(connector, "SELECT 1");

        assertTrue(outcome.isSuccess());
        assertEquals(1, connector.getCalls());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void attemptCount_isDeterminedByPredicateAndBudget() {
        for (int run = 0; run < 5; run++) {
            ScriptedConnector connector = new ScriptedConnector(BackendId.WAREHOUSE)
                    .thenFail(ErrorCategory.TRANSIENT, "still down");
            RetryPolicy retryPolicy = RetryPolicy.builder()
                    .maxAttempts(4)
                    .backoff(new ExponentialBackoff(Duration.ofMillis(1), 2.0, Duration.ofMillis(8), true))
                    .sleeper(delay -> { })
                    .build();

            retryPolicy.wrap(connector, "SELECT 1");

            assertEquals(4, connector.getCalls());
        }
    }

    @Test
    void interruptedBackoff_returnsCancelledFailure() {
        ScriptedConnector connector = new ScriptedConnector(BackendId.WAREHOUSE)
                .thenFail(ErrorCategory.TRANSIENT, "timeout")
                .thenSucceed(1);
        RetryPolicy retryPolicy = RetryPolicy.builder()
                .maxAttempts(3)
                .sleeper(delay -> {
                    throw new InterruptedException("cancelled");
                })
                .build();

        QueryOutcome outcome = retryPolicy.wrap(connector, "SELECT 1");

        assertFalse(outcome.isSuccess());
        assertEquals(ErrorCategory.CANCELLED, ((QueryFailure) outcome).getCategory());
        assertEquals(1, connector.getCalls());
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void interruptedDuringAttempt_makesNoFurtherAttempt() {
        ScriptedConnector connector = new ScriptedConnector(BackendId.WAREHOUSE) {
            @Override
            public QueryOutcome execute(String query) {
                QueryOutcome outcome = super.execute(query);
                Thread.currentThread().interrupt();
                return outcome;
            }
        }.thenFail(ErrorCategory.TRANSIENT, "canceling statement due to user request");
        RetryPolicy retryPolicy = RetryPolicy.builder()
                .maxAttempts(5)
                .backoff(BackoffSchedule.none())
                .build();

        QueryFailure failure = (QueryFailure) retryPolicy.wrap(connector, "SELECT 1");

        assertEquals(1, connector.getCalls());
        assertEquals(ErrorCategory.CANCELLED, failure.getCategory());
        assertEquals(1, failure.getAttempts());
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void threadSleep_withZeroDelay_stillObservesInterrupt() {
        Thread.currentThread().interrupt();

        assertThrows(InterruptedException.class, () -> Sleeper.THREAD_SLEEP.sleep(Duration.ZERO));
        assertFalse(Thread.currentThread().isInterrupted());
    }

    @Test
    void connectorExceptions_propagateWithoutRetry() {
        ScriptedConnector connector = new ScriptedConnector(BackendId.RELATIONAL)
                .thenThrow(new IllegalStateException("driver bug"));

        assertThrows(IllegalStateException.class,
                () -> policy(3, TransientErrorPredicate.byCategory(), new RecordingEventSink()).wrap(connector, "SELECT 1"));
        assertEquals(1, connector.getCalls());
    }

    @Test
    void rejectsNonPositiveBudget() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxAttempts(0).build());
    }
}
