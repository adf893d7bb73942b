package com.multiquery.service;

import com.multiquery.connector.BackendConnector;
import com.multiquery.model.AggregateResult;
import com.multiquery.model.BackendId;
import com.multiquery.model.ErrorCategory;
import com.multiquery.model.QueryFailure;
import com.multiquery.model.QueryOutcome;
import com.multiquery.model.QuerySuccess;
import com.multiquery.model.SelectionMask;
import com.multiquery.retry.RetryPolicy;
import com.multiquery.trace.CorrelationContext;
import com.multiquery.trace.CorrelationIds;
import com.multiquery.trace.QueryEvent;
import com.multiquery.trace.QueryEventSink;
import com.multiquery.trace.QuerySpan;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Fans one query out to the selected backends and collects every outcome.
 *
 * <p>Each backend runs as its own task on the shared executor, wrapped by the {@link RetryPolicy}.
 * Tasks share nothing and a failing backend never cancels a sibling. The only exception that
 * leaves {@link #execute(String, SelectionMask)} is {@link InvalidSelectionException}, raised
 * before anything is dispatched; every backend-level problem becomes a {@link QueryFailure} in
 * the returned {@link AggregateResult}, which always holds exactly one entry per selected backend.
 */
@Slf4j
public class QueryOrchestrator {

    private final BackendRegistry registry;
    private final RetryPolicy retryPolicy;
    private final ExecutorService executor;
    private final QueryEventSink eventSink;
    private final Duration timeout;

    /**
     * Create an orchestrator.
     *
     * @param registry registered backends
     * @param retryPolicy retry policy applied to every backend call
     * @param executor executor running the per-backend tasks
     * @param eventSink destination of orchestration events
     * @param timeout overall time budget of one call; in-flight backends are cancelled after it
     */
    public QueryOrchestrator(
            BackendRegistry registry,
            RetryPolicy retryPolicy,
            ExecutorService executor,
            QueryEventSink eventSink,
            Duration timeout
    ) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.registry = registry;
        this.retryPolicy = retryPolicy;
        this.executor = executor;
        this.eventSink = eventSink != null ? eventSink : QueryEventSink.noop();
        this.timeout = timeout;
    }

    public BackendRegistry getRegistry() {
        return registry;
    }

    /**
     * Run the query on every backend selected by the mask.
     *
     * @param query query text, passed to each backend unchanged
     * @param selection which backends to use
     * @return one outcome per selected backend plus the total elapsed time
     * @throws InvalidSelectionException when the query is blank or the mask selects no registered
     *                                   backend; no backend is contacted in that case
     */
    public AggregateResult execute(String query, SelectionMask selection) {
        if (query == null || query.isBlank()) {
            throw new InvalidSelectionException("Query text is required");
        }
        List<BackendConnector> selected = registry.resolve(selection);

        try (CorrelationContext.Scope scope = CorrelationContext.joinOrBegin()) {
            Map<String, Object> startFields = new LinkedHashMap<>();
            startFields.put("selection", selection.toString());
            startFields.put("backends", selected.stream()
                    .map(c -> c.getBackendId().getValue())
                    .collect(Collectors.joining(",")));
            log.debug("Dispatching query to {}: {}", startFields.get("backends"), query);

            return QuerySpan.run(
                    eventSink,
                    "orchestration",
                    startFields,
                    () -> fanOut(query, selected, scope.getIds()),
                    result -> Map.of(
                            "successes", result.getSuccessCount(),
                            "failures", result.getFailureCount()
                    )
            );
        }
    }

    private AggregateResult fanOut(String query, List<BackendConnector> selected, CorrelationIds ids) {
        long start = System.nanoTime();
        long deadline = start + timeout.toNanos();

        Map<BackendId, RunningTask> tasks = new LinkedHashMap<>();
        Map<BackendId, QueryOutcome> outcomes = new LinkedHashMap<>();
        for (BackendConnector connector : selected) {
            BackendId backend = connector.getBackendId();
            outcomes.put(backend, null);
            RunningTask task = new RunningTask(connector);
            Callable<QueryOutcome> work = CorrelationContext.propagate(() -> task.run(() -> runBackend(connector, query)), backend);
            try {
                task.future = executor.submit(work);
                tasks.put(backend, task);
            } catch (RejectedExecutionException e) {
                log.error("Executor rejected task for backend={}", backend, e);
                outcomes.put(backend, new QueryFailure("backend task rejected: " + e.getMessage(), backend, query, ErrorCategory.INTERNAL, 0));
            }
        }

        boolean interrupted = false;
        for (Map.Entry<BackendId, RunningTask> entry : tasks.entrySet()) {
            BackendId backend = entry.getKey();
            RunningTask task = entry.getValue();
            if (interrupted) {
                task.cancel();
                outcomes.put(backend, QueryFailure.cancelled(backend, query, "caller interrupted"));
                continue;
            }
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                QueryOutcome outcome = task.future.get(remaining, TimeUnit.NANOSECONDS);
                outcomes.put(backend, outcome != null ? outcome : isolationFailure(backend, query, null));
            } catch (TimeoutException e) {
                task.cancel();
                log.warn("Backend {} did not complete within {} ms; cancelled", backend, timeout.toMillis());
                outcomes.put(backend, QueryFailure.cancelled(backend, query, "overall timeout of " + timeout.toMillis() + " ms exceeded"));
            } catch (ExecutionException e) {
                outcomes.put(backend, isolationFailure(backend, query, e.getCause()));
            } catch (CancellationException e) {
                outcomes.put(backend, QueryFailure.cancelled(backend, query, "backend task cancelled"));
            } catch (InterruptedException e) {
                interrupted = true;
                task.cancel();
                outcomes.put(backend, QueryFailure.cancelled(backend, query, "caller interrupted"));
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        long totalMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        return new AggregateResult(ids.getRequestId(), ids.getCorrelationId(), outcomes, totalMs);
    }

    private QueryOutcome runBackend(BackendConnector connector, String query) {
        BackendId backend = connector.getBackendId();
        QueryOutcome outcome;
        try {
            outcome = retryPolicy.wrap(connector, query);
        } catch (RuntimeException e) {
            outcome = isolationFailure(backend, query, e);
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("backend", backend.getValue());
        if (outcome instanceof QuerySuccess success) {
            fields.put("rows", success.getRows().size());
            fields.put("duration_ms", success.getDurationMs());
            eventSink.emit(QueryEvent.info("backend.completed", fields));
        } else if (outcome instanceof QueryFailure failure) {
            fields.put("category", failure.getCategory());
            fields.put("attempts", failure.getAttempts());
            fields.put("error", failure.getErrorMessage());
            eventSink.emit(QueryEvent.warn("backend.failed", fields));
        }
        return outcome;
    }

    /**
     * One submitted backend task and the worker running it.
     *
     * <p>The worker is cleared under the task's lock before {@link #run} returns, so
     * {@link #cancel()} only ever aborts the call made by this task and never a later task the
     * same worker picks up.
     */
    private static final class RunningTask {
        private final BackendConnector connector;
        private Future<QueryOutcome> future;
        private Thread worker;

        private RunningTask(BackendConnector connector) {
            this.connector = connector;
        }

        QueryOutcome run(Supplier<QueryOutcome> work) {
            synchronized (this) {
                worker = Thread.currentThread();
            }
            try {
                return work.get();
            } finally {
                synchronized (this) {
                    worker = null;
                }
            }
        }

        synchronized void cancel() {
            future.cancel(true);
            if (worker != null) {
                connector.cancelRunning(worker);
            }
        }
    }

    private QueryFailure isolationFailure(BackendId backend, String query, Throwable error) {
        if (error == null) {
            return new QueryFailure("backend task produced no outcome", backend, query, ErrorCategory.INTERNAL, 0);
        }
        log.error("Backend task for {} terminated abnormally", backend, error);
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new QueryFailure("backend task failed unexpectedly: " + message, backend, query, ErrorCategory.INTERNAL, 0);
    }
}
