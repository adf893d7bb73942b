package com.multiquery.support;

import com.multiquery.connector.BackendConnector;
import com.multiquery.connector.BackendKind;
import com.multiquery.model.BackendId;
import com.multiquery.model.ErrorCategory;
import com.multiquery.model.QueryFailure;
import com.multiquery.model.QueryOutcome;
import com.multiquery.model.QuerySuccess;
import com.multiquery.trace.CorrelationContext;
import com.multiquery.trace.CorrelationIds;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Test connector that replays a script of outcomes and counts its calls.
 *
 * <p>When the script runs out the last step repeats.
 */
public class ScriptedConnector implements BackendConnector {

    private final BackendId backendId;
    private final BackendKind kind;
    private final Deque<Supplier<QueryOutcome>> script = new ArrayDeque<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger cancelRequests = new AtomicInteger();
    private final List<CorrelationIds> seenContexts = Collections.synchronizedList(new ArrayList<>());
    private Supplier<QueryOutcome> last;
    private volatile long delayMs;
    private volatile boolean ignoreInterrupts;
    private volatile String lastQuery;

    public ScriptedConnector(BackendId backendId) {
        this(backendId, BackendKind.RELATIONAL);
    }

    public ScriptedConnector(BackendId backendId, BackendKind kind) {
        this.backendId = backendId;
        this.kind = kind;
    }

    public ScriptedConnector thenSucceed(int rowCount) {
        script.add(() -> success(rowCount));
        return this;
    }

    public ScriptedConnector thenFail(ErrorCategory category, String message) {
        script.add(() -> QueryFailure.of(backendId, lastQuery, category, message));
        return this;
    }

    public ScriptedConnector thenThrow(RuntimeException e) {
        script.add(() -> {
            throw e;
        });
        return this;
    }

    public ScriptedConnector thenThrowError(Error e) {
        script.add(() -> {
            throw e;
        });
        return this;
    }

    public ScriptedConnector withDelay(long delayMs) {
        this.delayMs = delayMs;
        return this;
    }

    /**
     * Busy-wait instead of sleeping, the way a driver blocked on a socket read does not react to
     * {@link Thread#interrupt()}.
     */
    public ScriptedConnector withUninterruptibleDelay(long delayMs) {
        this.delayMs = delayMs;
        this.ignoreInterrupts = true;
        return this;
    }

    @Override
    public void cancelRunning(Thread worker) {
        cancelRequests.incrementAndGet();
    }

    @Override
    public BackendId getBackendId() {
        return backendId;
    }

    @Override
    public BackendKind getKind() {
        return kind;
    }

    @Override
    public QueryOutcome execute(String query) {
        calls.incrementAndGet();
        lastQuery = query;
        seenContexts.add(CorrelationContext.current());
        if (delayMs > 0 && ignoreInterrupts) {
            long end = System.nanoTime() + delayMs * 1_000_000L;
            while (System.nanoTime() < end) {
                Thread.onSpinWait();
            }
        } else if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return QueryFailure.of(backendId, query, ErrorCategory.CANCELLED, "interrupted");
            }
        }
        Supplier<QueryOutcome> step;
        synchronized (script) {
            step = script.isEmpty() ? last : script.poll();
            last = step;
        }
        if (step == null) {
            return success(0);
        }
        return step.get();
    }

    public int getCalls() {
        return calls.get();
    }

    public int getCancelRequests() {
        return cancelRequests.get();
    }

    public List<CorrelationIds> getSeenContexts() {
        return seenContexts;
    }

    private QuerySuccess success(int rowCount) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < rowCount; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", i + 1);
            row.put("source", backendId.getValue());
            rows.add(row);
        }
        return QuerySuccess.builder()
                .query(lastQuery)
                .rows(rows)
                .backend(backendId)
                .explanation("Successfully executed query returning " + rowCount + " rows")
                .durationMs(delayMs)
                .build();
    }
}
