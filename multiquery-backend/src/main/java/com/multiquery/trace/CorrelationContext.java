package com.multiquery.trace;

import com.multiquery.model.BackendId;
import org.slf4j.MDC;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Request/correlation identifiers bound to the current thread through the SLF4J {@link MDC}.
 *
 * <p>A call tree starts with {@link #begin()} and ends when the returned {@link Scope} is closed.
 * Worker threads do not inherit the MDC; tasks handed to an executor must be wrapped with
 * {@link #propagate(Callable, BackendId)} at submission time.
 */
public final class CorrelationContext {

    public static final String MDC_REQUEST_ID = "request_id";
    public static final String MDC_CORRELATION_ID = "correlation_id";
    public static final String MDC_SPAN_ID = "span_id";
    public static final String MDC_BACKEND = "backend";

    private CorrelationContext() {
    }

    /**
     * Start a call tree with a fresh request id, reusing the correlation id in scope if any.
     *
     * @return scope to close when the call tree completes
     */
    public static Scope begin() {
        return begin(null);
    }

    /**
     * Start a call tree with a fresh request id.
     *
     * @param correlationId correlation id to join; when blank, the id already in scope is reused,
     *                      or a new one is created
     * @return scope to close when the call tree completes
     */
    public static Scope begin(String correlationId) {
        String cid = correlationId;
        if (cid == null || cid.isBlank()) {
            cid = MDC.get(MDC_CORRELATION_ID);
        }
        if (cid == null || cid.isBlank()) {
            cid = UUID.randomUUID().toString();
        }
        return attach(new CorrelationIds(UUID.randomUUID().toString(), cid.trim(), null, null));
    }

    /**
     * Join the call tree already bound to this thread, or start one if there is none.
     *
     * @return scope to close when the caller's part of the call tree completes
     */
    public static Scope joinOrBegin() {
        CorrelationIds current = current();
        if (current.isPresent()) {
            return attach(current);
        }
        return begin();
    }

    /**
     * Bind the given identifiers to the current thread.
     *
     * @param ids identifiers to install
     * @return scope restoring the previous binding on close
     */
    public static Scope attach(CorrelationIds ids) {
        Scope scope = new Scope(MDC.getCopyOfContextMap(), ids);
        put(MDC_REQUEST_ID, ids.getRequestId());
        put(MDC_CORRELATION_ID, ids.getCorrelationId());
        put(MDC_SPAN_ID, ids.getSpanId());
        put(MDC_BACKEND, ids.getBackend());
        return scope;
    }

    /**
     * Identifiers bound to the current thread, or {@link CorrelationIds#NONE}.
     */
    public static CorrelationIds current() {
        String requestId = MDC.get(MDC_REQUEST_ID);
        if (requestId == null) {
            return CorrelationIds.NONE;
        }
        return new CorrelationIds(requestId, MDC.get(MDC_CORRELATION_ID), MDC.get(MDC_SPAN_ID), MDC.get(MDC_BACKEND));
    }

    /**
     * Capture the caller's identifiers now and re-install them, tagged with a new span id for
     * {@code backend}, when the task runs.
     *
     * @param task task to run on another thread
     * @param backend backend the task works for
     * @return wrapped task
     */
    public static <T> Callable<T> propagate(Callable<T> task, BackendId backend) {
        final CorrelationIds captured = current().forBackend(backend, newSpanId());
        return () -> {
            try (Scope ignored = attach(captured)) {
                return task.call();
            }
        };
    }

    static String newSpanId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    private static void put(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    /**
     * Handle of one bound context. Closing it restores whatever the thread had before.
     */
    public static final class Scope implements AutoCloseable {
        private final Map<String, String> previous;
        private final CorrelationIds ids;

        private Scope(Map<String, String> previous, CorrelationIds ids) {
            this.previous = previous;
            this.ids = ids;
        }

        public CorrelationIds getIds() {
            return ids;
        }

        public String getRequestId() {
            return ids.getRequestId();
        }

        public String getCorrelationId() {
            return ids.getCorrelationId();
        }

        @Override
        public void close() {
            if (previous == null || previous.isEmpty()) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
