package com.multiquery.trace;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Scoped span around a block of work: emits {@code <name>.start}, then {@code <name>.completed}
 * with a summary and {@code duration_ms}, or {@code <name>.failed} if the block throws.
 */
public final class QuerySpan {

    private QuerySpan() {
    }

    public static <T> T run(
            QueryEventSink sink,
            String name,
            Map<String, Object> fields,
            Supplier<T> work,
            Function<? super T, Map<String, Object>> summary
    ) {
        sink.emit(QueryEvent.info(name + ".start", fields));
        long start = System.nanoTime();
        T result;
        try {
            result = work.get();
        } catch (RuntimeException e) {
            Map<String, Object> failed = new LinkedHashMap<>();
            failed.put("error_type", e.getClass().getSimpleName());
            failed.put("error", e.getMessage());
            failed.put("duration_ms", elapsedMs(start));
            sink.emit(QueryEvent.warn(name + ".failed", failed));
            throw e;
        }
        Map<String, Object> completed = new LinkedHashMap<>();
        if (summary != null) {
            Map<String, Object> extra = summary.apply(result);
            if (extra != null) {
                completed.putAll(extra);
            }
        }
        completed.put("duration_ms", elapsedMs(start));
        sink.emit(QueryEvent.info(name + ".completed", completed));
        return result;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
