package com.multiquery.trace;

/**
 * Destination for {@link QueryEvent}s. Implementations must be thread-safe; nothing they
 * return is consumed.
 */
@FunctionalInterface
public interface QueryEventSink {

    void emit(QueryEvent event);

    static QueryEventSink noop() {
        return event -> {
        };
    }
}
