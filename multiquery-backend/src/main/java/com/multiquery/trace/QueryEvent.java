package com.multiquery.trace;

import lombok.Value;
import org.slf4j.event.Level;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One discrete observability event: identifiers, a message and open-ended named fields.
 */
@Value
public class QueryEvent {
    Level level;
    String message;
    CorrelationIds ids;
    Map<String, Object> fields;

    public QueryEvent(Level level, String message, CorrelationIds ids, Map<String, Object> fields) {
        this.level = level != null ? level : Level.INFO;
        this.message = message;
        this.ids = ids != null ? ids : CorrelationIds.NONE;
        this.fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
    }

    /**
     * Event stamped with the identifiers bound to the current thread.
     */
    public static QueryEvent of(Level level, String message, Map<String, Object> fields) {
        return new QueryEvent(level, message, CorrelationContext.current(), fields);
    }

    public static QueryEvent info(String message, Map<String, Object> fields) {
        return of(Level.INFO, message, fields);
    }

    public static QueryEvent warn(String message, Map<String, Object> fields) {
        return of(Level.WARN, message, fields);
    }
}
