package com.multiquery.trace;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Writes events to the {@code com.multiquery.events} logger as {@code message key=value ...}.
 *
 * <p>The event's identifiers are bound to the MDC for the duration of the log call, so the
 * console pattern shows them even when the event is emitted from another thread.
 */
@Slf4j(topic = "com.multiquery.events")
public class Slf4jQueryEventSink implements QueryEventSink {

    private static final int MAX_VALUE_CHARS = 500;

    @Override
    public void emit(QueryEvent event) {
        if (event == null) {
            return;
        }
        String line = format(event);
        if (!event.getIds().isPresent()) {
            write(event, line);
            return;
        }
        try (CorrelationContext.Scope ignored = CorrelationContext.attach(event.getIds())) {
            write(event, line);
        }
    }

    private void write(QueryEvent event, String line) {
        switch (event.getLevel()) {
            case ERROR:
                log.error(line);
                break;
            case WARN:
                log.warn(line);
                break;
            case DEBUG:
                log.debug(line);
                break;
            case TRACE:
                log.trace(line);
                break;
            default:
                log.info(line);
        }
    }

    static String format(QueryEvent event) {
        StringBuilder sb = new StringBuilder(event.getMessage() != null ? event.getMessage() : "event");
        for (Map.Entry<String, Object> field : event.getFields().entrySet()) {
            sb.append(' ').append(field.getKey()).append('=').append(render(field.getValue()));
        }
        return sb.toString();
    }

    private static String render(Object value) {
        if (value == null) {
            return "null";
        }
        String s = String.valueOf(value).replace('\n', ' ').replace('\r', ' ');
        if (s.length() > MAX_VALUE_CHARS) {
            s = s.substring(0, MAX_VALUE_CHARS) + "...";
        }
        if (s.indexOf(' ') >= 0 || s.isEmpty()) {
            return '"' + s.replace("\"", "\\\"") + '"';
        }
        return s;
    }
}
