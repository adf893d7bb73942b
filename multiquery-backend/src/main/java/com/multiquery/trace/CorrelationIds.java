package com.multiquery.trace;

import com.multiquery.model.BackendId;
import lombok.Value;

/**
 * Identifiers attached to every event emitted within one call tree.
 *
 * <p>{@code spanId} and {@code backend} are only set inside a per-backend task.
 */
@Value
public class CorrelationIds {
    public static final CorrelationIds NONE = new CorrelationIds(null, null, null, null);

    String requestId;
    String correlationId;
    String spanId;
    String backend;

    public boolean isPresent() {
        return requestId != null;
    }

    CorrelationIds forBackend(BackendId backendId, String newSpanId) {
        return new CorrelationIds(requestId, correlationId, newSpanId, backendId != null ? backendId.getValue() : null);
    }
}
