package com.multiquery.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one fan-out: one {@link QueryOutcome} per selected backend plus the wall-clock time
 * from dispatch to the last completion.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AggregateResult {
    String requestId;
    String correlationId;
    Map<BackendId, QueryOutcome> results;
    long totalDurationMs;

    public AggregateResult(String requestId, String correlationId, Map<BackendId, QueryOutcome> results, long totalDurationMs) {
        this.requestId = requestId;
        this.correlationId = correlationId;
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        this.totalDurationMs = totalDurationMs;
    }

    public Optional<QueryOutcome> get(BackendId backend) {
        return Optional.ofNullable(results.get(backend));
    }

    @JsonIgnore
    public long getSuccessCount() {
        return results.values().stream().filter(QueryOutcome::isSuccess).count();
    }

    @JsonIgnore
    public long getFailureCount() {
        return results.size() - getSuccessCount();
    }

    @JsonIgnore
    public boolean isAllSuccessful() {
        return getFailureCount() == 0;
    }
}
