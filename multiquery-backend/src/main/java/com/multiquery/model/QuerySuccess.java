package com.multiquery.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Successful execution of a query on one backend.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QuerySuccess implements QueryOutcome {
    String query;
    List<Map<String, Object>> rows;
    BackendId backend;
    String explanation;
    long durationMs;

    @Builder
    public QuerySuccess(String query, List<Map<String, Object>> rows, BackendId backend, String explanation, long durationMs) {
        if (backend == null) {
            throw new IllegalArgumentException("backend is required");
        }
        this.query = query;
        this.rows = rows != null ? List.copyOf(rows) : List.of();
        this.backend = backend;
        this.explanation = explanation;
        this.durationMs = durationMs;
    }

    @JsonIgnore
    @Override
    public boolean isSuccess() {
        return true;
    }
}
