package com.multiquery.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Failed execution of a query on one backend.
 *
 * <p>{@code query} is null when the failing query was not known at failure time. {@code attempts}
 * counts connector invocations that led to this failure (0 when the backend was never reached).
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryFailure implements QueryOutcome {
    String errorMessage;
    BackendId backend;
    String query;
    ErrorCategory category;
    @With
    int attempts;

    @Builder
    public QueryFailure(String errorMessage, BackendId backend, String query, ErrorCategory category, int attempts) {
        if (backend == null) {
            throw new IllegalArgumentException("backend is required");
        }
        this.errorMessage = errorMessage != null ? errorMessage : "unknown error";
        this.backend = backend;
        this.query = query;
        this.category = category != null ? category : ErrorCategory.PERMANENT;
        this.attempts = attempts;
    }

    public static QueryFailure of(BackendId backend, String query, ErrorCategory category, String errorMessage) {
        return new QueryFailure(errorMessage, backend, query, category, 1);
    }

    public static QueryFailure cancelled(BackendId backend, String query, String reason) {
        return new QueryFailure("cancelled: " + reason, backend, query, ErrorCategory.CANCELLED, 0);
    }

    @JsonIgnore
    public boolean isTransient() {
        return category == ErrorCategory.TRANSIENT;
    }

    @JsonIgnore
    @Override
    public boolean isSuccess() {
        return false;
    }
}
