package com.multiquery.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Result of running one query against one backend: either a {@link QuerySuccess} or a
 * {@link QueryFailure}, never both.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "status")
@JsonSubTypes({
        @JsonSubTypes.Type(value = QuerySuccess.class, name = "success"),
        @JsonSubTypes.Type(value = QueryFailure.class, name = "failure")
})
public interface QueryOutcome {

    BackendId getBackend();

    boolean isSuccess();
}
