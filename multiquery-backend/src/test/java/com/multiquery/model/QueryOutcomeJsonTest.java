package com.multiquery.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryOutcomeJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void success_isTaggedAndSnakeCased() throws Exception {
        QuerySuccess success = QuerySuccess.builder()
                .query("SELECT 1 AS one")
                .rows(List.of(Map.of("one", 1)))
                .backend(BackendId.RELATIONAL)
                .explanation("Successfully executed query returning 1 rows")
                .durationMs(12)
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(success));

        assertEquals("success", json.get("status").asText());
        assertEquals("relational", json.get("backend").asText());
        assertEquals(1, json.get("rows").get(0).get("one").asInt());
        assertEquals(12, json.get("duration_ms").asLong());
        assertFalse(json.has("success"));
    }

    @Test
    void failure_omitsUnknownQuery() throws Exception {
        QueryFailure failure = QueryFailure.of(BackendId.WAREHOUSE, null, ErrorCategory.TRANSIENT, "timeout");

        JsonNode json = mapper.readTree(mapper.writeValueAsString(failure));

        assertEquals("failure", json.get("status").asText());
        assertEquals("timeout", json.get("error_message").asText());
        assertEquals("warehouse", json.get("backend").asText());
        assertEquals("TRANSIENT", json.get("category").asText());
        assertEquals(1, json.get("attempts").asInt());
        assertFalse(json.has("query"));
        assertFalse(json.has("transient"));
    }

    @Test
    void aggregate_isKeyedByBackendLabel() throws Exception {
        Map<BackendId, QueryOutcome> results = new LinkedHashMap<>();
        results.put(BackendId.RELATIONAL, QuerySuccess.builder().backend(BackendId.RELATIONAL).query("q").build());
        results.put(BackendId.WAREHOUSE, QueryFailure.cancelled(BackendId.WAREHOUSE, "q", "overall timeout of 10 ms exceeded"));
        AggregateResult aggregate = new AggregateResult("req-1", "corr-1", results, 15);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(aggregate));

        assertEquals("req-1", json.get("request_id").asText());
        assertEquals("corr-1", json.get("correlation_id").asText());
        assertEquals("success", json.get("results").get("relational").get("status").asText());
        assertEquals("CANCELLED", json.get("results").get("warehouse").get("category").asText());
        assertEquals("cancelled: overall timeout of 10 ms exceeded",
                json.get("results").get("warehouse").get("error_message").asText());
        assertFalse(json.has("success_count"));
        assertEquals(1, aggregate.getSuccessCount());
        assertFalse(aggregate.isAllSuccessful());
    }

    @Test
    void backendIdsAreNormalized() {
        assertEquals(BackendId.WAREHOUSE, BackendId.of(" Warehouse "));
        assertThrows(IllegalArgumentException.class, () -> BackendId.of("  "));
    }

    @Test
    void selectionMaskMatching() {
        assertTrue(SelectionMask.all().matches(BackendId.WAREHOUSE));
        assertTrue(SelectionMask.include(BackendId.RELATIONAL).matches(BackendId.RELATIONAL));
        assertFalse(SelectionMask.include(BackendId.RELATIONAL).matches(BackendId.WAREHOUSE));
        assertFalse(SelectionMask.exclude(BackendId.RELATIONAL).matches(BackendId.RELATIONAL));
        assertEquals("include[relational,warehouse]",
                SelectionMask.include(BackendId.RELATIONAL, BackendId.WAREHOUSE).toString());
    }
}
