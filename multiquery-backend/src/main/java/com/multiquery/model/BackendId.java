package com.multiquery.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Locale;

/**
 * Stable label of one backend, used as the aggregation key and for log attribution.
 *
 * <p>Labels are trimmed and lower-cased so {@code "Warehouse"} and {@code "warehouse"} name the
 * same backend.
 */
@EqualsAndHashCode
public final class BackendId implements Comparable<BackendId> {

    public static final BackendId RELATIONAL = new BackendId("relational");
    public static final BackendId WAREHOUSE = new BackendId("warehouse");

    private final String value;

    private BackendId(String value) {
        this.value = value;
    }

    /**
     * Create a backend id from a label.
     *
     * @param label backend label
     * @return normalized backend id
     * @throws IllegalArgumentException when the label is null or blank
     */
    @JsonCreator
    public static BackendId of(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Backend id must not be blank");
        }
        return new BackendId(label.trim().toLowerCase(Locale.ROOT));
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(BackendId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
