package com.multiquery.connector;

import java.util.Locale;

/**
 * Backend variants a connector can be registered as.
 */
public enum BackendKind {
    RELATIONAL,
    WAREHOUSE;

    public static BackendKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Backend kind is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported backend kind: " + value + " (expected relational or warehouse)");
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
