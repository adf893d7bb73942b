package com.multiquery.model;

/**
 * Classification of a backend failure.
 */
public enum ErrorCategory {
    /** Connectivity or timeout class failure; worth retrying. */
    TRANSIENT,
    /** Malformed query, authorization or data errors; never retried. */
    PERMANENT,
    /** The backend task was cancelled before it produced an outcome. */
    CANCELLED,
    /** The backend task terminated abnormally outside the connector contract. */
    INTERNAL
}
