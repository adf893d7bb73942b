package com.multiquery.service;

/**
 * Thrown when a query call is invalid before any backend is contacted: an empty backend
 * selection, an unknown backend, or blank query text.
 */
public class InvalidSelectionException extends IllegalArgumentException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public InvalidSelectionException(String message) {
        super(message);
    }
}
