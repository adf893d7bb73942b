package com.multiquery.connector;

import com.multiquery.model.BackendId;
import com.multiquery.model.QueryOutcome;

/**
 * Executes one query against one backend.
 *
 * <p>Implementations are shared across concurrent calls. The only per-call state they may hold is
 * what {@link #cancelRunning(Thread)} needs to find a call in progress.
 * {@link #execute(String)} never throws: connection, query and timeout errors are returned as a
 * {@link com.multiquery.model.QueryFailure} carrying {@link #getBackendId()}.
 */
public interface BackendConnector {

    BackendId getBackendId();

    BackendKind getKind();

    /**
     * Execute the query and materialize its rows.
     *
     * @param query query text, passed to the backend unchanged
     * @return success with rows, or failure with the backend's error
     */
    QueryOutcome execute(String query);

    /**
     * Abort the call the given worker thread is currently running on this backend, if any.
     * The aborted call still returns its outcome from {@link #execute(String)}.
     *
     * @param worker thread running {@link #execute(String)}
     */
    default void cancelRunning(Thread worker) {
    }
}
