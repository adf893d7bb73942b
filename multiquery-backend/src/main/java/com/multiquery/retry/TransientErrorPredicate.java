package com.multiquery.retry;

import com.multiquery.model.ErrorCategory;
import com.multiquery.model.QueryFailure;

/**
 * Decides whether a failure is worth retrying.
 */
@FunctionalInterface
public interface TransientErrorPredicate {

    boolean isTransient(QueryFailure failure);

    /**
     * Retry exactly the failures a connector classified as {@link ErrorCategory#TRANSIENT}.
     */
    static TransientErrorPredicate byCategory() {
        return failure -> failure != null && failure.getCategory() == ErrorCategory.TRANSIENT;
    }

    static TransientErrorPredicate never() {
        return failure -> false;
    }
}
