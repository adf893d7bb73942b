package com.multiquery.connector;

import com.multiquery.model.ErrorCategory;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Maps JDBC errors to {@link ErrorCategory}.
 *
 * <p>Transient: {@link SQLTransientException} (timeouts, connection acquisition, rollbacks),
 * {@link SQLRecoverableException}, and SQLState classes 08 (connection), 40 (transaction
 * rollback / deadlock), 57 (operator intervention, e.g. PostgreSQL admin shutdown), HYT00/HYT01
 * (ODBC-style timeouts). Everything else is permanent.
 */
public final class SqlErrorClassifier {

    private static final Set<String> TRANSIENT_SQLSTATE_CLASSES = Set.of("08", "40", "57");
    private static final Set<String> TRANSIENT_SQLSTATES = Set.of("HYT00", "HYT01");

    private SqlErrorClassifier() {
    }

    public static ErrorCategory classify(Throwable error) {
        Throwable t = error;
        int depth = 0;
        while (t != null && depth++ < 10) {
            if (t instanceof SQLTransientException || t instanceof SQLRecoverableException) {
                return ErrorCategory.TRANSIENT;
            }
            if (t instanceof SQLException sqlException && isTransientSqlState(sqlException.getSQLState())) {
                return ErrorCategory.TRANSIENT;
            }
            if (t instanceof java.net.SocketTimeoutException || t instanceof java.net.ConnectException) {
                return ErrorCategory.TRANSIENT;
            }
            t = t.getCause();
        }
        return ErrorCategory.PERMANENT;
    }

    static boolean isTransientSqlState(String sqlState) {
        if (sqlState == null || sqlState.length() < 2) {
            return false;
        }
        String upper = sqlState.toUpperCase();
        return TRANSIENT_SQLSTATES.contains(upper) || TRANSIENT_SQLSTATE_CLASSES.contains(upper.substring(0, 2));
    }

    /**
     * Most specific non-blank message in the cause chain, prefixed with the SQLState when known.
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        Throwable c = error.getCause();
        while (c != null && c != c.getCause()) {
            if (c.getMessage() != null && !c.getMessage().isBlank()) {
                message = c.getMessage();
            }
            c = c.getCause();
        }
        if (message == null || message.isBlank()) {
            message = error.getClass().getSimpleName();
        }
        if (error instanceof SQLException sqlException && sqlException.getSQLState() != null) {
            return message + " (SQLState: " + sqlException.getSQLState() + ", Error Code: " + sqlException.getErrorCode() + ")";
        }
        return message;
    }
}
