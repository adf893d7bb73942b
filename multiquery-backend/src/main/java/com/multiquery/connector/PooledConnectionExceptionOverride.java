package com.multiquery.connector;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLSyntaxErrorException;

/**
 * Keeps pooled connections alive when a query fails for reasons that say nothing about the
 * connection itself (bad SQL, missing privileges, bad data, unsupported features).
 */
public class PooledConnectionExceptionOverride implements SQLExceptionOverride {

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }
        if (sqlException instanceof SQLFeatureNotSupportedException || sqlException instanceof SQLSyntaxErrorException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState == null || sqlState.length() < 2) {
            return Override.CONTINUE_EVICT;
        }
        switch (sqlState.substring(0, 2)) {
            case "0A": // feature not supported
            case "22": // data exception
            case "23": // integrity constraint violation
            case "42": // syntax error or access rule violation
                return Override.DO_NOT_EVICT;
            default:
                return Override.CONTINUE_EVICT;
        }
    }
}
