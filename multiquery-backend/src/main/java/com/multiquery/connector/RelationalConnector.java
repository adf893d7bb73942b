package com.multiquery.connector;

import com.multiquery.model.BackendId;

import javax.sql.DataSource;

/**
 * Connector for a row-oriented relational database (PostgreSQL, SQL Server, ...).
 */
public class RelationalConnector extends JdbcBackendConnector {

    public RelationalConnector(DataSource dataSource, JdbcOptions options) {
        this(BackendId.RELATIONAL, dataSource, options);
    }

    public RelationalConnector(BackendId backendId, DataSource dataSource, JdbcOptions options) {
        super(backendId, dataSource, options);
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.RELATIONAL;
    }
}
