package com.multiquery.connector;

import com.multiquery.model.BackendId;

import javax.sql.DataSource;

/**
 * Connector for a columnar warehouse reached through its JDBC driver.
 *
 * <p>Warehouse sessions usually need a few statements first (query tags, default dataset or
 * warehouse); these come from {@link JdbcOptions#getSessionStatements()}. Warehouse connections
 * are never switched to read-only, since several drivers reject {@code setReadOnly}.
 */
public class WarehouseConnector extends JdbcBackendConnector {

    public WarehouseConnector(DataSource dataSource, JdbcOptions options) {
        this(BackendId.WAREHOUSE, dataSource, options);
    }

    public WarehouseConnector(BackendId backendId, DataSource dataSource, JdbcOptions options) {
        super(backendId, dataSource, withoutReadOnly(options));
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.WAREHOUSE;
    }

    private static JdbcOptions withoutReadOnly(JdbcOptions options) {
        JdbcOptions base = options != null ? options : JdbcOptions.defaults();
        return base.toBuilder().readOnly(false).build();
    }
}
