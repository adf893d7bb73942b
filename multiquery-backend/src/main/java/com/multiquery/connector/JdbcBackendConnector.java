package com.multiquery.connector;

import com.multiquery.model.BackendId;
import com.multiquery.model.ErrorCategory;
import com.multiquery.model.QueryFailure;
import com.multiquery.model.QueryOutcome;
import com.multiquery.model.QuerySuccess;
import com.multiquery.util.JdbcValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.Closeable;
import java.io.IOException;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link BackendConnector} over a pooled JDBC {@link DataSource}.
 *
 * <p>Each call borrows its own connection and returns it on every exit path. Besides immutable
 * settings and the pool, the connector only tracks the statement each worker thread is running,
 * so {@link #cancelRunning(Thread)} can abort it.
 */
public abstract class JdbcBackendConnector implements BackendConnector, Closeable {
    private static final Logger log = LoggerFactory.getLogger(JdbcBackendConnector.class);

    private final BackendId backendId;
    private final DataSource dataSource;
    private final JdbcOptions options;
    private final Map<Thread, Statement> running = new ConcurrentHashMap<>();

    protected JdbcBackendConnector(BackendId backendId, DataSource dataSource, JdbcOptions options) {
        if (backendId == null) {
            throw new IllegalArgumentException("backendId is required");
        }
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource is required for backend " + backendId);
        }
        this.backendId = backendId;
        this.dataSource = dataSource;
        this.options = options != null ? options : JdbcOptions.defaults();
    }

    @Override
    public BackendId getBackendId() {
        return backendId;
    }

    public JdbcOptions getOptions() {
        return options;
    }

    @Override
    public final QueryOutcome execute(String query) {
        long startTime = System.currentTimeMillis();
        log.debug("Executing query on backend={}: {}", backendId, query);

        try (Connection conn = dataSource.getConnection()) {
            if (options.isReadOnly()) {
                conn.setReadOnly(true);
            }
            prepareSession(conn);

            try (Statement stmt = conn.createStatement()) {
                if (options.getQueryTimeoutMs() > 0) {
                    stmt.setQueryTimeout(queryTimeoutSeconds(options.getQueryTimeoutMs()));
                }
                if (options.getFetchSize() > 0) {
                    stmt.setFetchSize(options.getFetchSize());
                }

                Thread worker = Thread.currentThread();
                running.put(worker, stmt);
                try {
                    boolean isResultSet = stmt.execute(query);
                    if (!isResultSet) {
                        int updateCount = stmt.getUpdateCount();
                        return success(query, List.of(), explainUpdate(updateCount), startTime);
                    }
                    try (ResultSet rs = stmt.getResultSet()) {
                        RowBatch batch = readRows(rs, options.getMaxRows());
                        return success(query, batch.rows, explainRows(batch.rows.size(), batch.truncated), startTime);
                    }
                } finally {
                    running.remove(worker, stmt);
                }
            }
        } catch (SQLException e) {
            ErrorCategory category = SqlErrorClassifier.classify(e);
            log.warn("Query failed on backend={} ({}): {} (SQLState: {}, Error Code: {})",
                    backendId, category, e.getMessage(), e.getSQLState(), e.getErrorCode());
            return QueryFailure.of(backendId, query, category, SqlErrorClassifier.describe(e));
        } catch (Exception e) {
            ErrorCategory category = SqlErrorClassifier.classify(e);
            log.warn("Query failed on backend={} ({})", backendId, category, e);
            return QueryFailure.of(backendId, query, category, SqlErrorClassifier.describe(e));
        }
    }

    @Override
    public void cancelRunning(Thread worker) {
        Statement stmt = worker != null ? running.get(worker) : null;
        if (stmt == null) {
            return;
        }
        try {
            stmt.cancel();
            log.info("Cancelled running statement on backend={} (worker {})", backendId, worker.getName());
        } catch (SQLException e) {
            log.warn("Could not cancel running statement on backend={}: {} (SQLState: {})",
                    backendId, e.getMessage(), e.getSQLState());
        }
    }

    /**
     * Whole seconds for {@link Statement#setQueryTimeout(int)}, rounded up so the backend never
     * gives up before the configured time.
     */
    static int queryTimeoutSeconds(int timeoutMs) {
        return Math.max(1, (int) ((timeoutMs + 999L) / 1000L));
    }

    /**
     * Hook to configure a freshly borrowed connection before the query runs.
     *
     * @param conn borrowed connection
     * @throws SQLException when the session cannot be prepared
     */
    protected void prepareSession(Connection conn) throws SQLException {
        List<String> statements = options.getSessionStatements();
        if (statements == null || statements.isEmpty()) {
            return;
        }
        try (Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                if (sql != null && !sql.isBlank()) {
                    stmt.execute(sql);
                }
            }
        }
    }

    protected String explainRows(int rowCount, boolean truncated) {
        String explanation = "Successfully executed query returning " + rowCount + " rows";
        if (truncated) {
            explanation += " (truncated at " + rowCount + ")";
        }
        return explanation;
    }

    protected String explainUpdate(int updateCount) {
        return "Successfully executed statement affecting " + Math.max(updateCount, 0) + " rows";
    }

    private QuerySuccess success(String query, List<Map<String, Object>> rows, String explanation, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        log.debug("Query completed on backend={}: rows={}, duration_ms={}", backendId, rows.size(), duration);
        return QuerySuccess.builder()
                .query(query)
                .rows(rows)
                .backend(backendId)
                .explanation(explanation)
                .durationMs(duration)
                .build();
    }

    private RowBatch readRows(ResultSet rs, int limit) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int columnCount = md.getColumnCount();
        String[] labels = new String[columnCount];
        for (int i = 1; i <= columnCount; i++) {
            String label = md.getColumnLabel(i);
            labels[i - 1] = label != null && !label.isBlank() ? label : md.getColumnName(i);
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        boolean truncated = false;
        while (rs.next()) {
            if (limit > 0 && rows.size() >= limit) {
                truncated = true;
                break;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(labels[i - 1], JdbcValues.read(rs, i));
            }
            rows.add(row);
        }
        return new RowBatch(rows, truncated);
    }

    /**
     * Close the pool if this connector owns one.
     */
    @Override
    public void close() throws IOException {
        if (dataSource instanceof Closeable closeable) {
            closeable.close();
        }
    }

    private static final class RowBatch {
        private final List<Map<String, Object>> rows;
        private final boolean truncated;

        private RowBatch(List<Map<String, Object>> rows, boolean truncated) {
            this.rows = rows;
            this.truncated = truncated;
        }
    }
}
