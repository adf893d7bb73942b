package com.multiquery.connector;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Per-statement settings of a {@link JdbcBackendConnector}.
 */
@Value
@Builder(toBuilder = true)
public class JdbcOptions {
    @Builder.Default
    int queryTimeoutMs = 30000;
    @Builder.Default
    int fetchSize = 500;
    /** Rows kept per result; 0 keeps all. */
    @Builder.Default
    int maxRows = 10000;
    @Builder.Default
    boolean readOnly = true;
    /** Statements run on the borrowed connection before the query. */
    @Builder.Default
    List<String> sessionStatements = List.of();

    public static JdbcOptions defaults() {
        return JdbcOptions.builder().build();
    }
}
