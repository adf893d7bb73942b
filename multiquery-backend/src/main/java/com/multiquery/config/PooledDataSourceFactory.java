package com.multiquery.config;

import com.multiquery.connector.PooledConnectionExceptionOverride;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Builds one HikariCP pool per configured backend.
 */
@Slf4j
public class PooledDataSourceFactory {

    public HikariDataSource create(String backendId, MultiQueryProperties.Backend backend) {
        HikariConfig config = buildHikariConfig(backendId, backend);
        log.info("Creating connection pool {} for {}", config.getPoolName(), maskJdbcUrl(backend.getJdbcUrl()));
        return new HikariDataSource(config);
    }

    HikariConfig buildHikariConfig(String backendId, MultiQueryProperties.Backend backend) {
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(PooledConnectionExceptionOverride.class.getName());
        config.setJdbcUrl(backend.getJdbcUrl());
        config.setUsername(backend.getUsername());
        config.setPassword(backend.getPassword());
        if (backend.getDriverClassName() != null && !backend.getDriverClassName().isBlank()) {
            config.setDriverClassName(backend.getDriverClassName());
        }
        if (backend.getJdbcUrl() != null && backend.getJdbcUrl().startsWith("jdbc:postgresql:")) {
            // Shows up as pg_stat_activity.application_name.
            config.addDataSourceProperty("ApplicationName", "multiquery");
        }
        for (Map.Entry<String, String> property : backend.getDataSourceProperties().entrySet()) {
            config.addDataSourceProperty(property.getKey(), property.getValue());
        }

        config.setConnectionTimeout(backend.getConnectionTimeoutMs());
        config.setMaximumPoolSize(backend.getMaximumPoolSize());
        config.setMinimumIdle(Math.min(backend.getMinimumIdle(), backend.getMaximumPoolSize()));
        config.setIdleTimeout(60000);
        // A backend that is down at startup must not stop the service; its queries fail instead.
        config.setInitializationFailTimeout(-1);
        config.setPoolName("multiquery-" + backendId);
        return config;
    }

    static String maskJdbcUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            return null;
        }
        return jdbcUrl
                .replaceAll(":[^@:/]+@", ":****@")
                .replaceAll("(?i)(password=)[^;&]*", "$1****");
    }
}
