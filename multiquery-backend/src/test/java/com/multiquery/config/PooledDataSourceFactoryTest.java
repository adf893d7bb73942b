package com.multiquery.config;

import com.multiquery.connector.PooledConnectionExceptionOverride;
import com.zaxxer.hikari.HikariConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PooledDataSourceFactoryTest {

    private final PooledDataSourceFactory factory = new PooledDataSourceFactory();

    private static MultiQueryProperties.Backend backend(String url) {
        MultiQueryProperties.Backend backend = new MultiQueryProperties.Backend();
        backend.setKind("relational");
        backend.setJdbcUrl(url);
        backend.setUsername("reporter");
        backend.setPassword("secret");
        backend.setMaximumPoolSize(4);
        backend.setMinimumIdle(10);
        backend.setConnectionTimeoutMs(3000);
        return backend;
    }

    @Test
    void buildsNamedLazyPool() {
        HikariConfig config = factory.buildHikariConfig("relational", backend("jdbc:postgresql://db:5432/sales"));

        assertEquals("multiquery-relational", config.getPoolName());
        assertEquals("jdbc:postgresql://db:5432/sales", config.getJdbcUrl());
        assertEquals("reporter", config.getUsername());
        assertEquals(4, config.getMaximumPoolSize());
        assertEquals(4, config.getMinimumIdle());
        assertEquals(3000, config.getConnectionTimeout());
        assertEquals(-1, config.getInitializationFailTimeout());
        assertEquals(PooledConnectionExceptionOverride.class.getName(), config.getExceptionOverrideClassName());
        assertEquals("multiquery", config.getDataSourceProperties().getProperty("ApplicationName"));
    }

    @Test
    void passesExtraDriverProperties_andSkipsPostgresDefaultsElsewhere() {
        MultiQueryProperties.Backend warehouse = backend("jdbc:snowflake://acme.snowflakecomputing.com");
        warehouse.setKind("warehouse");
        warehouse.setSessionStatements(List.of("ALTER SESSION SET QUERY_TAG = 'multiquery'"));
        warehouse.getDataSourceProperties().put("warehouse", "ANALYTICS_WH");

        HikariConfig config = factory.buildHikariConfig("warehouse", warehouse);

        assertEquals("ANALYTICS_WH", config.getDataSourceProperties().getProperty("warehouse"));
        assertNull(config.getDataSourceProperties().getProperty("ApplicationName"));
    }

    @Test
    void masksCredentialsInUrls() {
        assertEquals("jdbc:postgresql://reporter:****@db/sales",
                PooledDataSourceFactory.maskJdbcUrl("jdbc:postgresql://reporter:secret@db/sales"));
        assertEquals("jdbc:sqlserver://db;user=sa;password=****;encrypt=true",
                PooledDataSourceFactory.maskJdbcUrl("jdbc:sqlserver://db;user=sa;password=hunter2;encrypt=true"));
        assertNull(PooledDataSourceFactory.maskJdbcUrl(null));
    }
}
