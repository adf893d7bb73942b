package com.multiquery.config;

import com.multiquery.connector.BackendConnector;
import com.multiquery.connector.BackendKind;
import com.multiquery.connector.JdbcOptions;
import com.multiquery.connector.RelationalConnector;
import com.multiquery.connector.WarehouseConnector;
import com.multiquery.model.BackendId;
import com.multiquery.retry.ExponentialBackoff;
import com.multiquery.retry.RetryPolicy;
import com.multiquery.retry.TransientErrorPredicate;
import com.multiquery.service.BackendRegistry;
import com.multiquery.service.QueryOrchestrator;
import com.multiquery.trace.QueryEventSink;
import com.multiquery.trace.Slf4jQueryEventSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires connectors, retry policy and orchestrator from {@link MultiQueryProperties}.
 */
@Slf4j
@Configuration
public class MultiQueryConfiguration {

    @Bean
    public QueryEventSink queryEventSink() {
        return new Slf4jQueryEventSink();
    }

    @Bean
    public PooledDataSourceFactory pooledDataSourceFactory() {
        return new PooledDataSourceFactory();
    }

    @Bean
    public BackendRegistry backendRegistry(MultiQueryProperties properties, PooledDataSourceFactory dataSourceFactory) {
        List<BackendConnector> connectors = new ArrayList<>();
        for (Map.Entry<String, MultiQueryProperties.Backend> entry : properties.getBackends().entrySet()) {
            MultiQueryProperties.Backend backend = entry.getValue();
            if (!backend.isEnabled()) {
                log.info("Backend {} is disabled", entry.getKey());
                continue;
            }
            BackendId id = BackendId.of(entry.getKey());
            DataSource dataSource = dataSourceFactory.create(id.getValue(), backend);
            connectors.add(createConnector(id, backend, dataSource, properties.getOrchestration().getTimeoutMs()));
        }
        if (connectors.isEmpty()) {
            throw new IllegalStateException("No enabled backend configured under multiquery.backends");
        }
        log.info("Registered backends: {}", connectors.stream().map(c -> c.getBackendId() + "(" + c.getKind().label() + ")").toList());
        return new BackendRegistry(connectors);
    }

    /**
     * Build the connector for one backend, capping its statement timeout at the orchestration
     * timeout.
     */
    static BackendConnector createConnector(BackendId id, MultiQueryProperties.Backend backend, DataSource dataSource,
                                            long orchestrationTimeoutMs) {
        int queryTimeoutMs = backend.getQueryTimeoutMs();
        if (queryTimeoutMs == 0 || queryTimeoutMs > orchestrationTimeoutMs) {
            int capped = (int) Math.min(orchestrationTimeoutMs, Integer.MAX_VALUE);
            log.warn("Backend {} query-timeout-ms={} is unbounded or exceeds the orchestration timeout; using {} ms", id, queryTimeoutMs, capped);
            queryTimeoutMs = capped;
        }
        JdbcOptions options = JdbcOptions.builder()
                .queryTimeoutMs(queryTimeoutMs)
                .fetchSize(backend.getFetchSize())
                .maxRows(backend.getMaxRows())
                .readOnly(backend.isReadOnly())
                .sessionStatements(List.copyOf(backend.getSessionStatements()))
                .build();
        BackendKind kind = BackendKind.parse(backend.getKind());
        switch (kind) {
            case WAREHOUSE:
                return new WarehouseConnector(id, dataSource, options);
            case RELATIONAL:
            default:
                return new RelationalConnector(id, dataSource, options);
        }
    }

    @Bean
    public RetryPolicy retryPolicy(MultiQueryProperties properties, QueryEventSink queryEventSink) {
        MultiQueryProperties.Retry retry = properties.getRetry();
        long initial = retry.getInitialDelayMs();
        long max = Math.max(initial, retry.getMaxDelayMs());
        return RetryPolicy.builder()
                .maxAttempts(retry.getMaxAttempts())
                .transientErrorPredicate(TransientErrorPredicate.byCategory())
                .backoff(new ExponentialBackoff(Duration.ofMillis(initial), retry.getMultiplier(), Duration.ofMillis(max), retry.isJitter()))
                .eventSink(queryEventSink)
                .build();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService backendExecutor(MultiQueryProperties properties) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("multiquery-backend-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(properties.getOrchestration().getPoolSize(), threadFactory);
    }

    @Bean
    public QueryOrchestrator queryOrchestrator(
            BackendRegistry backendRegistry,
            RetryPolicy retryPolicy,
            ExecutorService backendExecutor,
            QueryEventSink queryEventSink,
            MultiQueryProperties properties
    ) {
        return new QueryOrchestrator(
                backendRegistry,
                retryPolicy,
                backendExecutor,
                queryEventSink,
                Duration.ofMillis(properties.getOrchestration().getTimeoutMs())
        );
    }
}
