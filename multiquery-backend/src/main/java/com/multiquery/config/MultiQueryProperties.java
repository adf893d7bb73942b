package com.multiquery.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code multiquery.*} settings.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "multiquery")
public class MultiQueryProperties {

    /**
     * Backends keyed by id. Iteration order is the registration order.
     */
    @Valid
    @NotEmpty(message = "At least one backend must be configured under multiquery.backends")
    private Map<String, Backend> backends = new LinkedHashMap<>();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Orchestration orchestration = new Orchestration();

    @Data
    public static class Backend {
        /** relational | warehouse */
        @NotBlank(message = "Backend kind is required")
        private String kind;
        private boolean enabled = true;
        @NotBlank(message = "Backend jdbc-url is required")
        private String jdbcUrl;
        private String username;
        private String password;
        private String driverClassName;
        @Min(1)
        private int maximumPoolSize = 5;
        @Min(0)
        private int minimumIdle = 0;
        @Min(250)
        private int connectionTimeoutMs = 5000;
        @Min(0)
        private int queryTimeoutMs = 30000;
        @Min(0)
        private int fetchSize = 500;
        @Min(0)
        private int maxRows = 10000;
        private boolean readOnly = true;
        private List<String> sessionStatements = new ArrayList<>();
        private Map<String, String> dataSourceProperties = new LinkedHashMap<>();
    }

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;
        @Min(0)
        private long initialDelayMs = 200;
        @Min(0)
        private long maxDelayMs = 5000;
        @DecimalMin("1.0")
        private double multiplier = 2.0;
        private boolean jitter = true;
    }

    @Data
    public static class Orchestration {
        @Min(1)
        private long timeoutMs = 60000;
        @Min(1)
        private int poolSize = 8;
    }
}
