package com.whereq.tessera.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for WhereQ Tessera.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "tessera")
@Data
public class TesseraProperties {

    private Engines engines = new Engines();

    private Jobs jobs = new Jobs();

    private Store store = new Store();

    @Data
    public static class Engines {
        private Embedded embedded = new Embedded();
        private Distributed distributed = new Distributed();
    }

    @Data
    public static class Embedded {
        /**
         * Register the embedded (DuckDB) adapter.
         */
        private boolean enabled = true;

        /**
         * JDBC url. "jdbc:duckdb:" is an in-memory database.
         */
        private String url = "jdbc:duckdb:";

        /**
         * Value for DuckDB's memory_limit setting, empty to keep the engine default.
         */
        private String memoryLimit = "2GB";

        /**
         * Run EXPLAIN after each query to fill planText.
         */
        private boolean capturePlan = true;

        /**
         * How long a job waits for the single connection.
         */
        private Duration borrowTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Distributed {
        /**
         * Register the distributed (ClickHouse) adapter.
         */
        private boolean enabled = false;

        private String url = "jdbc:clickhouse://localhost:8123/default";

        private String username = "default";

        private String password = "";

        /**
         * Connection pool size, which is also the dispatch width.
         */
        private int maxConcurrency = 4;

        private boolean capturePlan = true;

        private Duration borrowTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Jobs {
        /**
         * Per-engine queue limit; submissions beyond it are rejected.
         */
        private long maxQueueSize = 1000;

        /**
         * How long cancel waits for the adapter to acknowledge before
         * marking a running job CANCELLED on its own.
         */
        private Duration cancelGracePeriod = Duration.ofSeconds(5);

        /**
         * Jobs running longer than this are cancelled and recorded as FAILED/TIMEOUT.
         */
        private Duration executionTimeout = Duration.ofMinutes(60);
    }

    @Data
    public static class Store {
        private StoreType type = StoreType.MEMORY;

        /**
         * Terminal jobs older than this are evicted.
         */
        private Duration retention = Duration.ofDays(7);

        /**
         * Delay between eviction runs (ISO-8601, read by the scheduler).
         */
        private Duration evictionInterval = Duration.ofMinutes(10);
    }

    public enum StoreType {
        /**
         * Jobs kept in process memory; lost on restart.
         */
        MEMORY,

        /**
         * Jobs kept in Redis with a TTL equal to the retention.
         */
        REDIS
    }
}
