package com.company.querylog.config;

import com.company.querylog.domain.RetentionPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Typed binding for the {@code querylog.*} configuration tree.
 */
@Configuration
@ConfigurationProperties(prefix = "querylog")
@Data
public class QueryLogProperties {

    private Retention retention = new Retention();
    private Stats stats = new Stats();
    private Query query = new Query();
    private Slowest slowest = new Slowest();
    private Reconciliation reconciliation = new Reconciliation();
    private Tracing tracing = new Tracing();

    @Data
    public static class Retention {
        /** Oldest events beyond this count are evicted; 0 disables count-based eviction */
        private long maxEvents = 100_000;
        /** Events older than this are evicted; unset keeps everything since start */
        private Duration maxAge;
        /** Appends are rejected beyond this count when count-based eviction is off; 0 = unbounded */
        private long hardCapacity = 0;
        private long sweepIntervalMs = 60_000;
        private int segmentSize = 1024;

        public RetentionPolicy toPolicy() {
            return new RetentionPolicy(maxEvents, maxAge, hardCapacity);
        }
    }

    @Data
    public static class Stats {
        private int topN = 10;
    }

    @Data
    public static class Query {
        private int maxPageSize = 1000;
        private int defaultPageSize = 100;
    }

    @Data
    public static class Slowest {
        private int scanDepth = 1000;
    }

    @Data
    public static class Reconciliation {
        private boolean enabled = true;
        private long intervalMs = 300_000;
    }

    @Data
    public static class Tracing {
        private boolean enabled = true;
    }
}
