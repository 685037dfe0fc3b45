package com.company.querylog.config;

import com.company.querylog.aggregation.StatisticsAggregator;
import com.company.querylog.repository.QueryRecordStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final QueryRecordStore store;
    private final StatisticsAggregator aggregator;

    @Bean
    public MeterBinder queryLogMetrics() {
        return (registry) -> {
            Gauge.builder("querylog.store.size", store, QueryRecordStore::size)
                    .description("Number of query events currently retained")
                    .register(registry);

            Gauge.builder("querylog.stats.total", aggregator, agg -> agg.snapshot(0).getTotalQueries())
                    .description("Queries counted by the statistics since start or last reset")
                    .register(registry);

            Gauge.builder("querylog.stats.blocked", aggregator, agg -> agg.snapshot(0).getTotalBlocked())
                    .description("Blocked queries counted since start or last reset")
                    .register(registry);

            log.info("Query log metrics registered");
        };
    }
}
