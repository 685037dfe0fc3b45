package com.company.querylog.config;

import com.company.querylog.aggregation.StatisticsAggregator;
import com.company.querylog.query.QueryLogRetrievalEngine;
import com.company.querylog.repository.InMemoryQueryRecordStore;
import com.company.querylog.repository.QueryRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the in-memory store, the aggregator and the retrieval engine from {@link QueryLogProperties}.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class QueryLogEngineConfig {

    private final QueryLogProperties properties;

    @Bean
    public QueryRecordStore queryRecordStore() {
        QueryLogProperties.Retention retention = properties.getRetention();
        log.info("Query record store: maxEvents={}, maxAge={}, hardCapacity={}",
                retention.getMaxEvents(), retention.getMaxAge(), retention.getHardCapacity());
        return new InMemoryQueryRecordStore(retention.toPolicy(), retention.getSegmentSize());
    }

    @Bean
    public StatisticsAggregator statisticsAggregator() {
        return new StatisticsAggregator(properties.getStats().getTopN());
    }

    @Bean
    public QueryLogRetrievalEngine queryLogRetrievalEngine(QueryRecordStore queryRecordStore) {
        return new QueryLogRetrievalEngine(queryRecordStore, properties.getQuery().getMaxPageSize());
    }
}
