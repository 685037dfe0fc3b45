package com.company.querylog.service;

import com.company.querylog.aggregation.StatisticsAggregator;
import com.company.querylog.config.CacheConfig;
import com.company.querylog.domain.AggregateStats;
import com.company.querylog.domain.RankedEntry;
import com.company.querylog.dto.response.SlowestQueryResponse;
import com.company.querylog.dto.response.StatsResponse;
import com.company.querylog.query.SlowestQueryAnalyzer;
import com.company.querylog.repository.QueryRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class StatsService {

    private final StatisticsAggregator aggregator;
    private final QueryRecordStore store;
    private final SlowestQueryAnalyzer slowestQueryAnalyzer;
    private final QueryLogIngestionService ingestionService;

    /**
     * Current statistics; {@code count} overrides the configured top-N when given.
     */
    public StatsResponse getStats(Integer count) {
        AggregateStats stats = count != null ? aggregator.snapshot(count) : aggregator.snapshot();
        return toResponse(stats);
    }

    @Cacheable(cacheNames = CacheConfig.SLOWEST_QUERIES, key = "#scanDepth")
    public List<SlowestQueryResponse> getSlowestQueries(int scanDepth) {
        log.debug("Computing slowest queries over the newest {} events", scanDepth);
        return slowestQueryAnalyzer.analyze(store.snapshot().newestFirst(), scanDepth).stream()
                .map(slowest -> SlowestQueryResponse.builder()
                        .domain(slowest.getDomain())
                        .elapsedMs(slowest.getElapsedMs())
                        .client(slowest.getClient())
                        .reason(slowest.getReason())
                        .occurrences(slowest.getOccurrences())
                        .build())
                .collect(Collectors.toList());
    }

    @CacheEvict(cacheNames = CacheConfig.SLOWEST_QUERIES, allEntries = true)
    public void resetStats() {
        ingestionService.resetStatistics();
    }

    static StatsResponse toResponse(AggregateStats stats) {
        return StatsResponse.builder()
                .numDnsQueries(stats.getTotalQueries())
                .numBlockedFiltering(stats.getTotalBlocked())
                .avgProcessingTime(Math.round(stats.getAvgProcessingTimeMs() * 100) / 100.0)
                .blockPercentage(stats.getBlockPercentage())
                .topQueriedDomains(toDomainCounts(stats.getTopQueriedDomains()))
                .topBlockedDomains(toDomainCounts(stats.getTopBlockedDomains()))
                .topClients(stats.getTopClients().stream()
                        .map(entry -> new StatsResponse.ClientCount(entry.key(), entry.count()))
                        .collect(Collectors.toList()))
                .build();
    }

    private static List<StatsResponse.DomainCount> toDomainCounts(List<RankedEntry> entries) {
        return entries.stream()
                .map(entry -> new StatsResponse.DomainCount(entry.key(), entry.count()))
                .collect(Collectors.toList());
    }
}
