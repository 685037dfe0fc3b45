package com.company.querylog.service;

import com.company.querylog.aggregation.StatisticsAggregator;
import com.company.querylog.domain.AggregateStats;
import com.company.querylog.domain.RankedEntry;
import com.company.querylog.dto.response.StatsResponse;
import com.company.querylog.query.SlowestQueryAnalyzer;
import com.company.querylog.repository.QueryRecordStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StatsServiceTest {

    private final StatisticsAggregator aggregator = mock(StatisticsAggregator.class);
    private final QueryLogIngestionService ingestionService = mock(QueryLogIngestionService.class);
    private final StatsService statsService = new StatsService(
            aggregator, mock(QueryRecordStore.class), new SlowestQueryAnalyzer(), ingestionService);

    @Test
    void mapsAggregateToDashboardShape() {
        when(aggregator.snapshot()).thenReturn(AggregateStats.builder()
                .totalQueries(8)
                .totalBlocked(3)
                .avgProcessingTimeMs(7.123456)
                .topQueriedDomains(List.of(new RankedEntry("example.com", 5), new RankedEntry("blocked.com", 3)))
                .topBlockedDomains(List.of(new RankedEntry("blocked.com", 3)))
                .topClients(List.of(new RankedEntry("192.168.1.10", 8)))
                .build());

        StatsResponse response = statsService.getStats(null);

        assertThat(response.getNumDnsQueries()).isEqualTo(8);
        assertThat(response.getNumBlockedFiltering()).isEqualTo(3);
        assertThat(response.getAvgProcessingTime()).isEqualTo(7.12);
        assertThat(response.getBlockPercentage()).isEqualTo(37.5);
        assertThat(response.getTopQueriedDomains()).containsExactly(
                new StatsResponse.DomainCount("example.com", 5),
                new StatsResponse.DomainCount("blocked.com", 3));
        assertThat(response.getTopBlockedDomains()).containsExactly(new StatsResponse.DomainCount("blocked.com", 3));
        assertThat(response.getTopClients()).containsExactly(new StatsResponse.ClientCount("192.168.1.10", 8));
    }

    @Test
    void countOverridesTopN() {
        when(aggregator.snapshot(3)).thenReturn(AggregateStats.empty());

        statsService.getStats(3);

        verify(aggregator).snapshot(3);
    }

    @Test
    void resetDelegatesToIngestion() {
        statsService.resetStats();

        verify(ingestionService).resetStatistics();
    }
}
