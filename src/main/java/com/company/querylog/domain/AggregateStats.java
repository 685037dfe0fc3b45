package com.company.querylog.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Point-in-time view of the aggregated query statistics.
 */
@Value
@Builder
public class AggregateStats {

    long totalQueries;
    long totalBlocked;
    double avgProcessingTimeMs;

    @Builder.Default
    List<RankedEntry> topQueriedDomains = List.of();

    @Builder.Default
    List<RankedEntry> topBlockedDomains = List.of();

    @Builder.Default
    List<RankedEntry> topClients = List.of();

    public long getTotalUnblocked() {
        return totalQueries - totalBlocked;
    }

    public double getBlockPercentage() {
        if (totalQueries == 0) {
            return 0.0;
        }
        return Math.round(totalBlocked * 10000.0 / totalQueries) / 100.0;
    }

    public static AggregateStats empty() {
        return AggregateStats.builder().build();
    }
}
