package com.company.querylog.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.io.Serializable;
import java.util.List;

/**
 * Dashboard statistics, in the snake_case shape the dashboard reads.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatsResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    @JsonProperty("num_dns_queries")
    private long numDnsQueries;

    @JsonProperty("num_blocked_filtering")
    private long numBlockedFiltering;

    // Milliseconds
    @JsonProperty("avg_processing_time")
    private double avgProcessingTime;

    @JsonProperty("block_percentage")
    private double blockPercentage;

    @JsonProperty("top_queried_domains")
    private List<DomainCount> topQueriedDomains;

    @JsonProperty("top_blocked_domains")
    private List<DomainCount> topBlockedDomains;

    @JsonProperty("top_clients")
    private List<ClientCount> topClients;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DomainCount implements Serializable {
        private static final long serialVersionUID = 1L;

        private String domain;
        private long count;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ClientCount implements Serializable {
        private static final long serialVersionUID = 1L;

        private String ip;
        private long count;
    }
}
