package com.company.querylog.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Query-string parameters shared by the query-log listing and its CSV export.
 * Values are checked when converted to a query request, not by bean validation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryLogParams {

    // Raw status, or "all" / "Blocked" / "filtered"
    private String status;
    private String domain;
    private String client;
    private String search;
    private String queryType;

    // ISO-8601, inclusive
    private String from;
    private String to;

    private Double minElapsedMs;

    private Integer offset;
    private Integer limit;

    // time | elapsedMs | domain | client | status
    private String sort;

    // asc | desc
    private String order;

    private Long snapshotId;
}
