package com.company.querylog.domain;

import com.company.querylog.domain.enums.QueryLogSortField;
import lombok.Builder;
import lombok.Value;

/**
 * A page request against the query log.
 */
@Value
@Builder(toBuilder = true)
public class QueryLogRequest {

    @Builder.Default
    QueryLogFilter filter = QueryLogFilter.none();

    @Builder.Default
    int offset = 0;

    @Builder.Default
    int limit = 100;

    @Builder.Default
    QueryLogSortField sortField = QueryLogSortField.TIME;

    @Builder.Default
    boolean descending = true;

    // Pins the read to events with id <= snapshotId; null reads the latest state
    Long snapshotId;
}
