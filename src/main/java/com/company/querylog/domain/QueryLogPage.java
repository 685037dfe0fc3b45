package com.company.querylog.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class QueryLogPage {

    List<QueryEvent> events;

    // Number of events matching the filter, independent of offset/limit
    long totalMatched;

    // Newest event id visible to this read; pass it back to keep later pages stable
    long snapshotId;

    // Timestamp of the last event on this page, null for an empty page
    Instant oldest;
}
