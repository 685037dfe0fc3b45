package com.company.querylog.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Predicates applied to the query log. All non-null predicates are combined with AND.
 */
@Value
@Builder(toBuilder = true)
public class QueryLogFilter {

    public static final String STATUS_ALL = "all";
    public static final String STATUS_BLOCKED = "Blocked";
    public static final String STATUS_FILTERED = "filtered";

    // Exact raw status, or one of the synthetic groups "all" / "Blocked" / "filtered"
    String status;

    // Case-insensitive substring of the domain
    String domain;

    // Exact client identifier
    String client;

    // Case-insensitive substring of either domain or client
    String search;

    // Case-insensitive exact question type
    String queryType;

    // Inclusive time bounds
    Instant from;
    Instant to;

    // Strictly greater than
    Double minElapsedMs;

    public static QueryLogFilter none() {
        return QueryLogFilter.builder().build();
    }

    public boolean isBlockedGroup() {
        return status != null
                && (STATUS_BLOCKED.equalsIgnoreCase(status) || STATUS_FILTERED.equalsIgnoreCase(status));
    }

    public boolean hasStatusPredicate() {
        return status != null && !status.isBlank() && !STATUS_ALL.equalsIgnoreCase(status);
    }
}
