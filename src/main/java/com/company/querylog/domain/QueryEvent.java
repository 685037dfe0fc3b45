package com.company.querylog.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * One recorded DNS lookup. Immutable once appended to the store.
 */
@Value
@Builder(toBuilder = true)
public class QueryEvent {

    // Store-assigned sequence, 0 until appended
    @With
    long id;

    @NonNull
    Instant timestamp;

    // Lowercase question name, never empty
    @NonNull
    String domain;

    @Builder.Default
    String queryType = "";

    // Verbatim client identifier (IPv4, IPv6 or label)
    @NonNull
    String client;

    double elapsedMs;

    @NonNull
    QueryStatus status;

    String reason;

    // Passthrough metadata
    String upstream;
    String rule;
    Long filterId;

    public boolean isBlocked() {
        return status.isBlocked();
    }
}
