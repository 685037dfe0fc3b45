package com.company.querylog.repository;

import com.company.querylog.domain.QueryEvent;
import com.company.querylog.domain.RetentionPolicy;

import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

/**
 * Append-only log of query events with bounded retention.
 */
public interface QueryRecordStore {

    /**
     * Assigns the next id, publishes the event and applies the retention policy.
     *
     * @throws com.company.querylog.exception.CapacityExceededException when a hard cap is
     *                                                                 reached and eviction is disabled
     */
    AppendResult append(QueryEvent event);

    /**
     * Immutable view of the currently retained events.
     */
    QueryLogSnapshot snapshot();

    /**
     * Newest-first events whose timestamp lies within the inclusive bounds. Either bound may be null.
     * Each call reads a fresh snapshot.
     */
    Stream<QueryEvent> iterate(Instant since, Instant until);

    /**
     * Removes events older than the cutoff, returning them oldest first.
     */
    List<QueryEvent> evictOlderThan(Instant cutoff);

    /**
     * Removes every event, returning them oldest first.
     */
    List<QueryEvent> clear();

    long size();

    /**
     * Id of the newest appended event, 0 when nothing was ever appended.
     */
    long latestId();

    RetentionPolicy getRetentionPolicy();
}
