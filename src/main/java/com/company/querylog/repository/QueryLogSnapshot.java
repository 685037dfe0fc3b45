package com.company.querylog.repository;

import com.company.querylog.domain.QueryEvent;

import java.util.stream.LongStream;
import java.util.stream.Stream;

/**
 * Immutable view over a contiguous id range of the record store.
 * <p>
 * The view holds references to the store's segments, so later appends and evictions
 * never change what it returns.
 */
public final class QueryLogSnapshot {

    private static final QueryEvent[][] NO_SEGMENTS = new QueryEvent[0][];

    private final QueryEvent[][] segments;
    private final int segmentSize;
    private final long segmentBaseId;
    private final long firstId;
    private final long lastId;

    QueryLogSnapshot(QueryEvent[][] segments, int segmentSize, long segmentBaseId, long firstId, long lastId) {
        this.segments = segments;
        this.segmentSize = segmentSize;
        this.segmentBaseId = segmentBaseId;
        this.firstId = firstId;
        this.lastId = lastId;
    }

    public static QueryLogSnapshot empty(long lastId) {
        return new QueryLogSnapshot(NO_SEGMENTS, 1, lastId + 1, lastId + 1, lastId);
    }

    public long size() {
        return Math.max(0, lastId - firstId + 1);
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Id of the oldest event in the view; greater than {@link #lastId()} when empty.
     */
    public long firstId() {
        return firstId;
    }

    /**
     * Id of the newest event in the view. Also used as the pagination anchor.
     */
    public long lastId() {
        return lastId;
    }

    public boolean contains(long id) {
        return id >= firstId && id <= lastId;
    }

    public QueryEvent get(long id) {
        if (!contains(id)) {
            throw new IndexOutOfBoundsException("Event " + id + " is outside [" + firstId + ", " + lastId + "]");
        }
        long offset = id - segmentBaseId;
        return segments[(int) (offset / segmentSize)][(int) (offset % segmentSize)];
    }

    public QueryEvent newest() {
        return isEmpty() ? null : get(lastId);
    }

    /**
     * Newest-first stream of every event in the view.
     */
    public Stream<QueryEvent> newestFirst() {
        return newestFirst(lastId);
    }

    /**
     * Newest-first stream of the events with {@code id <= maxId}.
     */
    public Stream<QueryEvent> newestFirst(long maxId) {
        long upper = Math.min(maxId, lastId);
        if (upper < firstId) {
            return Stream.empty();
        }
        return LongStream.rangeClosed(firstId, upper)
                .map(id -> upper - (id - firstId))
                .mapToObj(this::get);
    }

    /**
     * Oldest-first stream of every event in the view, the order a replay needs.
     */
    public Stream<QueryEvent> oldestFirst() {
        if (isEmpty()) {
            return Stream.empty();
        }
        return LongStream.rangeClosed(firstId, lastId).mapToObj(this::get);
    }
}
