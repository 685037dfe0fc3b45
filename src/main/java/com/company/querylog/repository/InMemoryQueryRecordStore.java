package com.company.querylog.repository;

import com.company.querylog.domain.QueryEvent;
import com.company.querylog.domain.RetentionPolicy;
import com.company.querylog.exception.CapacityExceededException;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

/**
 * Record store backed by fixed-size segments.
 * <p>
 * Ids are contiguous, so an id maps to a (segment, slot) pair. Appends fill the tail segment,
 * eviction advances the head id and drops a segment once all of its slots are evicted.
 * Slots are written once and never cleared, which lets a snapshot keep reading
 * segments the store has already dropped.
 */
@Slf4j
public class InMemoryQueryRecordStore implements QueryRecordStore {

    public static final int DEFAULT_SEGMENT_SIZE = 1024;

    private final RetentionPolicy retentionPolicy;
    private final int segmentSize;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ArrayDeque<QueryEvent[]> segments = new ArrayDeque<>();

    // Id stored at slot 0 of the first segment
    private long segmentBaseId = 1;
    // Oldest retained id
    private long headId = 1;
    // Next id to assign
    private long nextId = 1;

    public InMemoryQueryRecordStore(RetentionPolicy retentionPolicy) {
        this(retentionPolicy, DEFAULT_SEGMENT_SIZE);
    }

    public InMemoryQueryRecordStore(RetentionPolicy retentionPolicy, int segmentSize) {
        if (segmentSize <= 0) {
            throw new IllegalArgumentException("Segment size must be positive");
        }
        this.retentionPolicy = retentionPolicy;
        this.segmentSize = segmentSize;
    }

    @Override
    public AppendResult append(QueryEvent event) {
        lock.writeLock().lock();
        try {
            if (!retentionPolicy.evictsBySize()
                    && retentionPolicy.hardCapacity() > 0
                    && sizeLocked() >= retentionPolicy.hardCapacity()) {
                throw new CapacityExceededException(retentionPolicy.hardCapacity());
            }

            QueryEvent stored = event.withId(nextId);
            long offset = nextId - segmentBaseId;
            int segmentIndex = (int) (offset / segmentSize);
            if (segmentIndex == segments.size()) {
                segments.addLast(new QueryEvent[segmentSize]);
            }
            segments.peekLast()[(int) (offset % segmentSize)] = stored;
            nextId++;

            List<QueryEvent> evicted = enforceRetention(stored.getTimestamp());
            return new AppendResult(stored, evicted);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<QueryEvent> enforceRetention(Instant newestTimestamp) {
        List<QueryEvent> evicted = null;

        if (retentionPolicy.evictsBySize()) {
            while (sizeLocked() > retentionPolicy.maxEvents()) {
                if (evicted == null) {
                    evicted = new ArrayList<>();
                }
                evicted.add(evictHead());
            }
        }

        if (retentionPolicy.evictsByAge()) {
            Instant cutoff = newestTimestamp.minus(retentionPolicy.maxAge());
            while (sizeLocked() > 0 && headEvent().getTimestamp().isBefore(cutoff)) {
                if (evicted == null) {
                    evicted = new ArrayList<>();
                }
                evicted.add(evictHead());
            }
        }

        if (evicted == null) {
            return Collections.emptyList();
        }
        log.debug("Retention evicted {} event(s), {} retained", evicted.size(), sizeLocked());
        return evicted;
    }

    private QueryEvent headEvent() {
        return segments.peekFirst()[(int) (headId - segmentBaseId)];
    }

    private QueryEvent evictHead() {
        QueryEvent head = headEvent();
        headId++;
        if (headId - segmentBaseId >= segmentSize) {
            segments.pollFirst();
            segmentBaseId += segmentSize;
        }
        return head;
    }

    @Override
    public QueryLogSnapshot snapshot() {
        lock.readLock().lock();
        try {
            if (sizeLocked() == 0) {
                return QueryLogSnapshot.empty(nextId - 1);
            }
            QueryEvent[][] view = segments.toArray(new QueryEvent[0][]);
            return new QueryLogSnapshot(view, segmentSize, segmentBaseId, headId, nextId - 1);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Stream<QueryEvent> iterate(Instant since, Instant until) {
        return snapshot().newestFirst()
                .filter(event -> since == null || !event.getTimestamp().isBefore(since))
                .filter(event -> until == null || !event.getTimestamp().isAfter(until));
    }

    @Override
    public List<QueryEvent> evictOlderThan(Instant cutoff) {
        lock.writeLock().lock();
        try {
            List<QueryEvent> evicted = new ArrayList<>();
            while (sizeLocked() > 0 && headEvent().getTimestamp().isBefore(cutoff)) {
                evicted.add(evictHead());
            }
            return evicted;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<QueryEvent> clear() {
        lock.writeLock().lock();
        try {
            List<QueryEvent> removed = new ArrayList<>((int) sizeLocked());
            while (sizeLocked() > 0) {
                removed.add(evictHead());
            }
            // a partially filled tail segment stays; ids keep increasing
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public long size() {
        lock.readLock().lock();
        try {
            return sizeLocked();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long latestId() {
        lock.readLock().lock();
        try {
            return nextId - 1;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public RetentionPolicy getRetentionPolicy() {
        return retentionPolicy;
    }

    private long sizeLocked() {
        return nextId - headId;
    }
}
