package com.company.querylog.aggregation;

import com.company.querylog.domain.AggregateStats;
import com.company.querylog.domain.QueryEvent;
import com.company.querylog.domain.RankedEntry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

/**
 * Running query statistics: totals, mean processing time and three top-N rankings
 * (all queried domains, blocked domains, clients).
 * <p>
 * Writers and readers share one read/write lock, so a snapshot never shows counters and
 * rankings from different points in the event sequence.
 */
@Slf4j
public class StatisticsAggregator {

    private final int topN;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final TopKRanker queriedDomains = new TopKRanker();
    private final TopKRanker blockedDomains = new TopKRanker();
    private final TopKRanker clients = new TopKRanker();
    private final RunningMean processingTime = new RunningMean();

    private long totalQueries;
    private long totalBlocked;

    // Evictions of events older than this id were never counted (they predate a reset)
    private long firstCountedId = Long.MAX_VALUE;

    public StatisticsAggregator(int topN) {
        if (topN <= 0) {
            throw new IllegalArgumentException("topN must be positive");
        }
        this.topN = topN;
    }

    public void onEvent(QueryEvent event) {
        lock.writeLock().lock();
        try {
            apply(event);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Compensates an event the store evicted. Events must be evicted in the order they were
     * counted, which the store's FIFO retention guarantees.
     */
    public void onEvicted(QueryEvent event) {
        lock.writeLock().lock();
        try {
            if (event.getId() < firstCountedId || totalQueries == 0) {
                log.trace("Ignoring eviction of uncounted event {}", event.getId());
                return;
            }
            totalQueries--;
            processingTime.remove(event.getElapsedMs());
            queriedDomains.decrement(event.getDomain());
            clients.decrement(event.getClient());
            if (event.isBlocked()) {
                totalBlocked--;
                blockedDomains.decrement(event.getDomain());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public AggregateStats snapshot() {
        return snapshot(topN);
    }

    /**
     * Snapshot with rankings bounded by {@code n} instead of the configured top-N.
     */
    public AggregateStats snapshot(int n) {
        lock.readLock().lock();
        try {
            return AggregateStats.builder()
                    .totalQueries(totalQueries)
                    .totalBlocked(totalBlocked)
                    .avgProcessingTimeMs(processingTime.mean())
                    .topQueriedDomains(queriedDomains.topK(n))
                    .topBlockedDomains(blockedDomains.topK(n))
                    .topClients(clients.topK(n))
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<RankedEntry> topQueriedDomains(int n) {
        lock.readLock().lock();
        try {
            return queriedDomains.topK(n);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<RankedEntry> topBlockedDomains(int n) {
        lock.readLock().lock();
        try {
            return blockedDomains.topK(n);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<RankedEntry> topClients(int n) {
        lock.readLock().lock();
        try {
            return clients.topK(n);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void reset() {
        lock.writeLock().lock();
        try {
            clearLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Discards the current state and rebuilds it from the given events, oldest first.
     */
    public void replay(Stream<QueryEvent> oldestFirst) {
        lock.writeLock().lock();
        try {
            clearLocked();
            oldestFirst.forEach(this::apply);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getTopN() {
        return topN;
    }

    /**
     * Id of the oldest event counted since the last reset, {@link Long#MAX_VALUE} when none was.
     */
    public long getFirstCountedId() {
        lock.readLock().lock();
        try {
            return firstCountedId;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void apply(QueryEvent event) {
        if (firstCountedId == Long.MAX_VALUE) {
            firstCountedId = event.getId();
        }
        totalQueries++;
        processingTime.add(event.getElapsedMs());
        queriedDomains.increment(event.getDomain());
        clients.increment(event.getClient());
        if (event.isBlocked()) {
            totalBlocked++;
            blockedDomains.increment(event.getDomain());
        }
    }

    private void clearLocked() {
        queriedDomains.clear();
        blockedDomains.clear();
        clients.clear();
        processingTime.reset();
        totalQueries = 0;
        totalBlocked = 0;
        firstCountedId = Long.MAX_VALUE;
    }
}
