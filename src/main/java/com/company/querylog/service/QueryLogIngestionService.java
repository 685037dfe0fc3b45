package com.company.querylog.service;

import com.company.querylog.aggregation.StatisticsAggregator;
import com.company.querylog.domain.AggregateStats;
import com.company.querylog.domain.QueryEvent;
import com.company.querylog.dto.request.RawQueryEvent;
import com.company.querylog.exception.CapacityExceededException;
import com.company.querylog.exception.MalformedEventException;
import com.company.querylog.normalize.QueryEventNormalizer;
import com.company.querylog.repository.AppendResult;
import com.company.querylog.repository.QueryLogSnapshot;
import com.company.querylog.repository.QueryRecordStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Write path: normalizes wire events, appends them to the store and keeps the aggregator in step.
 * <p>
 * Append, {@code onEvent} and the compensating {@code onEvicted} calls run under one lock, so
 * the aggregator always sees an event before its eviction and evictions in store order.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QueryLogIngestionService {

    private final QueryRecordStore store;
    private final StatisticsAggregator aggregator;
    private final QueryEventNormalizer normalizer;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;

    private final ReentrantLock ingestionLock = new ReentrantLock();

    /**
     * Ingests a batch. Malformed entries are rejected one by one; a full store stops the batch
     * with {@link CapacityExceededException}, keeping what was already appended.
     */
    public IngestionResult ingestBatch(List<RawQueryEvent> batch) {
        Span span = tracer.spanBuilder("querylog.ingest.batch")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("batch.size", batch.size());

            int accepted = 0;
            int evicted = 0;
            long lastEventId = 0;
            List<IngestionResult.Rejection> rejections = new ArrayList<>();

            for (int i = 0; i < batch.size(); i++) {
                QueryEvent event;
                try {
                    event = normalizer.normalize(batch.get(i));
                } catch (MalformedEventException e) {
                    log.warn("Rejected query event at index {}: {}", i, e.getMessage());
                    meterRegistry.counter("querylog.events.rejected", "field", e.getField()).increment();
                    rejections.add(new IngestionResult.Rejection(i, e.getMessage()));
                    continue;
                }

                try {
                    AppendResult result = append(event);
                    accepted++;
                    evicted += result.evicted().size();
                    lastEventId = result.eventId();
                } catch (CapacityExceededException e) {
                    log.error("Store full after {} of {} events in batch: {}", accepted, batch.size(), e.getMessage());
                    meterRegistry.counter("querylog.events.capacity_exceeded").increment();
                    throw e;
                }
            }

            span.setAttribute("batch.accepted", accepted);
            span.setAttribute("batch.rejected", rejections.size());

            if (accepted > 0) {
                meterRegistry.counter("querylog.events.ingested").increment(accepted);
            }

            log.debug("Ingested batch: {} accepted, {} rejected, {} evicted", accepted, rejections.size(), evicted);

            return IngestionResult.builder()
                    .accepted(accepted)
                    .rejected(rejections.size())
                    .evicted(evicted)
                    .lastEventId(lastEventId)
                    .rejections(rejections)
                    .build();

        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Batch ingestion failed");
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Appends an already normalized event.
     */
    public AppendResult append(QueryEvent event) {
        ingestionLock.lock();
        try {
            AppendResult result = store.append(event);
            aggregator.onEvent(result.event());
            applyEvictions(result.evicted());
            return result;
        } finally {
            ingestionLock.unlock();
        }
    }

    /**
     * Evicts events older than the cutoff and removes them from the statistics.
     */
    public List<QueryEvent> sweepExpired(Instant cutoff) {
        ingestionLock.lock();
        try {
            List<QueryEvent> evicted = store.evictOlderThan(cutoff);
            applyEvictions(evicted);
            return evicted;
        } finally {
            ingestionLock.unlock();
        }
    }

    /**
     * Zeroes the statistics. The query log itself is kept.
     */
    public void resetStatistics() {
        ingestionLock.lock();
        try {
            aggregator.reset();
            log.info("Query statistics reset (store keeps {} events)", store.size());
        } finally {
            ingestionLock.unlock();
        }
    }

    /**
     * Rebuilds the statistics from the retained events counted since the last reset and compares
     * them with the incrementally maintained ones. On drift the rebuilt state replaces the live one.
     *
     * @return true when drift was found and repaired
     */
    public boolean reconcile() {
        ingestionLock.lock();
        try {
            long firstCounted = aggregator.getFirstCountedId();
            QueryLogSnapshot snapshot = store.snapshot();

            StatisticsAggregator rebuilt = new StatisticsAggregator(aggregator.getTopN());
            rebuilt.replay(snapshot.oldestFirst().filter(event -> event.getId() >= firstCounted));

            AggregateStats expected = rebuilt.snapshot();
            AggregateStats actual = aggregator.snapshot();
            if (sameStatistics(expected, actual)) {
                log.debug("Statistics reconciled: {} queries, no drift", actual.getTotalQueries());
                return false;
            }

            log.warn("Statistics drift detected: live total={} blocked={} avg={}, replay total={} blocked={} avg={}",
                    actual.getTotalQueries(), actual.getTotalBlocked(), actual.getAvgProcessingTimeMs(),
                    expected.getTotalQueries(), expected.getTotalBlocked(), expected.getAvgProcessingTimeMs());
            aggregator.replay(snapshot.oldestFirst().filter(event -> event.getId() >= firstCounted));
            return true;
        } finally {
            ingestionLock.unlock();
        }
    }

    private void applyEvictions(List<QueryEvent> evicted) {
        if (evicted.isEmpty()) {
            return;
        }
        evicted.forEach(aggregator::onEvicted);
        meterRegistry.counter("querylog.events.evicted").increment(evicted.size());
    }

    static boolean sameStatistics(AggregateStats a, AggregateStats b) {
        if (a.getTotalQueries() != b.getTotalQueries() || a.getTotalBlocked() != b.getTotalBlocked()) {
            return false;
        }
        // the incremental mean accumulates rounding error that a replay does not
        double tolerance = 1e-6 * Math.max(1.0, Math.abs(a.getAvgProcessingTimeMs()));
        if (Math.abs(a.getAvgProcessingTimeMs() - b.getAvgProcessingTimeMs()) > tolerance) {
            return false;
        }
        return a.getTopQueriedDomains().equals(b.getTopQueriedDomains())
                && a.getTopBlockedDomains().equals(b.getTopBlockedDomains())
                && a.getTopClients().equals(b.getTopClients());
    }
}
