package com.company.querylog.query;

import com.company.querylog.domain.QueryEvent;
import com.company.querylog.domain.QueryLogFilter;
import com.company.querylog.domain.QueryLogPage;
import com.company.querylog.domain.QueryLogRequest;
import com.company.querylog.domain.enums.QueryLogSortField;
import com.company.querylog.exception.InvalidFilterException;
import com.company.querylog.repository.QueryLogSnapshot;
import com.company.querylog.repository.QueryRecordStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Filtered, sorted, paginated reads over the record store.
 * <p>
 * Every read runs against one immutable store snapshot. A request carrying a
 * {@code snapshotId} only sees events with {@code id <= snapshotId}, so offsets computed
 * for an earlier page stay valid while new events arrive.
 */
@Slf4j
public class QueryLogRetrievalEngine {

    private final QueryRecordStore store;
    private final int maxPageSize;

    public QueryLogRetrievalEngine(QueryRecordStore store, int maxPageSize) {
        if (maxPageSize <= 0) {
            throw new IllegalArgumentException("maxPageSize must be positive");
        }
        this.store = store;
        this.maxPageSize = maxPageSize;
    }

    public QueryLogPage query(QueryLogRequest request) {
        validate(request);
        return execute(store.snapshot(), request);
    }

    private QueryLogPage execute(QueryLogSnapshot snapshot, QueryLogRequest request) {
        long anchor = anchor(snapshot, request.getSnapshotId());
        Predicate<QueryEvent> predicate = toPredicate(request.getFilter());
        int offset = request.getOffset();
        int limit = request.getLimit();

        List<QueryEvent> page;
        long total;

        if (request.getSortField() == QueryLogSortField.TIME && request.isDescending()) {
            // storage order already is newest first: count and slice in one pass
            page = new ArrayList<>(Math.min(limit, 256));
            long matched = 0;
            for (QueryEvent event : (Iterable<QueryEvent>) snapshot.newestFirst(anchor)::iterator) {
                if (!predicate.test(event)) {
                    continue;
                }
                if (matched >= offset && page.size() < limit) {
                    page.add(event);
                }
                matched++;
            }
            total = matched;
        } else {
            List<QueryEvent> matches = snapshot.newestFirst(anchor)
                    .filter(predicate)
                    .sorted(request.getSortField().comparator(request.isDescending()))
                    .collect(Collectors.toList());
            total = matches.size();
            page = offset >= matches.size()
                    ? Collections.emptyList()
                    : new ArrayList<>(matches.subList(offset, (int) Math.min((long) offset + limit, matches.size())));
        }

        log.debug("Query log read: {} of {} matches (offset={}, limit={}, snapshot={})",
                page.size(), total, offset, limit, anchor);

        return QueryLogPage.builder()
                .events(Collections.unmodifiableList(page))
                .totalMatched(total)
                .snapshotId(anchor)
                .oldest(oldestTimestamp(page))
                .build();
    }

    // rows are not in time order for every sort
    private static Instant oldestTimestamp(List<QueryEvent> page) {
        Instant oldest = null;
        for (QueryEvent event : page) {
            if (oldest == null || event.getTimestamp().isBefore(oldest)) {
                oldest = event.getTimestamp();
            }
        }
        return oldest;
    }

    private static long anchor(QueryLogSnapshot snapshot, Long snapshotId) {
        if (snapshotId == null) {
            return snapshot.lastId();
        }
        return Math.min(snapshotId, snapshot.lastId());
    }

    static Predicate<QueryEvent> toPredicate(QueryLogFilter filter) {
        Predicate<QueryEvent> predicate = event -> true;
        if (filter == null) {
            return predicate;
        }

        if (filter.hasStatusPredicate()) {
            if (filter.isBlockedGroup()) {
                predicate = predicate.and(QueryEvent::isBlocked);
            } else {
                String status = filter.getStatus();
                predicate = predicate.and(event -> event.getStatus().getRaw().equals(status));
            }
        }
        if (hasText(filter.getDomain())) {
            String needle = filter.getDomain().trim().toLowerCase(Locale.ROOT);
            predicate = predicate.and(event -> event.getDomain().contains(needle));
        }
        if (hasText(filter.getClient())) {
            String client = filter.getClient().trim();
            predicate = predicate.and(event -> event.getClient().equals(client));
        }
        if (hasText(filter.getSearch())) {
            String needle = filter.getSearch().trim().toLowerCase(Locale.ROOT);
            predicate = predicate.and(event -> event.getDomain().contains(needle)
                    || event.getClient().toLowerCase(Locale.ROOT).contains(needle));
        }
        if (hasText(filter.getQueryType())) {
            String type = filter.getQueryType().trim();
            predicate = predicate.and(event -> event.getQueryType().equalsIgnoreCase(type));
        }
        if (filter.getFrom() != null) {
            predicate = predicate.and(event -> !event.getTimestamp().isBefore(filter.getFrom()));
        }
        if (filter.getTo() != null) {
            predicate = predicate.and(event -> !event.getTimestamp().isAfter(filter.getTo()));
        }
        if (filter.getMinElapsedMs() != null) {
            double min = filter.getMinElapsedMs();
            predicate = predicate.and(event -> event.getElapsedMs() > min);
        }
        return predicate;
    }

    private void validate(QueryLogRequest request) {
        if (request == null) {
            throw new InvalidFilterException("Request is required");
        }
        if (request.getOffset() < 0) {
            throw new InvalidFilterException("offset must not be negative: " + request.getOffset());
        }
        if (request.getLimit() < 0) {
            throw new InvalidFilterException("limit must not be negative: " + request.getLimit());
        }
        if (request.getLimit() > maxPageSize) {
            throw new InvalidFilterException("limit must not exceed " + maxPageSize + ": " + request.getLimit());
        }
        if (request.getSortField() == null) {
            throw new InvalidFilterException("sort field is required");
        }
        if (request.getSnapshotId() != null && request.getSnapshotId() < 0) {
            throw new InvalidFilterException("snapshotId must not be negative: " + request.getSnapshotId());
        }
        validateFilter(request.getFilter());
    }

    private static void validateFilter(QueryLogFilter filter) {
        if (filter == null) {
            return;
        }
        if (filter.getFrom() != null && filter.getTo() != null && filter.getFrom().isAfter(filter.getTo())) {
            throw new InvalidFilterException(
                    "Time range end " + filter.getTo() + " is before start " + filter.getFrom());
        }
        Double minElapsed = filter.getMinElapsedMs();
        if (minElapsed != null && (minElapsed.isNaN() || minElapsed.isInfinite() || minElapsed < 0)) {
            throw new InvalidFilterException("minElapsedMs must be a non-negative number: " + minElapsed);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
