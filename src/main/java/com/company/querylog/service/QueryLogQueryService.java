package com.company.querylog.service;

import com.company.querylog.config.QueryLogProperties;
import com.company.querylog.domain.QueryEvent;
import com.company.querylog.domain.QueryLogFilter;
import com.company.querylog.domain.QueryLogPage;
import com.company.querylog.domain.QueryLogRequest;
import com.company.querylog.domain.enums.QueryLogSortField;
import com.company.querylog.dto.request.QueryLogParams;
import com.company.querylog.dto.response.QueryLogEntryResponse;
import com.company.querylog.dto.response.QueryLogResponse;
import com.company.querylog.exception.InvalidFilterException;
import com.company.querylog.query.QueryLogCsvExporter;
import com.company.querylog.query.QueryLogRetrievalEngine;
import com.company.querylog.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class QueryLogQueryService {

    private final QueryLogRetrievalEngine retrievalEngine;
    private final QueryLogCsvExporter csvExporter;
    private final QueryLogProperties properties;

    public QueryLogResponse getQueryLog(QueryLogParams params) {
        QueryLogPage page = retrievalEngine.query(toRequest(params));

        return QueryLogResponse.builder()
                .data(page.getEvents().stream()
                        .map(QueryLogQueryService::toEntry)
                        .collect(Collectors.toList()))
                .total(page.getTotalMatched())
                .snapshotId(page.getSnapshotId())
                .oldest(TimeUtils.formatIso(page.getOldest()))
                .build();
    }

    /**
     * The page selected by {@code params}, rendered as CSV.
     */
    public String exportCsv(QueryLogParams params) {
        QueryLogPage page = retrievalEngine.query(toRequest(params));
        log.debug("Exporting {} query-log rows as CSV", page.getEvents().size());
        return csvExporter.export(page.getEvents());
    }

    QueryLogRequest toRequest(QueryLogParams params) {
        QueryLogSortField sortField = QueryLogSortField.fromParam(params.getSort());
        if (sortField == null) {
            throw new InvalidFilterException("Unknown sort field: " + params.getSort());
        }

        QueryLogFilter filter = QueryLogFilter.builder()
                .status(params.getStatus())
                .domain(params.getDomain())
                .client(params.getClient())
                .search(params.getSearch())
                .queryType(params.getQueryType())
                .from(parseBound("from", params.getFrom()))
                .to(parseBound("to", params.getTo()))
                .minElapsedMs(params.getMinElapsedMs())
                .build();

        return QueryLogRequest.builder()
                .filter(filter)
                .offset(params.getOffset() != null ? params.getOffset() : 0)
                .limit(params.getLimit() != null ? params.getLimit() : properties.getQuery().getDefaultPageSize())
                .sortField(sortField)
                .descending(isDescending(params.getOrder()))
                .snapshotId(params.getSnapshotId())
                .build();
    }

    private static boolean isDescending(String order) {
        if (order == null || order.isBlank() || "desc".equalsIgnoreCase(order)) {
            return true;
        }
        if ("asc".equalsIgnoreCase(order)) {
            return false;
        }
        throw new InvalidFilterException("order must be 'asc' or 'desc': " + order);
    }

    private static Instant parseBound(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return TimeUtils.parseIsoInstant(value);
        } catch (DateTimeException e) {
            throw new InvalidFilterException(name + " is not an ISO-8601 date-time: '" + value + "'");
        }
    }

    static QueryLogEntryResponse toEntry(QueryEvent event) {
        return QueryLogEntryResponse.builder()
                .id(event.getId())
                .question(new QueryLogEntryResponse.Question(event.getDomain(), event.getQueryType()))
                .client(event.getClient())
                .status(event.getStatus().getRaw())
                .reason(event.getReason())
                .blocked(event.isBlocked())
                .time(TimeUtils.formatIso(event.getTimestamp()))
                .elapsedMs(TimeUtils.formatElapsed(event.getElapsedMs()))
                .upstream(event.getUpstream())
                .rule(event.getRule())
                .filterId(event.getFilterId())
                .build();
    }
}
