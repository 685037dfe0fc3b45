package com.company.querylog.controller;

import com.company.querylog.domain.enums.QueryLogSortField;
import com.company.querylog.dto.request.QueryLogParams;
import com.company.querylog.dto.response.QueryLogResponse;
import com.company.querylog.service.QueryLogQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/querylog")
@Tag(name = "Query Log", description = "Search, filter and export the DNS query log")
@RequiredArgsConstructor
@Slf4j
public class QueryLogController {

    static final MediaType TEXT_CSV = new MediaType("text", "csv");

    private final QueryLogQueryService queryService;
    private final MeterRegistry meterRegistry;

    @GetMapping
    @Operation(
            summary = "Get a page of the query log",
            description = "Filters are combined with AND. Pass snapshot_id back as snapshotId to page without shifting offsets"
    )
    public ResponseEntity<QueryLogResponse> getQueryLog(@ModelAttribute QueryLogParams params) {
        meterRegistry.counter("api.querylog.requests",
                "endpoint", "list",
                "sort", sortTag(params.getSort())
        ).increment();

        QueryLogResponse response = queryService.getQueryLog(params);

        log.debug("Query log page: {} rows of {} (snapshot {})",
                response.getData().size(), response.getTotal(), response.getSnapshotId());

        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(response);
    }

    @GetMapping("/export")
    @Operation(summary = "Export a page of the query log as CSV")
    public ResponseEntity<String> exportQueryLog(@ModelAttribute QueryLogParams params) {
        meterRegistry.counter("api.querylog.requests", "endpoint", "export", "sort", "n/a").increment();

        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"querylog.csv\"")
                .body(queryService.exportCsv(params));
    }

    // bounded tag values: unknown sorts share one series
    static String sortTag(String sort) {
        QueryLogSortField field = QueryLogSortField.fromParam(sort);
        return field != null ? field.getParamName() : "invalid";
    }
}
