package com.company.querylog.controller;

import com.company.querylog.dto.request.IngestBatchRequest;
import com.company.querylog.dto.response.IngestionResponse;
import com.company.querylog.service.IngestionResult;
import com.company.querylog.service.QueryLogIngestionService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/querylog")
@Tag(name = "Query Log Ingestion", description = "Push DNS query events from the resolver")
@RequiredArgsConstructor
@Slf4j
public class QueryLogIngestionController {

    private final QueryLogIngestionService ingestionService;
    private final MeterRegistry meterRegistry;

    @PostMapping("/events")
    @Operation(
            summary = "Ingest a batch of query events",
            description = "Malformed events are rejected individually and reported by index; the rest are stored"
    )
    public ResponseEntity<IngestionResponse> ingest(@Valid @RequestBody IngestBatchRequest request) {
        meterRegistry.counter("api.querylog.requests", "endpoint", "ingest", "sort", "n/a").increment();

        IngestionResult result = ingestionService.ingestBatch(request.getData());

        if (result.getRejected() > 0) {
            log.info("Batch of {} events: {} accepted, {} rejected",
                    request.getData().size(), result.getAccepted(), result.getRejected());
        }

        return ResponseEntity.ok(IngestionResponse.builder()
                .accepted(result.getAccepted())
                .rejected(result.getRejected())
                .evicted(result.getEvicted())
                .errors(result.getRejections().stream()
                        .map(r -> new IngestionResponse.RejectedEvent(r.index(), r.message()))
                        .collect(Collectors.toList()))
                .build());
    }
}
