package com.company.querylog.controller;

import com.company.querylog.dto.response.SlowestQueryResponse;
import com.company.querylog.dto.response.StatsResponse;
import com.company.querylog.service.StatsService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.concurrent.TimeUnit;

@RestController
@RequestMapping("/api/v1/stats")
@Tag(name = "Statistics", description = "Aggregated DNS query statistics and top-N rankings")
@RequiredArgsConstructor
@Slf4j
public class StatsController {

    private final StatsService statsService;
    private final MeterRegistry meterRegistry;

    @GetMapping
    @Operation(
            summary = "Get query statistics",
            description = "Totals, average processing time (ms), block percentage and top queried/blocked domains and clients"
    )
    public ResponseEntity<StatsResponse> getStats(
            @Parameter(description = "Entries per ranking, overrides the configured top-N")
            @RequestParam(required = false) @Min(1) @Max(100) Integer count) {

        meterRegistry.counter("api.stats.requests", "endpoint", "stats").increment();

        return ResponseEntity.ok()
                .cacheControl(CacheControl.noCache())
                .body(statsService.getStats(count));
    }

    @GetMapping("/slowest")
    @Operation(
            summary = "Get slowest queried domains",
            description = "Top 10 domains by highest elapsed time among the newest scanDepth events, cached for 60 seconds"
    )
    public ResponseEntity<List<SlowestQueryResponse>> getSlowestQueries(
            @RequestParam(defaultValue = "${querylog.slowest.scan-depth:1000}") @Min(1) @Max(100000) int scanDepth) {

        meterRegistry.counter("api.stats.requests", "endpoint", "slowest").increment();

        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(60, TimeUnit.SECONDS).cachePrivate())
                .body(statsService.getSlowestQueries(scanDepth));
    }

    @PostMapping("/reset")
    @Operation(summary = "Reset statistics", description = "Zeroes counters and rankings; the query log is kept")
    public ResponseEntity<Void> resetStats() {
        log.info("Statistics reset requested");
        meterRegistry.counter("api.stats.requests", "endpoint", "reset").increment();

        statsService.resetStats();
        return ResponseEntity.noContent().build();
    }
}
