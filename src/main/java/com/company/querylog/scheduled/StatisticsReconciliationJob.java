package com.company.querylog.scheduled;

import com.company.querylog.service.QueryLogIngestionService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically rebuilds the statistics from the retained events and repairs any drift of the
 * incrementally maintained counters.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "querylog.reconciliation.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class StatisticsReconciliationJob {

    private final QueryLogIngestionService ingestionService;
    private final MeterRegistry meterRegistry;

    @Scheduled(
            fixedDelayString = "${querylog.reconciliation.interval-ms:300000}",
            initialDelayString = "${querylog.reconciliation.interval-ms:300000}"
    )
    public void reconcileStatistics() {
        long start = System.currentTimeMillis();
        try {
            boolean drift = ingestionService.reconcile();
            meterRegistry.counter("querylog.stats.reconciliations", "drift", String.valueOf(drift)).increment();
            log.debug("Statistics reconciliation finished in {} ms (drift={})",
                    System.currentTimeMillis() - start, drift);
        } catch (Exception e) {
            log.error("Statistics reconciliation failed", e);
            meterRegistry.counter("querylog.stats.reconciliations", "drift", "error").increment();
        }
    }
}
