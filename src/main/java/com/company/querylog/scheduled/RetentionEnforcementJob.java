package com.company.querylog.scheduled;

import com.company.querylog.config.QueryLogProperties;
import com.company.querylog.domain.QueryEvent;
import com.company.querylog.service.QueryLogIngestionService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Evicts events that outlived {@code querylog.retention.max-age} by wall-clock time. Appends
 * only enforce the age limit relative to the newest event, so an idle store needs this sweep.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(value = "querylog.retention.max-age")
public class RetentionEnforcementJob {

    private final QueryLogIngestionService ingestionService;
    private final QueryLogProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${querylog.retention.sweep-interval-ms:60000}")
    public void sweepExpiredEvents() {
        Duration maxAge = properties.getRetention().getMaxAge();
        if (maxAge == null) {
            return;
        }

        Instant cutoff = Instant.now(clock).minus(maxAge);
        try {
            List<QueryEvent> evicted = ingestionService.sweepExpired(cutoff);
            if (!evicted.isEmpty()) {
                log.info("Retention sweep evicted {} events older than {}", evicted.size(), cutoff);
            }
            meterRegistry.counter("querylog.retention.sweeps", "outcome", "success").increment();
        } catch (Exception e) {
            log.error("Retention sweep failed", e);
            meterRegistry.counter("querylog.retention.sweeps", "outcome", "failure").increment();
        }
    }
}
