package com.company.querylog.query;

import com.company.querylog.domain.QueryEvent;
import com.company.querylog.domain.SlowestQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the domains with the slowest lookups among the most recent events.
 */
@Component
@Slf4j
public class SlowestQueryAnalyzer {

    public static final int TOP_DOMAINS = 10;
    public static final int TOP_OCCURRENCES = 5;

    /**
     * Scans at most {@code scanDepth} events from {@code newestFirst} and returns up to
     * {@value #TOP_DOMAINS} domains ordered by their highest elapsed time. Events with
     * {@code elapsedMs <= 0} are skipped but still count towards the scan depth. Equal
     * maxima keep the domain seen first (the more recent one) ahead.
     */
    public List<SlowestQuery> analyze(Stream<QueryEvent> newestFirst, int scanDepth) {
        if (scanDepth <= 0) {
            return List.of();
        }

        Map<String, DomainAccumulator> byDomain = new LinkedHashMap<>();
        Iterator<QueryEvent> it = newestFirst.limit(scanDepth).iterator();
        int scanned = 0;
        while (it.hasNext()) {
            QueryEvent event = it.next();
            scanned++;
            if (event.getElapsedMs() <= 0) {
                continue;
            }
            DomainAccumulator acc = byDomain.get(event.getDomain());
            if (acc == null) {
                byDomain.put(event.getDomain(), new DomainAccumulator(event));
            } else {
                acc.accept(event);
            }
        }

        // stable sort: insertion order breaks ties
        List<SlowestQuery> result = byDomain.values().stream()
                .sorted(Comparator.comparingDouble((DomainAccumulator acc) -> acc.maxElapsedMs).reversed())
                .limit(TOP_DOMAINS)
                .map(DomainAccumulator::toSlowestQuery)
                .collect(Collectors.toList());

        log.debug("Slowest-query scan: {} events, {} domains, {} returned", scanned, byDomain.size(), result.size());
        return result;
    }

    private static final class DomainAccumulator {
        private final String domain;
        private double maxElapsedMs;
        private String client;
        private String reason;
        private final List<Double> occurrences = new ArrayList<>(TOP_OCCURRENCES + 1);

        private DomainAccumulator(QueryEvent first) {
            this.domain = first.getDomain();
            this.maxElapsedMs = first.getElapsedMs();
            this.client = first.getClient();
            this.reason = first.getReason();
            occurrences.add(first.getElapsedMs());
        }

        private void accept(QueryEvent event) {
            double elapsed = event.getElapsedMs();
            addOccurrence(elapsed);
            if (elapsed > maxElapsedMs) {
                maxElapsedMs = elapsed;
                client = event.getClient();
                reason = event.getReason();
            }
        }

        // keeps the list descending and bounded
        private void addOccurrence(double elapsed) {
            if (occurrences.size() == TOP_OCCURRENCES && elapsed <= occurrences.get(TOP_OCCURRENCES - 1)) {
                return;
            }
            int i = 0;
            while (i < occurrences.size() && elapsed <= occurrences.get(i)) {
                i++;
            }
            occurrences.add(i, elapsed);
            if (occurrences.size() > TOP_OCCURRENCES) {
                occurrences.remove(occurrences.size() - 1);
            }
        }

        private SlowestQuery toSlowestQuery() {
            return SlowestQuery.builder()
                    .domain(domain)
                    .elapsedMs(maxElapsedMs)
                    .client(client)
                    .reason(reason)
                    .occurrences(List.copyOf(occurrences))
                    .build();
        }
    }
}
