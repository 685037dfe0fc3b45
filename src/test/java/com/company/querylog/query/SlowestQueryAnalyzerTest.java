package com.company.querylog.query;

import com.company.querylog.domain.QueryEvent;
import com.company.querylog.domain.SlowestQuery;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.company.querylog.QueryEventFixtures.event;
import static org.assertj.core.api.Assertions.assertThat;

class SlowestQueryAnalyzerTest {

    private final SlowestQueryAnalyzer analyzer = new SlowestQueryAnalyzer();

    @Test
    void ordersDomainsByHighestElapsed() {
        List<QueryEvent> newestFirst = List.of(
                event("fast.com", "10.0.0.1", "OK", 5.0),
                event("slow.com", "10.0.0.2", "OK", 300.0),
                event("medium.com", "10.0.0.3", "OK", 50.0),
                event("slow.com", "10.0.0.4", "FilteredBlackList", 900.0));

        List<SlowestQuery> result = analyzer.analyze(newestFirst.stream(), 1000);

        assertThat(result).extracting(SlowestQuery::getDomain).containsExactly("slow.com", "medium.com", "fast.com");
        SlowestQuery slowest = result.get(0);
        assertThat(slowest.getElapsedMs()).isEqualTo(900.0);
        assertThat(slowest.getClient()).isEqualTo("10.0.0.4");
        assertThat(slowest.getReason()).isEqualTo("FilteredBlackList");
        assertThat(slowest.getOccurrences()).containsExactly(900.0, 300.0);
    }

    @Test
    void keepsTopFiveOccurrencesDescending() {
        List<QueryEvent> events = new ArrayList<>();
        for (double elapsed : new double[]{4, 9, 1, 7, 3, 8, 2}) {
            events.add(event("a.com", "10.0.0.1", "OK", elapsed));
        }

        SlowestQuery result = analyzer.analyze(events.stream(), 1000).get(0);

        assertThat(result.getOccurrences()).containsExactly(9.0, 8.0, 7.0, 4.0, 3.0);
    }

    @Test
    void skipsNonPositiveElapsed() {
        List<QueryEvent> events = List.of(
                event("cached.com", "10.0.0.1", "OK", 0.0),
                event("real.com", "10.0.0.1", "OK", 1.5));

        assertThat(analyzer.analyze(events.stream(), 1000)).extracting(SlowestQuery::getDomain)
                .containsExactly("real.com");
    }

    @Test
    void returnsAtMostTenDomains() {
        List<QueryEvent> events = new ArrayList<>();
        for (int i = 1; i <= 15; i++) {
            events.add(event("d" + i + ".com", "10.0.0.1", "OK", i));
        }
        Collections.reverse(events);

        List<SlowestQuery> result = analyzer.analyze(events.stream(), 1000);

        assertThat(result).hasSize(SlowestQueryAnalyzer.TOP_DOMAINS);
        assertThat(result.get(0).getDomain()).isEqualTo("d15.com");
        assertThat(result.get(9).getDomain()).isEqualTo("d6.com");
    }

    @Test
    void scanDepthLimitsEventsRead() {
        List<QueryEvent> newestFirst = List.of(
                event("recent.com", "10.0.0.1", "OK", 10.0),
                event("old.com", "10.0.0.1", "OK", 999.0));

        assertThat(analyzer.analyze(newestFirst.stream(), 1)).extracting(SlowestQuery::getDomain)
                .containsExactly("recent.com");
        assertThat(analyzer.analyze(newestFirst.stream(), 0)).isEmpty();
    }

    @Test
    void equalMaximaKeepMoreRecentDomainFirst() {
        List<QueryEvent> newestFirst = List.of(
                event("newer.com", "10.0.0.1", "OK", 40.0),
                event("older.com", "10.0.0.1", "OK", 40.0));

        assertThat(analyzer.analyze(newestFirst.stream(), 10)).extracting(SlowestQuery::getDomain)
                .containsExactly("newer.com", "older.com");
    }
}
