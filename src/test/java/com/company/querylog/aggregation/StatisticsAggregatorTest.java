package com.company.querylog.aggregation;

import com.company.querylog.domain.AggregateStats;
import com.company.querylog.domain.QueryEvent;
import com.company.querylog.domain.RankedEntry;
import com.company.querylog.domain.RetentionPolicy;
import com.company.querylog.repository.AppendResult;
import com.company.querylog.repository.InMemoryQueryRecordStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static com.company.querylog.QueryEventFixtures.blocked;
import static com.company.querylog.QueryEventFixtures.event;
import static com.company.querylog.QueryEventFixtures.ok;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StatisticsAggregatorTest {

    private final StatisticsAggregator aggregator = new StatisticsAggregator(10);

    private long nextId = 1;

    private QueryEvent stored(QueryEvent event) {
        return event.withId(nextId++);
    }

    @Test
    void dashboardScenario() {
        for (int i = 0; i < 5; i++) {
            aggregator.onEvent(stored(ok("example.com")));
        }
        for (int i = 0; i < 3; i++) {
            aggregator.onEvent(stored(blocked("blocked.com")));
        }

        AggregateStats stats = aggregator.snapshot();

        assertThat(stats.getTotalQueries()).isEqualTo(8);
        assertThat(stats.getTotalBlocked()).isEqualTo(3);
        assertThat(stats.getTotalUnblocked()).isEqualTo(5);
        assertThat(stats.getBlockPercentage()).isEqualTo(37.5);
        assertThat(stats.getAvgProcessingTimeMs()).isCloseTo((5 * 10.0 + 3 * 2.0) / 8, within(1e-9));
        assertThat(stats.getTopQueriedDomains()).containsExactly(
                new RankedEntry("example.com", 5),
                new RankedEntry("blocked.com", 3));
        assertThat(stats.getTopBlockedDomains()).containsExactly(new RankedEntry("blocked.com", 3));
        assertThat(stats.getTopClients()).containsExactly(new RankedEntry("192.168.1.10", 8));
    }

    @Test
    void emptySnapshotIsZeroValued() {
        AggregateStats stats = aggregator.snapshot();

        assertThat(stats.getTotalQueries()).isZero();
        assertThat(stats.getAvgProcessingTimeMs()).isEqualTo(0.0);
        assertThat(stats.getBlockPercentage()).isEqualTo(0.0);
        assertThat(stats.getTopQueriedDomains()).isEmpty();
        assertThat(stats.getTopBlockedDomains()).isEmpty();
        assertThat(stats.getTopClients()).isEmpty();
    }

    @Test
    void snapshotIsIdempotent() {
        aggregator.onEvent(stored(ok("a.com")));
        aggregator.onEvent(stored(blocked("b.com")));

        assertThat(aggregator.snapshot()).isEqualTo(aggregator.snapshot());
    }

    @Test
    void rankingsAreBoundedByTopN() {
        StatisticsAggregator small = new StatisticsAggregator(2);
        for (String domain : List.of("a.com", "b.com", "c.com", "a.com")) {
            small.onEvent(stored(ok(domain)));
        }

        assertThat(small.snapshot().getTopQueriedDomains()).extracting(RankedEntry::key)
                .containsExactly("a.com", "b.com");
        assertThat(small.topQueriedDomains(5)).hasSize(3);
        assertThat(small.snapshot(1).getTopClients()).hasSize(1);
    }

    @Test
    void evictionDecrementsAggregates() {
        QueryEvent first = stored(event("a.com", "10.0.0.1", "FilteredBlackList", 30.0));
        QueryEvent second = stored(event("b.com", "10.0.0.2", "OK", 10.0));
        aggregator.onEvent(first);
        aggregator.onEvent(second);

        aggregator.onEvicted(first);

        AggregateStats stats = aggregator.snapshot();
        assertThat(stats.getTotalQueries()).isEqualTo(1);
        assertThat(stats.getTotalBlocked()).isZero();
        assertThat(stats.getAvgProcessingTimeMs()).isCloseTo(10.0, within(1e-9));
        assertThat(stats.getTopQueriedDomains()).containsExactly(new RankedEntry("b.com", 1));
        assertThat(stats.getTopBlockedDomains()).isEmpty();
        assertThat(stats.getTopClients()).containsExactly(new RankedEntry("10.0.0.2", 1));
    }

    @Test
    void ignoresEvictionOfEventsCountedBeforeReset() {
        QueryEvent old = stored(ok("old.com"));
        aggregator.onEvent(old);
        aggregator.reset();
        aggregator.onEvent(stored(ok("new.com")));

        aggregator.onEvicted(old);

        assertThat(aggregator.snapshot().getTotalQueries()).isEqualTo(1);
        assertThat(aggregator.snapshot().getTopQueriedDomains()).containsExactly(new RankedEntry("new.com", 1));
    }

    @Test
    void resetZeroesEverything() {
        aggregator.onEvent(stored(blocked("b.com")));

        aggregator.reset();

        assertThat(aggregator.snapshot()).isEqualTo(AggregateStats.empty());
        assertThat(aggregator.getFirstCountedId()).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void incrementalStateMatchesReplayAfterEvictions() {
        InMemoryQueryRecordStore store = new InMemoryQueryRecordStore(RetentionPolicy.maxEvents(200), 32);
        Random random = new Random(42);
        String[] statuses = {"OK", "FilteredBlackList", "NotFilteredWhiteList", "FilteredParental", "Custom"};

        for (int i = 0; i < 2_000; i++) {
            QueryEvent event = event(
                    "d" + random.nextInt(30) + ".com",
                    "10.0.0." + random.nextInt(12),
                    statuses[random.nextInt(statuses.length)],
                    random.nextDouble() * 250);
            AppendResult result = store.append(event);
            aggregator.onEvent(result.event());
            result.evicted().forEach(aggregator::onEvicted);
        }

        StatisticsAggregator replayed = new StatisticsAggregator(10);
        replayed.replay(store.snapshot().oldestFirst());

        AggregateStats incremental = aggregator.snapshot();
        AggregateStats expected = replayed.snapshot();

        assertThat(incremental.getTotalQueries()).isEqualTo(200).isEqualTo(expected.getTotalQueries());
        assertThat(incremental.getTotalBlocked()).isEqualTo(expected.getTotalBlocked());
        assertThat(incremental.getAvgProcessingTimeMs()).isCloseTo(expected.getAvgProcessingTimeMs(), within(1e-6));
        assertThat(incremental.getTopQueriedDomains()).isEqualTo(expected.getTopQueriedDomains());
        assertThat(incremental.getTopBlockedDomains()).isEqualTo(expected.getTopBlockedDomains());
        assertThat(incremental.getTopClients()).isEqualTo(expected.getTopClients());
    }

    @Test
    void concurrentReadersNeverSeeTornSnapshots() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(3);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean violation = new AtomicBoolean();
        AtomicLong idSequence = new AtomicLong();
        List<Future<?>> futures = new ArrayList<>();

        for (int w = 0; w < 2; w++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 5_000; i++) {
                    QueryEvent event = i % 3 == 0 ? blocked("b.com") : ok("a.com");
                    aggregator.onEvent(event.withId(idSequence.incrementAndGet()));
                }
                return null;
            }));
        }
        futures.add(executor.submit(() -> {
            start.await();
            for (int i = 0; i < 2_000; i++) {
                AggregateStats stats = aggregator.snapshot();
                long rankedTotal = stats.getTopQueriedDomains().stream().mapToLong(RankedEntry::count).sum();
                long rankedBlocked = stats.getTopBlockedDomains().stream().mapToLong(RankedEntry::count).sum();
                if (rankedTotal != stats.getTotalQueries()
                        || rankedBlocked != stats.getTotalBlocked()
                        || stats.getTotalBlocked() + stats.getTotalUnblocked() != stats.getTotalQueries()) {
                    violation.set(true);
                }
            }
            return null;
        }));

        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertThat(violation).isFalse();
        assertThat(aggregator.snapshot().getTotalQueries()).isEqualTo(10_000);
    }
}
