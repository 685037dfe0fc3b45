package com.company.querylog.aggregation;

import com.company.querylog.domain.RankedEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Occurrence counts per key, kept in rank order on every change.
 * <p>
 * Rank order is count descending, then first-seen ascending. First-seen is the tick of the
 * key's earliest occurrence still counted: {@link #decrement(String)} removes the oldest
 * occurrence, matching FIFO eviction, so a ranker fed increments and evictions ranks keys
 * exactly like one rebuilt from the retained occurrences only.
 * <p>
 * Not thread-safe; callers guard access.
 */
public class TopKRanker {

    private static final Comparator<Entry> RANK_ORDER = Comparator
            .comparingLong((Entry e) -> e.count).reversed()
            .thenComparingLong(Entry::firstSeen)
            .thenComparing(e -> e.key);

    private final Map<String, Entry> entries = new HashMap<>();
    private final TreeSet<Entry> ranking = new TreeSet<>(RANK_ORDER);
    private long clock;

    /**
     * Counts one occurrence of the key and returns its new count.
     */
    public long increment(String key) {
        long tick = ++clock;
        Entry entry = entries.get(key);
        if (entry == null) {
            entry = new Entry(key);
            entry.occurrences.addLast(tick);
            entry.count = 1;
            entries.put(key, entry);
            ranking.add(entry);
            return 1;
        }
        ranking.remove(entry);
        entry.occurrences.addLast(tick);
        entry.count++;
        ranking.add(entry);
        return entry.count;
    }

    /**
     * Removes the key's oldest occurrence. Returns the remaining count, or -1 when the key
     * was not tracked. A key reaching zero is dropped.
     */
    public long decrement(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return -1;
        }
        ranking.remove(entry);
        entry.occurrences.pollFirst();
        entry.count--;
        if (entry.count == 0) {
            entries.remove(key);
            return 0;
        }
        ranking.add(entry);
        return entry.count;
    }

    /**
     * At most {@code n} keys in rank order. Walks the ordered index; the key space is not re-sorted.
     */
    public List<RankedEntry> topK(int n) {
        if (n <= 0 || ranking.isEmpty()) {
            return Collections.emptyList();
        }
        List<RankedEntry> top = new ArrayList<>(Math.min(n, ranking.size()));
        Iterator<Entry> it = ranking.iterator();
        while (it.hasNext() && top.size() < n) {
            Entry entry = it.next();
            top.add(new RankedEntry(entry.key, entry.count));
        }
        return top;
    }

    public long count(String key) {
        Entry entry = entries.get(key);
        return entry == null ? 0 : entry.count;
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
        ranking.clear();
        clock = 0;
    }

    private static final class Entry {
        private final String key;
        private final ArrayDeque<Long> occurrences = new ArrayDeque<>();
        private long count;

        private Entry(String key) {
            this.key = key;
        }

        private long firstSeen() {
            return occurrences.peekFirst();
        }
    }
}
