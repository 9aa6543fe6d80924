package io.ledgerpoller.cursor;

import io.ledgerpoller.LedgerEvent;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-filter cursor state used to tell new events from ones already delivered, and to keep
 * that state bounded.
 *
 * <p>An event is new for a filter when its time is after the filter's watermark and its id
 * has not been recorded. Recording an event remembers its id with the current wall-clock time
 * and moves the watermark forward, never back. {@link #evict} forgets ids by age and count
 * but leaves watermarks alone.
 *
 * <p>The set of filter keys is fixed at construction. This class is thread-safe: each
 * filter's state is guarded by its own lock, so queries for different filters never contend.
 */
public final class CursorStore {
    private final Map<String, CursorState> states;

    /**
     * Creates one cursor per distinct filter key.
     *
     * @param filterKeys       canonical filter forms; duplicates share one cursor
     * @param initialWatermark starting watermark for every filter (ms since epoch)
     */
    public CursorStore(Collection<String> filterKeys, long initialWatermark) {
        Objects.requireNonNull(filterKeys, "filterKeys");
        Map<String, CursorState> created = new LinkedHashMap<>();
        for (String key : filterKeys) {
            Objects.requireNonNull(key, "filterKey");
            created.putIfAbsent(key, new CursorState(initialWatermark));
        }
        this.states = Collections.unmodifiableMap(created);
    }

    /**
     * Returns whether {@code event} has not been seen for this filter. Has no side effects.
     *
     * @throws IllegalArgumentException if the filter key is unknown
     */
    public boolean isNew(String filterKey, LedgerEvent event) {
        return state(filterKey).isNew(event.id().key(), event.timestampMs());
    }

    /**
     * Marks {@code event} as delivered for this filter. Call only for events classified as new
     * by {@link #isNew} in a fetch that completed.
     *
     * @param now wall-clock time of recording, in ms since epoch
     * @throws IllegalArgumentException if the filter key is unknown
     */
    public void record(String filterKey, LedgerEvent event, long now) {
        state(filterKey).record(event.id().key(), event.timestampMs(), now);
    }

    /**
     * Evicts, for every filter, ids recorded before {@code now - memoryWindowMs}, then the
     * oldest-recorded ids beyond {@code maxStored}. An id recorded exactly at the cutoff is kept.
     *
     * @param now            current wall-clock time in ms since epoch
     * @param memoryWindowMs how long an id is remembered
     * @param maxStored      maximum ids kept per filter
     * @return total number of ids removed
     */
    public int evict(long now, long memoryWindowMs, int maxStored) {
        if (memoryWindowMs < 0L) {
            throw new IllegalArgumentException("memoryWindowMs must be >= 0");
        }
        if (maxStored < 0) {
            throw new IllegalArgumentException("maxStored must be >= 0");
        }
        long cutoff = now - memoryWindowMs;
        int evicted = 0;
        for (CursorState state : states.values()) {
            evicted += state.evict(cutoff, maxStored);
        }
        return evicted;
    }

    /** Returns the watermark of one filter. */
    public long watermark(String filterKey) {
        return state(filterKey).lastProcessedTime();
    }

    /** Returns whether an id is currently remembered for a filter. */
    public boolean isTracked(String filterKey, String idKey) {
        return state(filterKey).contains(idKey);
    }

    /** Returns the number of ids remembered for one filter. */
    public int trackedIdCount(String filterKey) {
        return state(filterKey).size();
    }

    /** Returns the number of ids remembered across all filters. */
    public long trackedIdCount() {
        long total = 0;
        for (CursorState state : states.values()) {
            total += state.size();
        }
        return total;
    }

    public Set<String> filterKeys() {
        return states.keySet();
    }

    private CursorState state(String filterKey) {
        CursorState state = states.get(filterKey);
        if (state == null) {
            throw new IllegalArgumentException("Unknown filter: " + filterKey);
        }
        return state;
    }
}
