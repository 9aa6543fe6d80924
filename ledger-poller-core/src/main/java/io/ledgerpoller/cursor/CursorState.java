package io.ledgerpoller.cursor;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cursor of a single filter: the event-time watermark and the ids seen recently, each with
 * the wall-clock time it was first recorded.
 *
 * <p>All access goes through this object's monitor.
 */
final class CursorState {
    private long lastProcessedTime;
    private final Map<String, Long> seenIds = new LinkedHashMap<>();

    CursorState(long initialWatermark) {
        this.lastProcessedTime = initialWatermark;
    }

    synchronized boolean isNew(String idKey, long eventTime) {
        return eventTime > lastProcessedTime && !seenIds.containsKey(idKey);
    }

    synchronized void record(String idKey, long eventTime, long now) {
        seenIds.put(idKey, now);
        if (eventTime > lastProcessedTime) {
            lastProcessedTime = eventTime;
        }
    }

    /**
     * Drops ids recorded strictly before {@code cutoff}, then the oldest-recorded ids until at
     * most {@code maxStored} remain. Ids recorded at the same instant go in insertion order.
     *
     * @return number of ids removed
     */
    synchronized int evict(long cutoff, int maxStored) {
        int before = seenIds.size();
        if (before == 0) {
            return 0;
        }
        seenIds.values().removeIf(recordedAt -> recordedAt < cutoff);

        int excess = seenIds.size() - maxStored;
        if (excess > 0) {
            List<Map.Entry<String, Long>> byAge = new ArrayList<>(seenIds.entrySet());
            byAge.sort(Map.Entry.comparingByValue());
            Iterator<Map.Entry<String, Long>> oldest = byAge.iterator();
            for (int i = 0; i < excess; i++) {
                seenIds.remove(oldest.next().getKey());
            }
        }
        return before - seenIds.size();
    }

    synchronized long lastProcessedTime() {
        return lastProcessedTime;
    }

    synchronized int size() {
        return seenIds.size();
    }

    synchronized boolean contains(String idKey) {
        return seenIds.containsKey(idKey);
    }
}
