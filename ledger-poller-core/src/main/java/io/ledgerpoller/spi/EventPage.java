package io.ledgerpoller.spi;

import io.ledgerpoller.LedgerEvent;

import java.util.List;

/**
 * One page of query results as returned by an {@link EventQueryClient}.
 *
 * @param data        events in the order requested from the ledger
 * @param nextCursor  opaque cursor for the following page, or {@code null}
 * @param hasNextPage whether the ledger reported further results
 */
public record EventPage(List<LedgerEvent> data, String nextCursor, boolean hasNextPage) {

    public EventPage {
        data = data == null ? List.of() : List.copyOf(data);
    }

    /**
     * Creates a final page holding the given events.
     *
     * @param data the events
     * @return a page with no continuation cursor
     */
    public static EventPage of(List<LedgerEvent> data) {
        return new EventPage(data, null, false);
    }

    public static EventPage empty() {
        return new EventPage(List.of(), null, false);
    }
}
