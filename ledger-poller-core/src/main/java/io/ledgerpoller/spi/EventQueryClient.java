package io.ledgerpoller.spi;

import io.ledgerpoller.EventFilter;

/**
 * Read-only access to a ledger's event-query endpoint.
 *
 * <p>The poller calls {@link #queryEvents} once per filter per fetch cycle, from several
 * threads at once, so implementations must be thread-safe. Calls must be free of side
 * effects: the poller repeats them every cycle and expects overlapping results.
 *
 * <p>Failures are signalled by throwing; {@link EventQueryException} is provided for wrapping
 * transport errors.
 */
@FunctionalInterface
public interface EventQueryClient {

    /**
     * Queries events matching a filter.
     *
     * @param filter the filter to match
     * @param cursor continuation cursor from a previous page, or {@code null} for the first page
     * @param limit  maximum number of events to return
     * @param order  ordering by event time
     * @return the page of matching events, never {@code null}
     */
    EventPage queryEvents(EventFilter filter, String cursor, int limit, SortOrder order);
}
