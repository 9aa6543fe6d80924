package io.ledgerpoller.poller;

import io.ledgerpoller.LedgerEvent;

import java.util.List;

/**
 * Receives each batch of newly observed events from an {@link EventPoller}.
 *
 * <p>Called at most once per fetch cycle, from a poller thread, with a non-empty list
 * ordered by ascending event time. Anything thrown is routed to the poller's
 * {@link PollerErrorHandler}; the events are still considered delivered.
 */
@FunctionalInterface
public interface EventBatchListener {

    /**
     * Listener that ignores every batch.
     */
    EventBatchListener NOOP = events -> {
    };

    /**
     * Handles a batch of new events.
     *
     * @param events unmodifiable, non-empty, ordered by {@link LedgerEvent#timestampMs()}
     */
    void onNewEvents(List<LedgerEvent> events);
}
