package io.ledgerpoller.poller;

import io.ledgerpoller.EventFilter;

import java.util.List;

/**
 * Point-in-time snapshot of an {@link EventPoller}.
 *
 * @param isPolling       whether the poller is running
 * @param filters         the filters as configured
 * @param intervalMs      fetch interval in milliseconds
 * @param startTime       initial watermark: construction time, or {@code 0} when starting from the beginning
 * @param trackedEventIds ids currently held for duplicate suppression, summed over all filters
 */
public record PollerStatus(boolean isPolling, List<EventFilter> filters, long intervalMs,
                           long startTime, long trackedEventIds) {

    public PollerStatus {
        filters = List.copyOf(filters);
    }

    /**
     * Returns the tracked id count in human-readable form, e.g. {@code "42 events tracked"}.
     */
    public String memoryUsage() {
        return trackedEventIds + " events tracked";
    }
}
