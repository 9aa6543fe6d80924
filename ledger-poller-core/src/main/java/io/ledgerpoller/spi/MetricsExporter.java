package io.ledgerpoller.spi;

/**
 * Observability hook for exporting poller counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. The {@code ledger-poller-micrometer}
 * module bridges this interface onto Micrometer.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of fetch cycles started.
     */
    void incrementPollCycles();

    /**
     * Increments the count of per-filter queries that failed or timed out.
     */
    void incrementQueryFailures();

    /**
     * Adds to the count of events handed to the delivery callback.
     *
     * @param count number of events in the delivered batch
     */
    void incrementEventsDelivered(int count);

    /**
     * Increments the count of batches handed to the delivery callback.
     */
    default void incrementBatchesDelivered() {
    }

    /**
     * Increments the count of delivery callback invocations that threw.
     */
    default void incrementCallbackFailures() {
    }

    /**
     * Adds to the count of duplicate-suppression ids removed by eviction.
     *
     * @param count number of ids evicted in one cycle
     */
    default void incrementEvicted(int count) {
    }

    /**
     * Records the number of duplicate-suppression ids currently held across all filters.
     *
     * @param count tracked id count (always non-negative)
     */
    void recordTrackedIds(long count);

    /**
     * Default no-op implementation.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementPollCycles() {
        }

        @Override
        public void incrementQueryFailures() {
        }

        @Override
        public void incrementEventsDelivered(int count) {
        }

        @Override
        public void recordTrackedIds(long count) {
        }
    }
}
