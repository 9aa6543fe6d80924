package io.ledgerpoller.micrometer;

import io.ledgerpoller.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a gauge with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code ledgerpoller.poll.cycles}: fetch cycles started</li>
 *   <li>{@code ledgerpoller.query.failures}: per-filter queries that failed or timed out</li>
 *   <li>{@code ledgerpoller.events.delivered}: events handed to the listener</li>
 *   <li>{@code ledgerpoller.batches.delivered}: batches handed to the listener</li>
 *   <li>{@code ledgerpoller.callback.failures}: listener invocations that threw</li>
 *   <li>{@code ledgerpoller.ids.evicted}: duplicate-suppression ids removed by eviction</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code ledgerpoller.ids.tracked}: ids currently held across all filters</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter pollCycles;
    private final Counter queryFailures;
    private final Counter eventsDelivered;
    private final Counter batchesDelivered;
    private final Counter callbackFailures;
    private final Counter idsEvicted;
    private final Gauge trackedIdsGauge;

    private final AtomicLong trackedIds = new AtomicLong();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "ledgerpoller"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "ledgerpoller");
    }

    /**
     * Creates an exporter with a custom metric name prefix, for running several pollers
     * against one registry.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "dex.ledgerpoller"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.pollCycles = Counter.builder(namePrefix + ".poll.cycles")
                .description("Fetch cycles started")
                .register(registry);
        this.queryFailures = Counter.builder(namePrefix + ".query.failures")
                .description("Per-filter queries that failed or timed out")
                .register(registry);
        this.eventsDelivered = Counter.builder(namePrefix + ".events.delivered")
                .description("Events handed to the listener")
                .register(registry);
        this.batchesDelivered = Counter.builder(namePrefix + ".batches.delivered")
                .description("Batches handed to the listener")
                .register(registry);
        this.callbackFailures = Counter.builder(namePrefix + ".callback.failures")
                .description("Listener invocations that threw")
                .register(registry);
        this.idsEvicted = Counter.builder(namePrefix + ".ids.evicted")
                .description("Duplicate-suppression ids removed by eviction")
                .register(registry);

        this.trackedIdsGauge = Gauge.builder(namePrefix + ".ids.tracked", trackedIds, AtomicLong::get)
                .description("Duplicate-suppression ids held across all filters")
                .register(registry);
    }

    @Override
    public void incrementPollCycles() {
        if (closed) return;
        pollCycles.increment();
    }

    @Override
    public void incrementQueryFailures() {
        if (closed) return;
        queryFailures.increment();
    }

    @Override
    public void incrementEventsDelivered(int count) {
        if (closed) return;
        eventsDelivered.increment(count);
    }

    @Override
    public void incrementBatchesDelivered() {
        if (closed) return;
        batchesDelivered.increment();
    }

    @Override
    public void incrementCallbackFailures() {
        if (closed) return;
        callbackFailures.increment();
    }

    @Override
    public void incrementEvicted(int count) {
        if (closed) return;
        idsEvicted.increment(count);
    }

    @Override
    public void recordTrackedIds(long count) {
        if (closed) return;
        trackedIds.set(count);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this once the {@link io.ledgerpoller.poller.EventPoller} it feeds is closed,
     * so the tracked-ids gauge does not linger with a stale value.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(pollCycles, queryFailures, eventsDelivered,
                batchesDelivered, callbackFailures, idsEvicted, trackedIdsGauge)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
