package io.ledgerpoller.micrometer;

import io.ledgerpoller.EventFilter;
import io.ledgerpoller.LedgerEvent;
import io.ledgerpoller.poller.EventPoller;
import io.ledgerpoller.spi.EventPage;
import io.ledgerpoller.spi.EventQueryException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsExporter exporter;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        exporter = new MicrometerMetricsExporter(registry);
    }

    @Test
    void incrementPollCycles() {
        exporter.incrementPollCycles();
        exporter.incrementPollCycles();
        assertEquals(2.0, counter("ledgerpoller.poll.cycles").count());
    }

    @Test
    void incrementQueryFailures() {
        exporter.incrementQueryFailures();
        assertEquals(1.0, counter("ledgerpoller.query.failures").count());
    }

    @Test
    void incrementEventsDeliveredAddsBatchSize() {
        exporter.incrementEventsDelivered(3);
        exporter.incrementEventsDelivered(4);
        assertEquals(7.0, counter("ledgerpoller.events.delivered").count());
    }

    @Test
    void incrementBatchesAndCallbackFailures() {
        exporter.incrementBatchesDelivered();
        exporter.incrementCallbackFailures();
        assertEquals(1.0, counter("ledgerpoller.batches.delivered").count());
        assertEquals(1.0, counter("ledgerpoller.callback.failures").count());
    }

    @Test
    void incrementEvicted() {
        exporter.incrementEvicted(25);
        assertEquals(25.0, counter("ledgerpoller.ids.evicted").count());
    }

    @Test
    void recordTrackedIds() {
        exporter.recordTrackedIds(420L);
        assertEquals(420.0, gauge("ledgerpoller.ids.tracked").value());

        exporter.recordTrackedIds(0L);
        assertEquals(0.0, gauge("ledgerpoller.ids.tracked").value());
    }

    @Test
    void customNamePrefix() {
        var custom = new MicrometerMetricsExporter(registry, "dex.ledgerpoller");
        custom.incrementPollCycles();
        custom.recordTrackedIds(9L);

        assertEquals(1.0, counter("dex.ledgerpoller.poll.cycles").count());
        assertEquals(9.0, gauge("dex.ledgerpoller.ids.tracked").value());
    }

    @Test
    void closeRemovesMetersAndIgnoresLaterUpdates() {
        exporter.close();

        assertNull(registry.find("ledgerpoller.poll.cycles").counter());
        assertNull(registry.find("ledgerpoller.ids.tracked").gauge());
        assertDoesNotThrow(() -> {
            exporter.incrementPollCycles();
            exporter.recordTrackedIds(5L);
        });
        assertTrue(registry.getMeters().isEmpty());
    }

    @Test
    void pollerFeedsExporter() {
        EventFilter coins = EventFilter.of("MoveEventType", "0x2::coin::CoinEvent");
        EventFilter swaps = EventFilter.of("MoveEventType", "0xdee::pool::SwapEvent");
        LedgerEvent first = LedgerEvent.builder("tx1", "0").timestampMs(100L).build();
        LedgerEvent second = LedgerEvent.builder("tx2", "0").timestampMs(200L).build();

        try (EventPoller poller = EventPoller.builder()
                .client((filter, cursor, limit, order) -> {
                    if (filter.equals(swaps)) {
                        throw new EventQueryException("node unavailable");
                    }
                    return EventPage.of(List.of(second, first));
                })
                .filters(coins, swaps)
                .startFromNow(false)
                .onError(error -> {
                })
                .metrics(exporter)
                .build()) {
            poller.pollOnce();
            poller.pollOnce();
        }

        assertEquals(2.0, counter("ledgerpoller.poll.cycles").count());
        assertEquals(2.0, counter("ledgerpoller.query.failures").count());
        assertEquals(2.0, counter("ledgerpoller.events.delivered").count());
        assertEquals(1.0, counter("ledgerpoller.batches.delivered").count());
        assertEquals(2.0, gauge("ledgerpoller.ids.tracked").value());
    }

    @Test
    void emptyPrefixThrows() {
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "ledger."));
    }

    @Test
    void nullRegistryThrows() {
        assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    }

    private Counter counter(String name) {
        Counter c = registry.find(name).counter();
        assertNotNull(c, "Counter not found: " + name);
        return c;
    }

    private Gauge gauge(String name) {
        Gauge g = registry.find(name).gauge();
        assertNotNull(g, "Gauge not found: " + name);
        return g;
    }
}
