package io.ledgerpoller;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LedgerEventTest {

    @Test
    void builderCreatesEventWithDefaults() {
        LedgerEvent event = LedgerEvent.builder("9xTx", "0")
                .timestampMs(1_700_000_000_000L)
                .build();

        assertEquals(new EventId("9xTx", "0"), event.id());
        assertEquals(1_700_000_000_000L, event.timestampMs());
        assertNull(event.eventType());
        assertNull(event.sender());
        assertNull(event.packageId());
        assertNull(event.transactionModule());
        assertEquals("{}", event.payloadJson());
    }

    @Test
    void builderAcceptsAllFields() {
        LedgerEvent event = LedgerEvent.builder(new EventId("9xTx", "3"))
                .timestampMs("1700000000123")
                .eventType("0x2::coin::CoinEvent")
                .sender("0xabc")
                .packageId("0x2")
                .transactionModule("coin")
                .payloadJson("{\"amount\":\"10\"}")
                .build();

        assertEquals(1_700_000_000_123L, event.timestampMs());
        assertEquals("0x2::coin::CoinEvent", event.eventType());
        assertEquals("0xabc", event.sender());
        assertEquals("0x2", event.packageId());
        assertEquals("coin", event.transactionModule());
        assertEquals("{\"amount\":\"10\"}", event.payloadJson());
    }

    @Test
    void timestampIsRequired() {
        assertThrows(IllegalArgumentException.class, () ->
                LedgerEvent.builder("9xTx", "0").build());
    }

    @Test
    void negativeTimestampIsRejected() {
        assertThrows(IllegalArgumentException.class, () ->
                LedgerEvent.builder("9xTx", "0").timestampMs(-1L).build());
    }

    @Test
    void malformedTimestampStringIsRejected() {
        assertThrows(IllegalArgumentException.class, () ->
                LedgerEvent.builder("9xTx", "0").timestampMs("12ab"));
    }

    @Test
    void equalityFollowsId() {
        LedgerEvent a = LedgerEvent.builder("9xTx", "0").timestampMs(1L).eventType("A").build();
        LedgerEvent b = LedgerEvent.builder("9xTx", "0").timestampMs(2L).eventType("B").build();
        LedgerEvent c = LedgerEvent.builder("9xTx", "1").timestampMs(1L).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    void eventIdKeyJoinsDigestAndSequence() {
        EventId id = new EventId("9xTx", "12");

        assertEquals("9xTx:12", id.key());
        assertEquals("9xTx:12", id.toString());
    }

    @Test
    void eventIdRejectsMissingParts() {
        assertThrows(NullPointerException.class, () -> new EventId(null, "0"));
        assertThrows(IllegalArgumentException.class, () -> new EventId("", "0"));
        assertThrows(IllegalArgumentException.class, () -> new EventId("9xTx", ""));
    }
}
