package io.ledgerpoller;

import java.util.Objects;

/**
 * Ledger-assigned identity of an event: the digest of the transaction that emitted it plus
 * the event's sequence number within that transaction.
 *
 * @param txDigest transaction digest
 * @param eventSeq sequence number of the event inside the transaction
 */
public record EventId(String txDigest, String eventSeq) {

    public EventId {
        Objects.requireNonNull(txDigest, "txDigest");
        Objects.requireNonNull(eventSeq, "eventSeq");
        if (txDigest.isEmpty()) {
            throw new IllegalArgumentException("txDigest cannot be empty");
        }
        if (eventSeq.isEmpty()) {
            throw new IllegalArgumentException("eventSeq cannot be empty");
        }
    }

    /**
     * Returns the single-string form used for duplicate suppression: {@code txDigest:eventSeq}.
     *
     * @return the combined key
     */
    public String key() {
        return txDigest + ":" + eventSeq;
    }

    @Override
    public String toString() {
        return key();
    }
}
