package io.ledgerpoller.spi;

/**
 * Ordering requested from the ledger when querying events.
 */
public enum SortOrder {
    /** Oldest events first. */
    ASCENDING,
    /** Most recent events first. */
    DESCENDING
}
