package io.ledgerpoller;

import java.util.Objects;

/**
 * Immutable event observed on the ledger.
 *
 * <p>Only {@link #id()} and {@link #timestampMs()} take part in polling decisions; every other
 * field is carried through to listeners untouched. Two events are equal when their ids are
 * equal, since the ledger never emits two different events under one id.
 *
 * <p>Use {@link #builder(String, String)} or {@link #builder(EventId)} to create instances.
 *
 * @see EventId
 */
public final class LedgerEvent {
    private final EventId id;
    private final long timestampMs;
    private final String eventType;
    private final String sender;
    private final String packageId;
    private final String transactionModule;
    private final String payloadJson;

    private LedgerEvent(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        if (builder.timestampMs == null) {
            throw new IllegalArgumentException("timestampMs must be set");
        }
        if (builder.timestampMs < 0L) {
            throw new IllegalArgumentException("timestampMs must be >= 0");
        }
        this.timestampMs = builder.timestampMs;
        this.eventType = builder.eventType;
        this.sender = builder.sender;
        this.packageId = builder.packageId;
        this.transactionModule = builder.transactionModule;
        this.payloadJson = builder.payloadJson == null ? "{}" : builder.payloadJson;
    }

    public static Builder builder(EventId id) {
        return new Builder(Objects.requireNonNull(id, "id"));
    }

    public static Builder builder(String txDigest, String eventSeq) {
        return new Builder(new EventId(txDigest, eventSeq));
    }

    public EventId id() {
        return id;
    }

    /** Event time in milliseconds since the epoch, as reported by the ledger. */
    public long timestampMs() {
        return timestampMs;
    }

    public String eventType() {
        return eventType;
    }

    public String sender() {
        return sender;
    }

    public String packageId() {
        return packageId;
    }

    public String transactionModule() {
        return transactionModule;
    }

    /** Event payload as JSON, {@code "{}"} when the ledger supplied none. */
    public String payloadJson() {
        return payloadJson;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LedgerEvent other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "LedgerEvent{id=" + id
                + ", timestampMs=" + timestampMs
                + ", eventType=" + eventType + '}';
    }

    /**
     * Builder for {@link LedgerEvent}.
     */
    public static final class Builder {
        private final EventId id;
        private Long timestampMs;
        private String eventType;
        private String sender;
        private String packageId;
        private String transactionModule;
        private String payloadJson;

        private Builder(EventId id) {
            this.id = id;
        }

        /**
         * Sets the event time.
         *
         * <p><b>Required.</b> Must be &ge; 0.
         *
         * @param timestampMs milliseconds since the epoch
         * @return this builder
         */
        public Builder timestampMs(long timestampMs) {
            this.timestampMs = timestampMs;
            return this;
        }

        /**
         * Sets the event time from its decimal string form, as most ledger RPC
         * responses encode 64-bit numbers.
         *
         * @param timestampMs milliseconds since the epoch as a decimal string
         * @return this builder
         * @throws IllegalArgumentException if the value is not a decimal integer
         */
        public Builder timestampMs(String timestampMs) {
            Objects.requireNonNull(timestampMs, "timestampMs");
            try {
                this.timestampMs = Long.parseLong(timestampMs.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("timestampMs is not a decimal integer: " + timestampMs, e);
            }
            return this;
        }

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder sender(String sender) {
            this.sender = sender;
            return this;
        }

        public Builder packageId(String packageId) {
            this.packageId = packageId;
            return this;
        }

        public Builder transactionModule(String transactionModule) {
            this.transactionModule = transactionModule;
            return this;
        }

        public Builder payloadJson(String payloadJson) {
            this.payloadJson = payloadJson;
            return this;
        }

        /**
         * Builds the event.
         *
         * @return a new {@link LedgerEvent}
         * @throws IllegalArgumentException if the timestamp is missing or negative
         */
        public LedgerEvent build() {
            return new LedgerEvent(this);
        }
    }
}
