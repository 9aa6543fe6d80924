package io.ledgerpoller.spi;

/**
 * Unchecked exception for transport or protocol failures raised by an {@link EventQueryClient}.
 */
public final class EventQueryException extends RuntimeException {
    public EventQueryException(String message) {
        super(message);
    }

    public EventQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
