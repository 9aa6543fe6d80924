package io.ledgerpoller.poller;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Receives failures raised while an {@link EventPoller} runs: per-filter query failures and
 * failures of the delivery callback. This is the only channel through which runtime errors
 * surface once the poller has started.
 */
@FunctionalInterface
public interface PollerErrorHandler {

    /**
     * Handler that logs each failure at {@link Level#SEVERE}. The JDK's default console
     * handler writes these records to standard error.
     */
    PollerErrorHandler LOGGING = new PollerErrorHandler() {
        private final Logger logger = Logger.getLogger(EventPoller.class.getName());

        @Override
        public void onError(Throwable error) {
            logger.log(Level.SEVERE, "EventPoller error", error);
        }
    };

    /**
     * Handles a failure.
     *
     * @param error the original cause
     */
    void onError(Throwable error);
}
