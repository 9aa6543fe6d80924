/**
 * Spring Boot auto-configuration for the ledger event poller.
 *
 * <p>{@link io.ledgerpoller.spring.boot.LedgerPollerAutoConfiguration} wires an
 * {@link io.ledgerpoller.poller.EventPoller} from {@code ledger-poller.*} application
 * properties once the application provides an {@link io.ledgerpoller.spi.EventQueryClient}
 * bean. Batches go to every {@link io.ledgerpoller.poller.EventBatchListener} bean.
 *
 * @see io.ledgerpoller.spring.boot.LedgerPollerAutoConfiguration
 * @see io.ledgerpoller.spring.boot.LedgerPollerProperties
 * @see io.ledgerpoller.spring.boot.LedgerPollerMicrometerAutoConfiguration
 */
package io.ledgerpoller.spring.boot;
