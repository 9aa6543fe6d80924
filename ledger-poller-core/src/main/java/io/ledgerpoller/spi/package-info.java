/**
 * Service provider interfaces: the ledger query capability the poller consumes
 * ({@link io.ledgerpoller.spi.EventQueryClient}) and the metrics hook it reports to
 * ({@link io.ledgerpoller.spi.MetricsExporter}).
 */
package io.ledgerpoller.spi;
