/**
 * Micrometer bridge for exporting poller metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.ledgerpoller.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.ledgerpoller.spi.MetricsExporter} SPI using Micrometer counters and a gauge.
 *
 * @see io.ledgerpoller.micrometer.MicrometerMetricsExporter
 */
package io.ledgerpoller.micrometer;
