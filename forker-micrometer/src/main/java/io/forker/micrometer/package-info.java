/**
 * Micrometer bridge for exporting dispatcher metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.forker.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.forker.spi.MetricsExporter} SPI using Micrometer counters, gauges and a
 * distribution summary.
 *
 * @see io.forker.micrometer.MicrometerMetricsExporter
 */
package io.forker.micrometer;
