/**
 * Service provider interfaces for plugging observability into the dispatcher.
 *
 * @see io.forker.spi.MetricsExporter
 */
package io.forker.spi;
