/**
 * Micrometer bridge for exporting debouncer metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.fsdebounce.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.fsdebounce.spi.MetricsExporter} SPI using Micrometer counters and a gauge.
 *
 * @see io.fsdebounce.micrometer.MicrometerMetricsExporter
 */
package io.fsdebounce.micrometer;
