/**
 * Service Provider Interfaces (SPI) for plugging backends and observability into the debouncer.
 *
 * <p>A backend implements {@link io.fsdebounce.spi.WatcherFactory} and
 * {@link io.fsdebounce.spi.Watcher}, and reports raw changes through the
 * {@link io.fsdebounce.spi.RawEventCallback} it is handed at construction.
 *
 * @see io.fsdebounce.spi.WatcherFactory
 * @see io.fsdebounce.spi.Watcher
 * @see io.fsdebounce.spi.RawEventCallback
 * @see io.fsdebounce.spi.MetricsExporter
 * @see io.fsdebounce.spi.TimeSource
 */
package io.fsdebounce.spi;
