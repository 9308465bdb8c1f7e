/**
 * Default watcher backend on {@link java.nio.file.WatchService}.
 *
 * <p>Used by {@link io.fsdebounce.Debouncer} when no other
 * {@link io.fsdebounce.spi.WatcherFactory} is configured.
 *
 * @see io.fsdebounce.nio.NioWatcher
 * @see io.fsdebounce.nio.NioWatcherFactory
 */
package io.fsdebounce.nio;
