package io.fsdebounce.spi;

import io.fsdebounce.WatchException;

/**
 * Creates watcher backends wired to a callback.
 *
 * <p>This is the only contract the debouncer needs from a backend; any implementation
 * able to construct itself around a {@link RawEventCallback} can be plugged in.
 */
@FunctionalInterface
public interface WatcherFactory {

    /**
     * Creates a backend that reports every raw change and failure to {@code callback}.
     *
     * @param callback the receiver of raw output
     * @return the running backend
     * @throws WatchException if the backend cannot be started
     */
    Watcher create(RawEventCallback callback) throws WatchException;
}
