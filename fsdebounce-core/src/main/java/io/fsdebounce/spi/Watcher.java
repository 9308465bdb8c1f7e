package io.fsdebounce.spi;

import io.fsdebounce.WatchException;

import java.nio.file.Path;

/**
 * Handle to a running watcher backend, used to change the watched set at runtime.
 *
 * <p>Obtained from {@link io.fsdebounce.Debouncer#watcher()}. Closed by the debouncer
 * when it stops.
 */
public interface Watcher extends AutoCloseable {

    /**
     * Starts watching a file or directory.
     *
     * @param path the path to watch
     * @param mode whether sub-directories are included (ignored for files)
     * @throws WatchException if the path cannot be watched
     */
    void watch(Path path, RecursiveMode mode) throws WatchException;

    /**
     * Stops watching a path previously passed to {@link #watch}.
     *
     * @param path the path to stop watching
     * @throws WatchException with kind {@link WatchException.Kind#WATCH_NOT_FOUND}
     *                        if the path is not watched
     */
    void unwatch(Path path) throws WatchException;

    /**
     * Releases the backend's resources. No raw output is reported after this returns.
     */
    @Override
    void close();
}
