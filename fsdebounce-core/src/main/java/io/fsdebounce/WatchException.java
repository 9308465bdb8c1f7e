package io.fsdebounce;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Error raised by a watcher backend, or by the debouncer while recording backend output.
 *
 * <p>Errors reported asynchronously by a backend are buffered and delivered to the
 * {@link DebounceEventHandler} as a {@link DebounceResult.Errors} batch on the next tick.
 * Errors raised synchronously (creating a watcher, adding or removing a watch) are thrown
 * to the caller.
 */
public class WatchException extends Exception {

    /**
     * Category of a watch failure.
     */
    public enum Kind {
        /** Anything without a more specific kind, including lost events. */
        GENERIC,
        /** An I/O error from the underlying watch API. */
        IO,
        /** The path to watch does not exist. */
        PATH_NOT_FOUND,
        /** The path to unwatch was never watched. */
        WATCH_NOT_FOUND,
        /** The backend rejected its configuration. */
        INVALID_CONFIG,
        /** The OS limit on watches was reached. */
        MAX_FILES_WATCH
    }

    private final Kind kind;
    private final List<Path> paths;

    public WatchException(Kind kind, String message) {
        this(kind, message, null, List.of());
    }

    public WatchException(Kind kind, String message, Throwable cause) {
        this(kind, message, cause, List.of());
    }

    public WatchException(Kind kind, String message, Path path) {
        this(kind, message, null, List.of(path));
    }

    /**
     * Creates a new instance.
     *
     * @param kind    the failure category
     * @param message detail message
     * @param cause   the underlying cause, may be null
     * @param paths   the paths involved, may be empty
     * @throws NullPointerException if {@code kind} or {@code paths} is null
     */
    public WatchException(Kind kind, String message, Throwable cause, List<Path> paths) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.paths = List.copyOf(paths);
    }

    /**
     * Returns the failure category.
     *
     * @return the kind (never null)
     */
    public Kind kind() {
        return kind;
    }

    /**
     * Returns the paths involved in the failure.
     *
     * @return an immutable, possibly empty list
     */
    public List<Path> paths() {
        return paths;
    }

    @Override
    public String toString() {
        String base = getClass().getName() + "[" + kind + "]: " + getMessage();
        return paths.isEmpty() ? base : base + " about " + paths;
    }
}
