package io.fsdebounce;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A debounced change signal for a single path.
 *
 * @param path the changed path, as reported by the watcher backend
 * @param kind whether the path went quiet or is still changing
 */
public record DebouncedEvent(Path path, DebouncedEventKind kind) {

    public DebouncedEvent {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
    }

    /**
     * Creates an {@link DebouncedEventKind#ANY} event.
     *
     * @param path the path that went quiet
     * @return the event
     */
    public static DebouncedEvent any(Path path) {
        return new DebouncedEvent(path, DebouncedEventKind.ANY);
    }

    /**
     * Creates an {@link DebouncedEventKind#ANY_CONTINUOUS} event.
     *
     * @param path the path that is still changing
     * @return the event
     */
    public static DebouncedEvent anyContinuous(Path path) {
        return new DebouncedEvent(path, DebouncedEventKind.ANY_CONTINUOUS);
    }
}
