package io.fsdebounce.spi;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * An unprocessed change notification from a watcher backend.
 *
 * <p>A single notification may name several paths (a rename names both ends, for
 * instance). The debouncer treats each path independently.
 *
 * @param paths the changed paths (never empty)
 */
public record RawEvent(List<Path> paths) {

    public RawEvent {
        Objects.requireNonNull(paths, "paths");
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("paths must not be empty");
        }
        paths = List.copyOf(paths);
    }

    public static RawEvent of(Path... paths) {
        return new RawEvent(List.of(paths));
    }

    public static RawEvent of(Collection<Path> paths) {
        return new RawEvent(List.copyOf(paths));
    }
}
