package io.fsdebounce;

/**
 * Kind of a {@link DebouncedEvent}.
 *
 * <p>The kind never describes the filesystem operation (create, modify, delete);
 * it only says whether the path went quiet or is still being modified.
 */
public enum DebouncedEventKind {

    /**
     * The path received no further raw events for at least the quiet timeout.
     * The path is dropped from the debounce cache when this is emitted.
     */
    ANY,

    /**
     * The path has been cached for at least one quiet timeout and is still receiving
     * raw events. Repeats on every tick until the path goes quiet.
     */
    ANY_CONTINUOUS
}
