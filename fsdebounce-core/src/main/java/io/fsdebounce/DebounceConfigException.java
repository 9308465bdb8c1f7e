package io.fsdebounce;

/**
 * Thrown when a {@link Debouncer} is built with an unusable timeout or tick rate.
 *
 * <p>Raised synchronously by {@link Debouncer.Builder#build()} before any thread or
 * watcher is created.
 */
public final class DebounceConfigException extends IllegalArgumentException {
    public DebounceConfigException(String message) {
        super(message);
    }

    public DebounceConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
