package io.fsdebounce.spi;

/**
 * Monotonic time source for the debounce cache, in nanoseconds.
 *
 * <p>Only differences between readings are meaningful. The {@link #SYSTEM} instance
 * reads {@link System#nanoTime()}; tests substitute a manually advanced source.
 */
@FunctionalInterface
public interface TimeSource {

    TimeSource SYSTEM = System::nanoTime;

    long nanoTime();
}
