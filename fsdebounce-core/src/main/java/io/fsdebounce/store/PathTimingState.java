package io.fsdebounce.store;

/**
 * Timing state of one cached path, as {@link io.fsdebounce.spi.TimeSource} readings.
 */
final class PathTimingState {
    /** When the path entered the cache since its last {@code ANY} emission. */
    final long insertNanos;
    /** When the latest raw event for the path arrived. */
    long updateNanos;

    PathTimingState(long nowNanos) {
        this.insertNanos = nowNanos;
        this.updateNanos = nowNanos;
    }
}
