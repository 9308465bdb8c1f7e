package io.fsdebounce.spi;

/**
 * Observability hook for exporting debouncer counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of raw events recorded from the backend.
     */
    void incrementRawEvents();

    /**
     * Increments the count of backend errors buffered for delivery.
     */
    void incrementBackendErrors();

    /**
     * Increments the count of {@code ANY} events emitted.
     */
    void incrementDebounced();

    /**
     * Increments the count of {@code ANY_CONTINUOUS} events emitted.
     */
    void incrementContinuous();

    /**
     * Increments the count of handler invocations that threw.
     */
    default void incrementHandlerFailures() {
    }

    /**
     * Records how many paths are waiting in the debounce cache after a tick.
     *
     * @param pendingPaths the number of cached paths
     */
    void recordPendingPaths(int pendingPaths);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementRawEvents() {
        }

        @Override
        public void incrementBackendErrors() {
        }

        @Override
        public void incrementDebounced() {
        }

        @Override
        public void incrementContinuous() {
        }

        @Override
        public void recordPendingPaths(int pendingPaths) {
        }
    }
}
