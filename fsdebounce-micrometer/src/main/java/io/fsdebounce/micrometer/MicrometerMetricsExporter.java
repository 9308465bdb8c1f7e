package io.fsdebounce.micrometer;

import io.fsdebounce.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code fsdebounce.events.raw} — raw events recorded from the backend</li>
 *   <li>{@code fsdebounce.errors.backend} — backend errors buffered for delivery</li>
 *   <li>{@code fsdebounce.emitted.any} — paths emitted after going quiet</li>
 *   <li>{@code fsdebounce.emitted.continuous} — continuous heartbeats emitted</li>
 *   <li>{@code fsdebounce.handler.failures} — handler calls that threw</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code fsdebounce.paths.pending} — paths waiting in the debounce cache after the last tick</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter rawEvents;
    private final Counter backendErrors;
    private final Counter debounced;
    private final Counter continuous;
    private final Counter handlerFailures;
    private final Gauge pendingGauge;

    private final AtomicInteger pendingPaths = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "fsdebounce"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "fsdebounce");
    }

    /**
     * Creates an exporter with a custom metric name prefix, for several debouncers in one registry.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "assets.debounce"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.rawEvents = Counter.builder(namePrefix + ".events.raw")
                .description("Raw events recorded from the watcher backend")
                .register(registry);
        this.backendErrors = Counter.builder(namePrefix + ".errors.backend")
                .description("Backend errors buffered for delivery")
                .register(registry);
        this.debounced = Counter.builder(namePrefix + ".emitted.any")
                .description("Paths emitted after going quiet")
                .register(registry);
        this.continuous = Counter.builder(namePrefix + ".emitted.continuous")
                .description("Continuous events emitted for paths still changing")
                .register(registry);
        this.handlerFailures = Counter.builder(namePrefix + ".handler.failures")
                .description("Handler invocations that threw")
                .register(registry);

        this.pendingGauge = Gauge.builder(namePrefix + ".paths.pending", pendingPaths, AtomicInteger::get)
                .description("Paths waiting in the debounce cache")
                .register(registry);
    }

    @Override
    public void incrementRawEvents() {
        if (closed) return;
        rawEvents.increment();
    }

    @Override
    public void incrementBackendErrors() {
        if (closed) return;
        backendErrors.increment();
    }

    @Override
    public void incrementDebounced() {
        if (closed) return;
        debounced.increment();
    }

    @Override
    public void incrementContinuous() {
        if (closed) return;
        continuous.increment();
    }

    @Override
    public void incrementHandlerFailures() {
        if (closed) return;
        handlerFailures.increment();
    }

    @Override
    public void recordPendingPaths(int pendingPaths) {
        if (closed) return;
        this.pendingPaths.set(pendingPaths);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this once the {@link io.fsdebounce.Debouncer} using the exporter is stopped,
     * to prevent stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(rawEvents, backendErrors, debounced, continuous,
                handlerFailures, pendingGauge)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
