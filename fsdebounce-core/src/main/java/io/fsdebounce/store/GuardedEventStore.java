package io.fsdebounce.store;

import io.fsdebounce.DebouncedEvent;
import io.fsdebounce.DebouncedEventKind;
import io.fsdebounce.WatchException;
import io.fsdebounce.spi.MetricsExporter;
import io.fsdebounce.spi.RawEvent;
import io.fsdebounce.spi.RawEventCallback;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EventStore} behind the single lock shared by the watcher backend and the ticker.
 *
 * <p>Implements {@link RawEventCallback} so it can be handed straight to a
 * {@link io.fsdebounce.spi.WatcherFactory}. Critical sections only touch the in-memory
 * cache; nothing is dispatched while the lock is held.
 *
 * <p>A failure inside a critical section does not wedge the store: it is wrapped in a
 * {@link WatchException} of kind {@link WatchException.Kind#GENERIC} and delivered
 * through the error batch like any backend error.
 */
public final class GuardedEventStore implements RawEventCallback {
    private static final Logger logger = Logger.getLogger(GuardedEventStore.class.getName());

    private final EventStore store;
    private final MetricsExporter metrics;
    private final ReentrantLock lock = new ReentrantLock();

    public GuardedEventStore(EventStore store, MetricsExporter metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public void onEvent(RawEvent event) {
        lock.lock();
        try {
            store.addEvent(event);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to record raw event " + event, e);
            store.addError(new WatchException(WatchException.Kind.GENERIC,
                    "Failed to record raw event", e, event.paths()));
        } finally {
            lock.unlock();
        }
        metrics.incrementRawEvents();
    }

    @Override
    public void onError(WatchException error) {
        lock.lock();
        try {
            store.addError(error);
        } finally {
            lock.unlock();
        }
        metrics.incrementBackendErrors();
    }

    /**
     * Takes the ready events and all buffered errors in one critical section.
     *
     * @return what the ticker should dispatch
     */
    public Drain drain() {
        List<DebouncedEvent> events;
        List<WatchException> errors;
        int pendingPaths;
        lock.lock();
        try {
            try {
                events = store.debouncedEvents();
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to evaluate debounce cache", e);
                events = List.of();
                store.addError(new WatchException(WatchException.Kind.GENERIC,
                        "Failed to evaluate debounce cache", e));
            }
            errors = store.errors();
            pendingPaths = store.pendingPaths();
        } finally {
            lock.unlock();
        }
        return new Drain(events, errors, pendingPaths);
    }

    /**
     * Result of one {@link #drain()}.
     *
     * @param events       ready debounced events
     * @param errors       buffered errors in arrival order
     * @param pendingPaths paths still cached after the drain
     */
    public record Drain(List<DebouncedEvent> events, List<WatchException> errors, int pendingPaths) {
        public Drain {
            events = List.copyOf(events);
            errors = List.copyOf(errors);
        }

        public int count(DebouncedEventKind kind) {
            int n = 0;
            for (DebouncedEvent event : events) {
                if (event.kind() == kind) {
                    n++;
                }
            }
            return n;
        }
    }
}
