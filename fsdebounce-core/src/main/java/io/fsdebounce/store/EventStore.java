package io.fsdebounce.store;

import io.fsdebounce.DebouncedEvent;
import io.fsdebounce.WatchException;
import io.fsdebounce.spi.RawEvent;
import io.fsdebounce.spi.TimeSource;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-path dedup cache plus the queue of backend errors awaiting delivery.
 *
 * <p>Each cached path carries two timestamps: when it entered the cache and when its
 * latest raw event arrived. On every {@link #debouncedEvents()} call a path is
 * <ul>
 *   <li>emitted as {@code ANY} and evicted once it has been quiet for the timeout;</li>
 *   <li>emitted as {@code ANY_CONTINUOUS} and kept while it is still active but has
 *       been cached for at least the timeout;</li>
 *   <li>kept silently otherwise.</li>
 * </ul>
 *
 * <p>The insert timestamp is never reset while the path stays cached, so a path under
 * sustained modification produces {@code ANY_CONTINUOUS} on every tick until it goes
 * quiet. Consumers should treat it as a heartbeat.
 *
 * <p>Not thread-safe. Shared access goes through {@link GuardedEventStore}.
 */
public final class EventStore {

    private final Map<Path, PathTimingState> pending = new HashMap<>();
    private final long timeoutNanos;
    private final Duration timeout;
    private final TimeSource timeSource;
    private List<WatchException> errors = new ArrayList<>();

    /**
     * Creates an empty store.
     *
     * @param timeout    the quiet timeout (must be positive and representable in nanoseconds)
     * @param timeSource the monotonic clock
     * @throws NullPointerException     if an argument is null
     * @throws IllegalArgumentException if {@code timeout} is not positive
     * @throws ArithmeticException      if {@code timeout} overflows a nanosecond count
     */
    public EventStore(Duration timeout, TimeSource timeSource) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        this.timeoutNanos = timeout.toNanos();
    }

    /**
     * Records a raw event: refreshes every named path already cached and caches the rest.
     *
     * @param event the raw event
     */
    public void addEvent(RawEvent event) {
        addEvent(event.paths());
    }

    /**
     * Records a change for each of {@code paths}.
     *
     * @param paths the changed paths
     * @throws NullPointerException if {@code paths} or one of its elements is null; paths
     *                              before the null one are still recorded
     */
    public void addEvent(Collection<Path> paths) {
        long now = timeSource.nanoTime();
        for (Path path : paths) {
            Objects.requireNonNull(path, "path");
            PathTimingState state = pending.get(path);
            if (state != null) {
                state.updateNanos = now;
            } else {
                pending.put(path, new PathTimingState(now));
            }
        }
    }

    /**
     * Buffers a backend error for delivery on the next drain.
     *
     * @param error the error
     */
    public void addError(WatchException error) {
        errors.add(Objects.requireNonNull(error, "error"));
    }

    /**
     * Evaluates every cached path once and returns the events that are ready.
     * Quiet paths are evicted; continuous and not-yet-ready paths stay cached.
     *
     * @return the ready events, in no particular order (possibly empty)
     */
    public List<DebouncedEvent> debouncedEvents() {
        long now = timeSource.nanoTime();
        List<DebouncedEvent> ready = new ArrayList<>();
        Iterator<Map.Entry<Path, PathTimingState>> it = pending.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Path, PathTimingState> entry = it.next();
            PathTimingState state = entry.getValue();
            if (now - state.updateNanos >= timeoutNanos) {
                ready.add(DebouncedEvent.any(entry.getKey()));
                it.remove();
            } else if (now - state.insertNanos >= timeoutNanos) {
                ready.add(DebouncedEvent.anyContinuous(entry.getKey()));
            }
        }
        return ready;
    }

    /**
     * Takes all buffered errors, leaving the queue empty.
     *
     * @return the errors in arrival order (possibly empty)
     */
    public List<WatchException> errors() {
        List<WatchException> taken = errors;
        errors = new ArrayList<>();
        return taken;
    }

    /**
     * Returns the number of cached paths.
     *
     * @return the number of paths awaiting emission or eviction
     */
    public int pendingPaths() {
        return pending.size();
    }

    public Duration timeout() {
        return timeout;
    }
}
