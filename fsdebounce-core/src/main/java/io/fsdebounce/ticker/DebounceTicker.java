package io.fsdebounce.ticker;

import io.fsdebounce.DebounceEventHandler;
import io.fsdebounce.DebounceResult;
import io.fsdebounce.DebouncedEventKind;
import io.fsdebounce.spi.MetricsExporter;
import io.fsdebounce.store.GuardedEventStore;
import io.fsdebounce.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single background loop that drains a {@link GuardedEventStore} once per tick interval
 * and dispatches to a {@link DebounceEventHandler}.
 *
 * <p>Each tick takes the ready events and buffered errors under the store's lock, releases
 * it, then calls the handler with the events batch (if any) and the errors batch (if any)
 * as two separate calls. Dispatch runs on the ticker's own daemon thread, so a slow handler
 * delays the next tick without affecting the watcher backend.
 *
 * <p>Ticks run with a fixed delay: the next wake is one interval after the previous tick
 * finished. Stopping is cooperative. {@link #requestStop()} sets the stop flag and shuts the
 * scheduler down; a tick already in progress completes, and no tick starts afterwards.
 *
 * <p>The {@link #start()} and {@link #requestStop()} methods are synchronized to prevent
 * concurrent lifecycle transitions.
 */
public final class DebounceTicker {
    private static final Logger logger = Logger.getLogger(DebounceTicker.class.getName());

    private final GuardedEventStore store;
    private final DebounceEventHandler handler;
    private final long tickNanos;
    private final MetricsExporter metrics;
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    private TickerExecutor scheduler;
    private volatile Thread tickerThread;

    /**
     * Creates a ticker. Call {@link #start()} to begin ticking.
     *
     * @param store    the shared debounce cache
     * @param handler  the consumer of debounced batches
     * @param tickRate the interval between ticks (must be positive)
     * @param metrics  the metrics exporter
     */
    public DebounceTicker(GuardedEventStore store, DebounceEventHandler handler,
            Duration tickRate, MetricsExporter metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(tickRate, "tickRate");
        if (tickRate.isNegative() || tickRate.isZero()) {
            throw new IllegalArgumentException("tickRate must be > 0");
        }
        this.tickNanos = tickRate.toNanos();
    }

    /**
     * Starts the ticking loop. Subsequent calls are no-ops if already started.
     *
     * @throws IllegalStateException if the ticker has been stopped
     */
    public synchronized void start() {
        if (stopRequested.get()) {
            throw new IllegalStateException("DebounceTicker has been stopped");
        }
        if (scheduler != null) {
            return;
        }
        scheduler = new TickerExecutor(new DaemonThreadFactory("fsdebounce-ticker-"), terminated);
        scheduler.scheduleWithFixedDelay(this::tick, tickNanos, tickNanos, TimeUnit.NANOSECONDS);
        logger.fine("Debounce ticker started");
    }

    /**
     * Executes a single tick. Called by the scheduler, but may also be invoked directly for testing.
     */
    public void tick() {
        if (stopRequested.get()) {
            return;
        }
        tickerThread = Thread.currentThread();
        try {
            GuardedEventStore.Drain drain = store.drain();
            metrics.recordPendingPaths(drain.pendingPaths());
            if (!drain.events().isEmpty()) {
                recordEmitted(drain);
                dispatch(DebounceResult.events(drain.events()));
            }
            if (!drain.errors().isEmpty()) {
                dispatch(DebounceResult.errors(drain.errors()));
            }
        } catch (Throwable t) {
            // an exception escaping a periodic task would cancel every later tick
            logger.log(Level.SEVERE, "Debounce tick failed", t);
        }
    }

    private void recordEmitted(GuardedEventStore.Drain drain) {
        int continuous = drain.count(DebouncedEventKind.ANY_CONTINUOUS);
        int quiet = drain.events().size() - continuous;
        for (int i = 0; i < quiet; i++) {
            metrics.incrementDebounced();
        }
        for (int i = 0; i < continuous; i++) {
            metrics.incrementContinuous();
        }
    }

    private void dispatch(DebounceResult result) {
        try {
            handler.handleEvent(result);
        } catch (Exception e) {
            metrics.incrementHandlerFailures();
            logger.log(Level.SEVERE, "Debounce handler failed on " + result, e);
        }
    }

    /**
     * Sets the stop flag and shuts the scheduler down without waiting. At most the tick
     * already in progress still dispatches. Idempotent.
     */
    public synchronized void requestStop() {
        if (!stopRequested.compareAndSet(false, true)) {
            return;
        }
        if (scheduler != null) {
            scheduler.shutdown();
        } else {
            terminated.complete(null);
        }
        logger.fine("Debounce ticker stop requested");
    }

    /**
     * Blocks until the ticker thread has finished its last tick. Returns immediately when
     * called from the ticker thread itself, which cannot wait for its own completion.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void awaitTermination() throws InterruptedException {
        TickerExecutor current;
        synchronized (this) {
            current = scheduler;
        }
        if (current == null || isTickerThread()) {
            return;
        }
        while (!current.awaitTermination(1, TimeUnit.SECONDS)) {
            logger.fine("Waiting for debounce ticker to finish its tick");
        }
    }

    /**
     * Returns a future that completes once the ticker thread has terminated.
     *
     * @return the completion future
     */
    public CompletableFuture<Void> terminated() {
        return terminated;
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public boolean isTerminated() {
        return terminated.isDone();
    }

    /**
     * Returns {@code true} when the caller is running on the ticker thread, e.g. inside a handler.
     *
     * @return whether the current thread is the ticker thread
     */
    public boolean isTickerThread() {
        return Thread.currentThread() == tickerThread;
    }

    private static final class TickerExecutor extends ScheduledThreadPoolExecutor {
        private final CompletableFuture<Void> terminated;

        TickerExecutor(ThreadFactory threadFactory, CompletableFuture<Void> terminated) {
            super(1, threadFactory);
            this.terminated = terminated;
            setRemoveOnCancelPolicy(true);
        }

        @Override
        protected void terminated() {
            super.terminated();
            terminated.complete(null);
        }
    }
}
