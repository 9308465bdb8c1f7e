package io.fsdebounce;

import io.fsdebounce.nio.NioWatcherFactory;
import io.fsdebounce.spi.MetricsExporter;
import io.fsdebounce.spi.TimeSource;
import io.fsdebounce.spi.Watcher;
import io.fsdebounce.spi.WatcherFactory;
import io.fsdebounce.store.EventStore;
import io.fsdebounce.store.GuardedEventStore;
import io.fsdebounce.ticker.DebounceTicker;
import io.fsdebounce.util.DaemonThreadFactory;

import java.lang.ref.Cleaner;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Debounced filesystem watcher: owns a watcher backend, the debounce cache and the
 * ticker thread that drains it.
 *
 * <p>Raw changes reported by the backend are collapsed per path. The handler receives
 * {@link DebouncedEventKind#ANY} once a path has been quiet for the timeout, and
 * {@link DebouncedEventKind#ANY_CONTINUOUS} on every tick while a path that has been cached
 * for at least the timeout keeps changing. Backend errors are delivered as separate
 * {@link DebounceResult.Errors} batches and never stop the debouncer.
 *
 * <h2>Lifecycle</h2>
 * <p>A debouncer is running as soon as it is built. {@link #stop()} (and {@link #close()})
 * close the backend and wait for the ticker to finish; no handler call happens after they
 * return. {@link #stopNonBlocking()} returns at once, and at most one more dispatch may
 * follow. A debouncer that becomes unreachable without being stopped is stopped by a
 * {@link Cleaner} action that does not wait; callers that need a joined shutdown must
 * call {@link #stop()} themselves.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Debouncer debouncer = Debouncer.builder()
 *     .timeout(Duration.ofSeconds(2))
 *     .handler(result -> System.out.println(result))
 *     .build()) {
 *   debouncer.watcher().watch(Path.of("src"), RecursiveMode.RECURSIVE);
 *   // ...
 * }
 * }</pre>
 *
 * @see Debouncer.Builder
 * @see DebounceEventHandler
 */
public final class Debouncer implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(Debouncer.class.getName());

    private static final Cleaner CLEANER = Cleaner.create(new DaemonThreadFactory("fsdebounce-cleaner-"));

    private static final int DEFAULT_TICK_DIVISOR = 4;

    private final Watcher watcher;
    private final DebounceTicker ticker;
    private final Duration timeout;
    private final Duration tickRate;
    private final Cleaner.Cleanable cleanable;

    private Debouncer(Watcher watcher, DebounceTicker ticker, Duration timeout, Duration tickRate) {
        this.watcher = watcher;
        this.ticker = ticker;
        this.timeout = timeout;
        this.tickRate = tickRate;
        this.cleanable = CLEANER.register(this, new StopAction(ticker, watcher));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a debouncer on the default {@link java.nio.file.WatchService} backend.
     *
     * @param timeout  the quiet timeout
     * @param tickRate the tick interval, or {@code null} for a quarter of the timeout
     * @param handler  the consumer of debounced batches
     * @return a running debouncer
     * @throws DebounceConfigException if the timeout or tick rate is unusable
     * @throws WatchException          if the backend cannot be started
     */
    public static Debouncer create(Duration timeout, Duration tickRate, DebounceEventHandler handler)
            throws WatchException {
        return builder()
                .timeout(timeout)
                .tickRate(tickRate)
                .handler(handler)
                .build();
    }

    /**
     * Returns the backend handle, for adding and removing watched paths at runtime.
     *
     * @return the watcher backend
     */
    public Watcher watcher() {
        return watcher;
    }

    public Duration timeout() {
        return timeout;
    }

    public Duration tickRate() {
        return tickRate;
    }

    /**
     * Stops the debouncer and waits for the ticker thread to finish. May block for up to one
     * tick interval plus one handler call. When called from inside the handler it does not
     * wait.
     */
    public void stop() {
        cleanable.clean();
        try {
            ticker.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Stops the debouncer without waiting for the ticker thread. At most one more handler
     * call may still happen.
     *
     * @return a future that completes once the ticker thread has terminated
     */
    public CompletableFuture<Void> stopNonBlocking() {
        cleanable.clean();
        return ticker.terminated();
    }

    /**
     * Returns a future that completes once the ticker thread has terminated.
     *
     * @return the completion future
     */
    public CompletableFuture<Void> terminated() {
        return ticker.terminated();
    }

    public boolean isStopRequested() {
        return ticker.isStopRequested();
    }

    public boolean isStopped() {
        return ticker.isTerminated();
    }

    /**
     * Same as {@link #stop()}.
     */
    @Override
    public void close() {
        stop();
    }

    /**
     * Shared by explicit stops and the cleaner. Must not reference the {@link Debouncer}.
     */
    private static final class StopAction implements Runnable {
        private final DebounceTicker ticker;
        private final Watcher watcher;

        StopAction(DebounceTicker ticker, Watcher watcher) {
            this.ticker = ticker;
            this.watcher = watcher;
        }

        @Override
        public void run() {
            ticker.requestStop();
            try {
                watcher.close();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Failed to close watcher backend", e);
            }
        }
    }

    /**
     * Builder for {@link Debouncer}.
     */
    public static final class Builder {
        private Duration timeout;
        private Duration tickRate;
        private DebounceEventHandler handler;
        private WatcherFactory watcherFactory;
        private MetricsExporter metrics;
        private TimeSource timeSource;
        private final AtomicBoolean built = new AtomicBoolean(false);

        private Builder() {
        }

        /**
         * Sets the quiet timeout: how long a path must go without raw events before
         * {@link DebouncedEventKind#ANY} is emitted for it. Also the age after which a still
         * active path produces {@link DebouncedEventKind#ANY_CONTINUOUS}.
         *
         * <p><b>Required.</b> Must be &gt; 0.
         *
         * @param timeout the quiet timeout
         * @return this builder
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * Sets the interval between ticks.
         *
         * <p>Optional. Defaults to a quarter of the timeout. Must be &gt; 0 and not greater
         * than the timeout.
         *
         * @param tickRate the tick interval, or {@code null} to derive it
         * @return this builder
         */
        public Builder tickRate(Duration tickRate) {
            this.tickRate = tickRate;
            return this;
        }

        /**
         * Sets the consumer of debounced batches.
         *
         * <p><b>Required.</b>
         *
         * @param handler the handler
         * @return this builder
         */
        public Builder handler(DebounceEventHandler handler) {
            this.handler = handler;
            return this;
        }

        /**
         * Sets the watcher backend.
         *
         * <p>Optional. Defaults to {@link NioWatcherFactory}.
         *
         * @param watcherFactory the backend factory
         * @return this builder
         */
        public Builder watcherFactory(WatcherFactory watcherFactory) {
            this.watcherFactory = watcherFactory;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the monotonic clock used by the debounce cache.
         *
         * <p>Optional. Defaults to {@link TimeSource#SYSTEM}.
         *
         * @param timeSource the time source
         * @return this builder
         */
        public Builder timeSource(TimeSource timeSource) {
            this.timeSource = timeSource;
            return this;
        }

        /**
         * Copies timeout and tick rate from an externalized config.
         *
         * @param config the config
         * @return this builder
         */
        public Builder config(DebouncerConfig config) {
            Objects.requireNonNull(config, "config");
            this.timeout = Duration.ofMillis(config.getTimeoutMs());
            this.tickRate = config.getTickRateMs() == null ? null : Duration.ofMillis(config.getTickRateMs());
            return this;
        }

        /**
         * Validates the settings, starts the backend and then the ticker.
         *
         * @return a running debouncer
         * @throws NullPointerException    if {@code timeout} or {@code handler} is null
         * @throws DebounceConfigException if the timeout is not positive or too large, the tick
         *                                 rate is not positive or exceeds the timeout, or the
         *                                 derived tick rate rounds to zero
         * @throws WatchException          if the backend cannot be started; no thread is left running
         * @throws IllegalStateException   if build() was already called
         */
        public Debouncer build() throws WatchException {
            if (!built.compareAndSet(false, true)) {
                throw new IllegalStateException("build() already called on this builder");
            }
            Objects.requireNonNull(timeout, "timeout");
            Objects.requireNonNull(handler, "handler");
            Duration tick = resolveTickRate(timeout, tickRate);

            TimeSource clock = timeSource != null ? timeSource : TimeSource.SYSTEM;
            MetricsExporter exporter = metrics != null ? metrics : MetricsExporter.NOOP;
            WatcherFactory factory = watcherFactory != null ? watcherFactory : new NioWatcherFactory();

            GuardedEventStore store = new GuardedEventStore(new EventStore(timeout, clock), exporter);
            Watcher watcher = Objects.requireNonNull(factory.create(store), "watcherFactory returned null");
            DebounceTicker ticker = new DebounceTicker(store, handler, tick, exporter);
            try {
                ticker.start();
            } catch (RuntimeException e) {
                watcher.close();
                throw e;
            }
            logger.log(Level.FINE, "Debouncer started with timeout {0}, tick rate {1}",
                    new Object[]{timeout, tick});
            return new Debouncer(watcher, ticker, timeout, tick);
        }

        static Duration resolveTickRate(Duration timeout, Duration tickRate) {
            if (timeout.isNegative() || timeout.isZero()) {
                throw new DebounceConfigException("Invalid timeout " + timeout + ", must be > 0");
            }
            try {
                timeout.toNanos();
            } catch (ArithmeticException e) {
                throw new DebounceConfigException("Invalid timeout " + timeout + ", too large", e);
            }
            if (tickRate != null) {
                if (tickRate.isNegative() || tickRate.isZero()) {
                    throw new DebounceConfigException("Invalid tick rate " + tickRate + ", must be > 0");
                }
                if (tickRate.compareTo(timeout) > 0) {
                    throw new DebounceConfigException(
                            "Invalid tick rate, tick rate " + tickRate + " > " + timeout + " timeout!");
                }
                return tickRate;
            }
            Duration derived = timeout.dividedBy(DEFAULT_TICK_DIVISOR);
            if (derived.isZero()) {
                throw new DebounceConfigException(
                        "Failed to calculate tick as " + timeout + "/" + DEFAULT_TICK_DIVISOR + "!");
            }
            return derived;
        }
    }
}
