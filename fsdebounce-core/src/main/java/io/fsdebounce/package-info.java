/**
 * Root API for fsdebounce: collapses noisy raw filesystem notifications into at most one
 * "changed" signal per path per quiet period, plus a repeating "still changing" signal for
 * paths under sustained modification.
 *
 * <h2>Core Design</h2>
 * <p>A watcher backend reports raw changes into a per-path cache behind one lock. A ticker
 * thread wakes every tick interval, takes the paths that have gone quiet
 * ({@link io.fsdebounce.DebouncedEventKind#ANY}) or that have been changing for at least the
 * timeout ({@link io.fsdebounce.DebouncedEventKind#ANY_CONTINUOUS}), releases the lock and
 * hands them to the {@link io.fsdebounce.DebounceEventHandler}. Backend errors are buffered
 * and delivered as a separate batch on the same tick.
 *
 * <p>The kind of filesystem operation (create, modify, delete) is deliberately not reported.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>fsdebounce-core</b> — debouncer, cache, ticker, SPI and the
 *       {@linkplain io.fsdebounce.nio WatchService backend} (zero external deps)</li>
 *   <li><b>fsdebounce-micrometer</b> — optional {@linkplain io.fsdebounce.micrometer Micrometer
 *       metrics bridge}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * BlockingQueue<DebounceResult> results = new LinkedBlockingQueue<>();
 *
 * try (Debouncer debouncer = Debouncer.create(Duration.ofMillis(200), null,
 *     DebounceEventHandler.forQueue(results))) {
 *   debouncer.watcher().watch(Path.of("src"), RecursiveMode.RECURSIVE);
 *
 *   DebounceResult next = results.take();
 *   if (next instanceof DebounceResult.Events batch) {
 *     batch.events().forEach(e -> System.out.println(e.path() + " " + e.kind()));
 *   }
 * }
 * }</pre>
 *
 * <h2>Custom Backend</h2>
 * <pre>{@code
 * Debouncer debouncer = Debouncer.builder()
 *     .timeout(Duration.ofSeconds(1))
 *     .tickRate(Duration.ofMillis(100))
 *     .watcherFactory(callback -> new MyWatcher(callback))
 *     .handler(result -> System.out.println(result))
 *     .build();
 * }</pre>
 *
 * @see io.fsdebounce.Debouncer
 * @see io.fsdebounce.DebounceEventHandler
 * @see io.fsdebounce.DebounceResult
 * @see io.fsdebounce.spi.WatcherFactory
 */
package io.fsdebounce;
