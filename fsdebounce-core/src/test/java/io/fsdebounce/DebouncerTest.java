package io.fsdebounce;

import io.fsdebounce.spi.RecursiveMode;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DebouncerTest {

    private static final Path A = Path.of("/a");

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsTickRateAboveTimeout() {
        StubWatcherFactory factory = new StubWatcherFactory();
        DebounceConfigException e = assertThrows(DebounceConfigException.class, () ->
                Debouncer.builder()
                        .timeout(Duration.ofMillis(100))
                        .tickRate(Duration.ofMillis(101))
                        .handler(result -> {
                        })
                        .watcherFactory(factory)
                        .build());
        assertTrue(e.getMessage().contains("tick rate"));
        assertEquals(0, factory.createCount.get());
    }

    @Test
    void builderAcceptsTickRateEqualToTimeout() throws Exception {
        try (Debouncer debouncer = Debouncer.builder()
                .timeout(Duration.ofMillis(100))
                .tickRate(Duration.ofMillis(100))
                .handler(result -> {
                })
                .watcherFactory(new StubWatcherFactory())
                .build()) {
            assertEquals(Duration.ofMillis(100), debouncer.tickRate());
        }
    }

    @Test
    void builderDerivesQuarterTickRate() throws Exception {
        try (Debouncer debouncer = Debouncer.builder()
                .timeout(Duration.ofMillis(200))
                .handler(result -> {
                })
                .watcherFactory(new StubWatcherFactory())
                .build()) {
            assertEquals(Duration.ofMillis(50), debouncer.tickRate());
            assertEquals(Duration.ofMillis(200), debouncer.timeout());
        }
    }

    @Test
    void builderRejectsTimeoutTooSmallToDivide() {
        DebounceConfigException e = assertThrows(DebounceConfigException.class, () ->
                Debouncer.builder()
                        .timeout(Duration.ofNanos(3))
                        .handler(result -> {
                        })
                        .watcherFactory(new StubWatcherFactory())
                        .build());
        assertTrue(e.getMessage().startsWith("Failed to calculate tick"));
    }

    @Test
    void builderRejectsZeroTimeout() {
        assertThrows(DebounceConfigException.class, () ->
                Debouncer.builder()
                        .timeout(Duration.ZERO)
                        .handler(result -> {
                        })
                        .watcherFactory(new StubWatcherFactory())
                        .build());
    }

    @Test
    void builderRejectsOverflowingTimeout() {
        assertThrows(DebounceConfigException.class, () ->
                Debouncer.builder()
                        .timeout(Duration.ofSeconds(Long.MAX_VALUE))
                        .handler(result -> {
                        })
                        .watcherFactory(new StubWatcherFactory())
                        .build());
    }

    @Test
    void builderRejectsNegativeTickRate() {
        assertThrows(DebounceConfigException.class, () ->
                Debouncer.builder()
                        .timeout(Duration.ofMillis(100))
                        .tickRate(Duration.ofMillis(-1))
                        .handler(result -> {
                        })
                        .watcherFactory(new StubWatcherFactory())
                        .build());
    }

    @Test
    void builderRejectsNullHandler() {
        assertThrows(NullPointerException.class, () ->
                Debouncer.builder()
                        .timeout(Duration.ofMillis(100))
                        .watcherFactory(new StubWatcherFactory())
                        .build());
    }

    @Test
    void builderRejectsNullTimeout() {
        assertThrows(NullPointerException.class, () ->
                Debouncer.builder()
                        .handler(result -> {
                        })
                        .watcherFactory(new StubWatcherFactory())
                        .build());
    }

    @Test
    void builderCannotBeReused() throws Exception {
        Debouncer.Builder builder = Debouncer.builder()
                .timeout(Duration.ofMillis(100))
                .handler(result -> {
                })
                .watcherFactory(new StubWatcherFactory());
        try (Debouncer ignored = builder.build()) {
            assertThrows(IllegalStateException.class, builder::build);
        }
    }

    @Test
    void backendFailurePropagatesFromBuild() {
        WatchException failure = new WatchException(WatchException.Kind.IO, "no watch service");
        WatchException thrown = assertThrows(WatchException.class, () ->
                Debouncer.builder()
                        .timeout(Duration.ofMillis(100))
                        .handler(result -> {
                        })
                        .watcherFactory(callback -> {
                            throw failure;
                        })
                        .build());
        assertSame(failure, thrown);
    }

    @Test
    void configSuppliesTimeoutAndTickRate() throws Exception {
        DebouncerConfig config = new DebouncerConfig().setTimeoutMs(400).setTickRateMs(20L);
        try (Debouncer debouncer = Debouncer.builder()
                .config(config)
                .handler(result -> {
                })
                .watcherFactory(new StubWatcherFactory())
                .build()) {
            assertEquals(Duration.ofMillis(400), debouncer.timeout());
            assertEquals(Duration.ofMillis(20), debouncer.tickRate());
        }
    }

    // ── Delivery ────────────────────────────────────────────────────

    @Test
    void singleEventIsDeliveredOnceAfterQuietTimeout() throws Exception {
        StubWatcherFactory factory = new StubWatcherFactory();
        BlockingQueue<DebounceResult> results = new LinkedBlockingQueue<>();
        List<Long> arrivals = new ArrayList<>();
        try (Debouncer debouncer = Debouncer.builder()
                .timeout(Duration.ofMillis(200))
                .handler(result -> {
                    synchronized (arrivals) {
                        arrivals.add(System.nanoTime());
                    }
                    results.add(result);
                })
                .watcherFactory(factory)
                .build()) {
            long start = System.nanoTime();
            factory.emit("/a");

            DebounceResult first = results.poll(5, TimeUnit.SECONDS);
            assertNotNull(first);
            DebounceResult.Events events = assertInstanceOf(DebounceResult.Events.class, first);
            assertEquals(List.of(DebouncedEvent.any(A)), events.events());
            long elapsedMs;
            synchronized (arrivals) {
                elapsedMs = TimeUnit.NANOSECONDS.toMillis(arrivals.get(0) - start);
            }
            assertTrue(elapsedMs >= 200, "delivered too early: " + elapsedMs + "ms");

            assertNull(results.poll(400, TimeUnit.MILLISECONDS));
            assertFalse(debouncer.isStopped());
        }
    }

    @Test
    void continuousWritesProduceRepeatedContinuousThenAny() throws Exception {
        StubWatcherFactory factory = new StubWatcherFactory();
        BlockingQueue<DebounceResult> results = new LinkedBlockingQueue<>();
        try (Debouncer debouncer = Debouncer.builder()
                .timeout(Duration.ofMillis(200))
                .handler(results::add)
                .watcherFactory(factory)
                .build()) {
            long end = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(600);
            while (System.nanoTime() < end) {
                factory.emit("/a");
                Thread.sleep(30);
            }

            List<DebouncedEvent> duringWrites = new ArrayList<>();
            DebounceResult next;
            while ((next = results.poll()) != null) {
                duringWrites.addAll(assertInstanceOf(DebounceResult.Events.class, next).events());
            }
            assertTrue(duringWrites.size() >= 2, "expected repeated continuous events: " + duringWrites);
            for (DebouncedEvent event : duringWrites) {
                assertEquals(DebouncedEvent.anyContinuous(A), event);
            }

            DebounceResult last = null;
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (System.nanoTime() < deadline) {
                DebounceResult polled = results.poll(100, TimeUnit.MILLISECONDS);
                if (polled == null) {
                    continue;
                }
                List<DebouncedEvent> events = assertInstanceOf(DebounceResult.Events.class, polled).events();
                if (events.contains(DebouncedEvent.any(A))) {
                    last = polled;
                    break;
                }
            }
            assertNotNull(last, "expected a final ANY once writes stopped");
            assertNull(results.poll(300, TimeUnit.MILLISECONDS));
        }
    }

    @Test
    void multiPathEventProducesIndependentEmissions() throws Exception {
        StubWatcherFactory factory = new StubWatcherFactory();
        BlockingQueue<DebounceResult> results = new LinkedBlockingQueue<>();
        try (Debouncer debouncer = Debouncer.builder()
                .timeout(Duration.ofMillis(100))
                .tickRate(Duration.ofMillis(10))
                .handler(results::add)
                .watcherFactory(factory)
                .build()) {
            factory.emit("/a", "/b", "/c");

            DebounceResult result = results.poll(5, TimeUnit.SECONDS);
            DebounceResult.Events events = assertInstanceOf(DebounceResult.Events.class, result);
            assertEquals(Set.of(DebouncedEvent.any(A), DebouncedEvent.any(Path.of("/b")),
                    DebouncedEvent.any(Path.of("/c"))), Set.copyOf(events.events()));
        }
    }

    @Test
    void backendErrorsBetweenTicksArriveAsOneBatch() throws Exception {
        StubWatcherFactory factory = new StubWatcherFactory();
        BlockingQueue<DebounceResult> results = new LinkedBlockingQueue<>();
        CountDownLatch blockFirstTick = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        try (Debouncer debouncer = Debouncer.builder()
                .timeout(Duration.ofMillis(100))
                .tickRate(Duration.ofMillis(20))
                .handler(result -> {
                    if (calls.getAndIncrement() == 0) {
                        blockFirstTick.await(5, TimeUnit.SECONDS);
                    }
                    results.add(result);
                })
                .watcherFactory(factory)
                .build()) {
            factory.fail("warm-up");
            // wait until the warm-up batch is being handled, then inject while the ticker is busy
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (calls.get() == 0 && System.nanoTime() < deadline) {
                Thread.sleep(5);
            }
            for (int i = 0; i < 5; i++) {
                factory.fail("error-" + i);
            }
            blockFirstTick.countDown();

            DebounceResult warmUp = results.poll(5, TimeUnit.SECONDS);
            assertEquals(1, assertInstanceOf(DebounceResult.Errors.class, warmUp).errors().size());
            DebounceResult batch = results.poll(5, TimeUnit.SECONDS);
            DebounceResult.Errors errors = assertInstanceOf(DebounceResult.Errors.class, batch);
            assertEquals(5, errors.errors().size());
            for (int i = 0; i < 5; i++) {
                assertEquals("error-" + i, errors.errors().get(i).getMessage());
            }
            assertNull(results.poll(200, TimeUnit.MILLISECONDS));
            assertFalse(debouncer.isStopRequested());
        }
    }

    @Test
    void queueHandlerReceivesBatches() throws Exception {
        StubWatcherFactory factory = new StubWatcherFactory();
        BlockingQueue<DebounceResult> results = new LinkedBlockingQueue<>();
        try (Debouncer debouncer = Debouncer.builder()
                .timeout(Duration.ofMillis(50))
                .handler(DebounceEventHandler.forQueue(results))
                .watcherFactory(factory)
                .build()) {
            factory.emit("/a");
            assertTrue(results.poll(5, TimeUnit.SECONDS).isOk());
        }
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    @Test
    void watcherAccessorExposesBackend() throws Exception {
        StubWatcherFactory factory = new StubWatcherFactory();
        try (Debouncer debouncer = Debouncer.builder()
                .timeout(Duration.ofMillis(100))
                .handler(result -> {
                })
                .watcherFactory(factory)
                .build()) {
            debouncer.watcher().watch(Path.of("/src"), RecursiveMode.RECURSIVE);

            assertSame(factory.watcher, debouncer.watcher());
            assertEquals(RecursiveMode.RECURSIVE, factory.watcher.watched.get(Path.of("/src")));
        }
    }

    @Test
    void stopWaitsForTickerAndClosesWatcher() throws Exception {
        StubWatcherFactory factory = new StubWatcherFactory();
        AtomicInteger calls = new AtomicInteger();
        Debouncer debouncer = Debouncer.builder()
                .timeout(Duration.ofMillis(40))
                .tickRate(Duration.ofMillis(10))
                .handler(result -> calls.incrementAndGet())
                .watcherFactory(factory)
                .build();
        factory.emit("/a");

        debouncer.stop();

        assertTrue(debouncer.isStopped());
        assertTrue(debouncer.terminated().isDone());
        assertEquals(1, factory.watcher.closeCount.get());
        int afterStop = calls.get();
        factory.emit("/b");
        Thread.sleep(150);
        assertEquals(afterStop, calls.get());
    }

    @Test
    void stopWhileHandlerRunsWaitsForIt() throws Exception {
        StubWatcherFactory factory = new StubWatcherFactory();
        CountDownLatch inHandler = new CountDownLatch(1);
        AtomicInteger finished = new AtomicInteger();
        Debouncer debouncer = Debouncer.builder()
                .timeout(Duration.ofMillis(20))
                .tickRate(Duration.ofMillis(5))
                .handler(result -> {
                    inHandler.countDown();
                    Thread.sleep(200);
                    finished.incrementAndGet();
                })
                .watcherFactory(factory)
                .build();
        factory.emit("/a");
        assertTrue(inHandler.await(5, TimeUnit.SECONDS));

        debouncer.stop();

        assertEquals(1, finished.get());
    }

    @Test
    void stopNonBlockingReturnsCompletionFuture() throws Exception {
        StubWatcherFactory factory = new StubWatcherFactory();
        Debouncer debouncer = Debouncer.builder()
                .timeout(Duration.ofMillis(100))
                .handler(result -> {
                })
                .watcherFactory(factory)
                .build();

        CompletableFuture<Void> terminated = debouncer.stopNonBlocking();

        assertTrue(debouncer.isStopRequested());
        terminated.get(5, TimeUnit.SECONDS);
        assertTrue(debouncer.isStopped());
        assertEquals(1, factory.watcher.closeCount.get());
    }

    @Test
    void stopFromInsideHandlerDoesNotDeadlock() throws Exception {
        StubWatcherFactory factory = new StubWatcherFactory();
        CountDownLatch stopped = new CountDownLatch(1);
        Debouncer[] holder = new Debouncer[1];
        holder[0] = Debouncer.builder()
                .timeout(Duration.ofMillis(20))
                .tickRate(Duration.ofMillis(5))
                .handler(result -> {
                    holder[0].stop();
                    stopped.countDown();
                })
                .watcherFactory(factory)
                .build();
        factory.emit("/a");

        assertTrue(stopped.await(5, TimeUnit.SECONDS));
        holder[0].terminated().get(5, TimeUnit.SECONDS);
    }

    @Test
    void stopIsIdempotent() throws Exception {
        StubWatcherFactory factory = new StubWatcherFactory();
        Debouncer debouncer = Debouncer.builder()
                .timeout(Duration.ofMillis(100))
                .handler(result -> {
                })
                .watcherFactory(factory)
                .build();

        assertDoesNotThrow(() -> {
            debouncer.stop();
            debouncer.stopNonBlocking();
            debouncer.close();
        });
        assertEquals(1, factory.watcher.closeCount.get());
    }

    @Test
    void unreachableDebouncerIsStoppedByCleaner() throws Exception {
        StubWatcherFactory factory = new StubWatcherFactory();
        CompletableFuture<Void> terminated = startAndDrop(factory);

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (factory.watcher.closeCount.get() == 0 && System.nanoTime() < deadline) {
            System.gc();
            Thread.sleep(50);
        }

        assertEquals(1, factory.watcher.closeCount.get());
        terminated.get(5, TimeUnit.SECONDS);
    }

    // keeps the debouncer local so that only the returned future survives
    private static CompletableFuture<Void> startAndDrop(StubWatcherFactory factory) throws WatchException {
        Debouncer debouncer = Debouncer.builder()
                .timeout(Duration.ofMillis(100))
                .handler(result -> {
                })
                .watcherFactory(factory)
                .build();
        assertFalse(debouncer.isStopRequested());
        return debouncer.terminated();
    }
}
