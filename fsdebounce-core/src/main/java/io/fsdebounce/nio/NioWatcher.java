package io.fsdebounce.nio;

import io.fsdebounce.WatchException;
import io.fsdebounce.spi.RawEvent;
import io.fsdebounce.spi.RawEventCallback;
import io.fsdebounce.spi.RecursiveMode;
import io.fsdebounce.spi.Watcher;
import io.fsdebounce.util.DaemonThreadFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * {@link Watcher} on a JDK {@link WatchService}, polled by one daemon thread.
 *
 * <p>Directories are registered directly; a recursive watch registers the whole tree and
 * every directory created inside it later. A watched file is observed through its parent
 * directory and only changes to the file itself are reported. Each changed path is reported
 * as its own {@link RawEvent}. Entries already present in a directory by the time it is
 * registered are reported too, since the watch service never saw them being created.
 * Lost events ({@code OVERFLOW}) and failures to register new directories are reported
 * through {@link RawEventCallback#onError}.
 */
public final class NioWatcher implements Watcher {
    private static final Logger logger = Logger.getLogger(NioWatcher.class.getName());

    private final RawEventCallback callback;
    private final WatchService watchService;
    private final Map<Path, Root> roots = new ConcurrentHashMap<>();
    private final Map<WatchKey, Path> keys = new ConcurrentHashMap<>();
    private final ExecutorService loop;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile Thread loopThread;

    NioWatcher(FileSystem fileSystem, RawEventCallback callback) throws WatchException {
        this.callback = Objects.requireNonNull(callback, "callback");
        try {
            this.watchService = fileSystem.newWatchService();
        } catch (IOException | UnsupportedOperationException e) {
            throw new WatchException(WatchException.Kind.IO, "Failed to open watch service", e);
        }
        this.loop = Executors.newSingleThreadExecutor(new DaemonThreadFactory("fsdebounce-nio-"));
        loop.submit(this::runLoop);
    }

    @Override
    public synchronized void watch(Path path, RecursiveMode mode) throws WatchException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(mode, "mode");
        if (closed.get()) {
            throw new IllegalStateException("NioWatcher has been closed");
        }
        Path target = path.toAbsolutePath().normalize();
        if (!Files.exists(target)) {
            throw new WatchException(WatchException.Kind.PATH_NOT_FOUND, "Path not found: " + target, target);
        }
        boolean directory = Files.isDirectory(target);
        if (!directory) {
            registerDirectory(target.getParent());
        } else if (mode == RecursiveMode.RECURSIVE) {
            registerTree(target, null);
        } else {
            registerDirectory(target);
        }
        roots.put(target, new Root(mode, directory));
    }

    @Override
    public synchronized void unwatch(Path path) throws WatchException {
        Objects.requireNonNull(path, "path");
        Path target = path.toAbsolutePath().normalize();
        if (roots.remove(target) == null) {
            throw new WatchException(WatchException.Kind.WATCH_NOT_FOUND, "Path is not watched: " + target, target);
        }
        keys.entrySet().removeIf(entry -> {
            if (isCovered(entry.getValue())) {
                return false;
            }
            entry.getKey().cancel();
            return true;
        });
    }

    /**
     * Returns the number of directories registered with the watch service.
     *
     * @return registered directory count
     */
    public int registeredDirectories() {
        return keys.size();
    }

    /**
     * Stops the polling thread and closes the watch service. Unless called from a callback,
     * waits for a callback already in progress to return.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            watchService.close();
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to close watch service", e);
        }
        loop.shutdownNow();
        if (Thread.currentThread() != loopThread) {
            awaitLoop();
        }
        roots.clear();
        keys.clear();
    }

    private void awaitLoop() {
        try {
            while (!loop.awaitTermination(1, TimeUnit.SECONDS)) {
                logger.fine("Waiting for watch service thread to finish its callback");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void runLoop() {
        loopThread = Thread.currentThread();
        while (!closed.get()) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            Path dir = keys.get(key);
            if (dir == null) {
                key.reset();
                continue;
            }
            for (WatchEvent<?> event : key.pollEvents()) {
                if (closed.get()) {
                    return;
                }
                try {
                    handle(dir, event);
                } catch (RuntimeException e) {
                    logger.log(Level.SEVERE, "Failed to report change under " + dir, e);
                }
            }
            if (!key.reset()) {
                keys.remove(key);
            }
        }
    }

    private void handle(Path dir, WatchEvent<?> event) {
        if (event.kind() == OVERFLOW) {
            callback.onError(new WatchException(WatchException.Kind.GENERIC,
                    "Watch service overflowed, changes under " + dir + " were lost", dir));
            return;
        }
        Path child = dir.resolve((Path) event.context());
        if (isReported(dir, child)) {
            callback.onEvent(RawEvent.of(child));
        }
        if (event.kind() == ENTRY_CREATE && isRecursive(dir) && Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
            List<Path> found = new ArrayList<>();
            try {
                registerTree(child, found);
            } catch (WatchException e) {
                if (e.kind() == WatchException.Kind.PATH_NOT_FOUND) {
                    logger.log(Level.FINE, "Directory vanished before it could be watched: {0}", e.paths());
                } else {
                    callback.onError(e);
                }
            }
            for (Path path : found) {
                callback.onEvent(RawEvent.of(path));
            }
        }
    }

    /**
     * Registers {@code root} and every directory below it. Each directory is registered before
     * it is listed, so an entry created concurrently is either listed or reported by the watch
     * service (possibly both).
     *
     * @param found collects every entry listed below {@code root}, or null to skip collecting
     */
    private void registerTree(Path root, List<Path> found) throws WatchException {
        registerDirectory(root);
        List<Path> children;
        try (Stream<Path> list = Files.list(root)) {
            children = list.collect(Collectors.toList());
        } catch (NoSuchFileException e) {
            throw new WatchException(WatchException.Kind.PATH_NOT_FOUND, "Directory vanished: " + root, root);
        } catch (IOException | UncheckedIOException e) {
            throw new WatchException(WatchException.Kind.IO, "Failed to list " + root, e, List.of(root));
        }
        for (Path child : children) {
            if (found != null) {
                found.add(child);
            }
            if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                registerTree(child, found);
            }
        }
    }

    private void registerDirectory(Path dir) throws WatchException {
        try {
            WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
            keys.put(key, dir);
        } catch (ClosedWatchServiceException e) {
            throw new IllegalStateException("NioWatcher has been closed", e);
        } catch (NoSuchFileException e) {
            throw new WatchException(WatchException.Kind.PATH_NOT_FOUND, "Directory vanished: " + dir, dir);
        } catch (IOException e) {
            String message = e.getMessage();
            WatchException.Kind kind = message != null && message.contains("inotify")
                    ? WatchException.Kind.MAX_FILES_WATCH : WatchException.Kind.IO;
            throw new WatchException(kind, "Failed to watch " + dir, e, List.of(dir));
        }
    }

    private boolean isRecursive(Path dir) {
        for (Map.Entry<Path, Root> entry : roots.entrySet()) {
            Root root = entry.getValue();
            if (root.directory() && root.mode() == RecursiveMode.RECURSIVE && dir.startsWith(entry.getKey())) {
                return true;
            }
        }
        return false;
    }

    private boolean isReported(Path dir, Path child) {
        for (Map.Entry<Path, Root> entry : roots.entrySet()) {
            Path rootPath = entry.getKey();
            Root root = entry.getValue();
            if (!root.directory()) {
                if (child.equals(rootPath)) {
                    return true;
                }
            } else if (dir.equals(rootPath)
                    || (root.mode() == RecursiveMode.RECURSIVE && dir.startsWith(rootPath))) {
                return true;
            }
        }
        return false;
    }

    private boolean isCovered(Path dir) {
        for (Map.Entry<Path, Root> entry : roots.entrySet()) {
            Path rootPath = entry.getKey();
            Root root = entry.getValue();
            if (!root.directory()) {
                if (dir.equals(rootPath.getParent())) {
                    return true;
                }
            } else if (dir.equals(rootPath)
                    || (root.mode() == RecursiveMode.RECURSIVE && dir.startsWith(rootPath))) {
                return true;
            }
        }
        return false;
    }

    private record Root(RecursiveMode mode, boolean directory) {
    }
}
