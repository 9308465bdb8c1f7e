package io.fsdebounce.nio;

import io.fsdebounce.WatchException;
import io.fsdebounce.spi.RawEventCallback;
import io.fsdebounce.spi.Watcher;
import io.fsdebounce.spi.WatcherFactory;

import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.util.Objects;

/**
 * {@link WatcherFactory} creating {@link NioWatcher} instances on a {@link FileSystem}
 * (the default file system unless specified).
 */
public final class NioWatcherFactory implements WatcherFactory {
    private final FileSystem fileSystem;

    public NioWatcherFactory() {
        this(FileSystems.getDefault());
    }

    public NioWatcherFactory(FileSystem fileSystem) {
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
    }

    @Override
    public Watcher create(RawEventCallback callback) throws WatchException {
        return new NioWatcher(fileSystem, callback);
    }
}
