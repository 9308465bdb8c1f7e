package io.fsdebounce.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the debouncer's background threads: the ticker, the NIO polling loop and the cleaner.
 *
 * <p>Threads are daemons named {@code <prefix>N}, so a debouncer that is never stopped does
 * not keep the JVM alive and its threads are easy to find in a thread dump. A failure that
 * escapes a thread's task goes to the log instead of {@code System.err}.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private static final Thread.UncaughtExceptionHandler LOG_UNCAUGHT = (thread, failure) ->
            logger.log(Level.SEVERE, "Uncaught failure on thread " + thread.getName(), failure);

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger();

    /**
     * @param prefix thread name prefix, e.g. {@code "fsdebounce-ticker-"}
     * @throws IllegalArgumentException if {@code prefix} is blank
     */
    public DaemonThreadFactory(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        if (prefix.isBlank()) {
            throw new IllegalArgumentException("prefix must not be blank");
        }
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread thread = new Thread(task, prefix + sequence.incrementAndGet());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(LOG_UNCAUGHT);
        return thread;
    }
}
