package io.fsdebounce;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.logging.Logger;

/**
 * {@link DebounceEventHandler} that offers every batch to a {@link BlockingQueue}.
 *
 * <p>Never blocks the ticker: a full queue drops the batch and logs a warning.
 *
 * @see DebounceEventHandler#forQueue(BlockingQueue)
 */
public final class QueueEventHandler implements DebounceEventHandler {
    private static final Logger logger = Logger.getLogger(QueueEventHandler.class.getName());

    private final BlockingQueue<? super DebounceResult> queue;

    public QueueEventHandler(BlockingQueue<? super DebounceResult> queue) {
        this.queue = Objects.requireNonNull(queue, "queue");
    }

    @Override
    public void handleEvent(DebounceResult result) {
        if (!queue.offer(result)) {
            logger.warning("Receiving queue is full, dropped debounced batch: " + result);
        }
    }
}
