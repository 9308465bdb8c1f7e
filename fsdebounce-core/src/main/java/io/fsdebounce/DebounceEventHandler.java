package io.fsdebounce;

import java.util.concurrent.BlockingQueue;

/**
 * Consumer of debounced batches.
 *
 * <h2>Execution Model</h2>
 * <p>Handlers run <b>synchronously</b> on the debouncer's ticker thread, outside the
 * lock that guards the debounce cache. A slow handler delays the next tick but never
 * blocks the watcher backend.
 *
 * <h2>Error Handling</h2>
 * <p>An exception thrown by the handler is logged and the ticker carries on with the
 * next tick. The failed batch is not redelivered.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * DebounceEventHandler handler = result -> {
 *   if (result instanceof DebounceResult.Events batch) {
 *     batch.events().forEach(e -> rebuild(e.path()));
 *   } else if (result instanceof DebounceResult.Errors batch) {
 *     batch.errors().forEach(err -> log.warn("watch failed", err));
 *   }
 * };
 * }</pre>
 */
@FunctionalInterface
public interface DebounceEventHandler {

    /**
     * Handles one batch.
     *
     * @param result an events batch or an errors batch
     * @throws Exception if handling fails; logged by the ticker
     */
    void handleEvent(DebounceResult result) throws Exception;

    /**
     * Returns a handler that hands every batch to {@code queue}, so that another thread
     * can consume the debounced stream. Batches that do not fit are dropped with a warning.
     *
     * @param queue the receiving queue
     * @return a queue-backed handler
     * @throws NullPointerException if {@code queue} is null
     */
    static DebounceEventHandler forQueue(BlockingQueue<? super DebounceResult> queue) {
        return new QueueEventHandler(queue);
    }
}
