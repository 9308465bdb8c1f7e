package io.fsdebounce.spi;

import io.fsdebounce.WatchException;

/**
 * Receiver of raw backend output.
 *
 * <p>Invoked from backend-controlled threads. Implementations must be thread-safe and
 * return quickly; the debouncer's own implementation only takes a short lock.
 */
public interface RawEventCallback {

    /**
     * Reports a raw change.
     *
     * @param event the change notification
     */
    void onEvent(RawEvent event);

    /**
     * Reports a backend failure.
     *
     * @param error the failure
     */
    void onError(WatchException error);
}
