/**
 * The background loop that drains the debounce cache.
 *
 * <p>{@link io.fsdebounce.ticker.DebounceTicker} wakes once per tick interval, takes the
 * ready events and buffered errors from a {@link io.fsdebounce.store.GuardedEventStore},
 * and hands them to the {@link io.fsdebounce.DebounceEventHandler} outside the lock.
 *
 * @see io.fsdebounce.ticker.DebounceTicker
 */
package io.fsdebounce.ticker;
