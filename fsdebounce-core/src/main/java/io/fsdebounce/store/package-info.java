/**
 * The debounce cache.
 *
 * <p>{@link io.fsdebounce.store.EventStore} holds per-path timing state and buffered
 * backend errors and decides, on each tick, which paths are quiet and which are
 * continuously changing. {@link io.fsdebounce.store.GuardedEventStore} puts the single
 * shared lock around it for the watcher and ticker threads.
 *
 * @see io.fsdebounce.store.EventStore
 * @see io.fsdebounce.store.GuardedEventStore
 */
package io.fsdebounce.store;
