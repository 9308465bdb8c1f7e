package io.fsdebounce;

import java.util.List;
import java.util.Objects;

/**
 * One batch delivered to a {@link DebounceEventHandler}.
 *
 * <ul>
 *   <li>{@link Events} — debounced events that became ready during one tick.</li>
 *   <li>{@link Errors} — backend errors buffered since the previous tick.</li>
 * </ul>
 *
 * <p>Both lists are non-empty and immutable. When a tick produces both kinds the
 * handler receives two separate calls, events first.
 *
 * @see DebounceEventHandler#handleEvent(DebounceResult)
 */
public sealed interface DebounceResult permits DebounceResult.Events, DebounceResult.Errors {

    /**
     * Creates an events batch.
     *
     * @param events the debounced events (must not be empty)
     * @return the batch
     * @throws NullPointerException     if {@code events} or an element is null
     * @throws IllegalArgumentException if {@code events} is empty
     */
    static Events events(List<DebouncedEvent> events) {
        return new Events(events);
    }

    /**
     * Creates an errors batch.
     *
     * @param errors the backend errors (must not be empty)
     * @return the batch
     * @throws NullPointerException     if {@code errors} or an element is null
     * @throws IllegalArgumentException if {@code errors} is empty
     */
    static Errors errors(List<WatchException> errors) {
        return new Errors(errors);
    }

    /**
     * Returns {@code true} for an {@link Events} batch.
     *
     * @return whether this batch carries events
     */
    boolean isOk();

    /**
     * Debounced events ready in one tick.
     *
     * @param events the events, in no particular cross-path order
     */
    record Events(List<DebouncedEvent> events) implements DebounceResult {
        public Events {
            Objects.requireNonNull(events, "events");
            if (events.isEmpty()) {
                throw new IllegalArgumentException("events must not be empty");
            }
            events = List.copyOf(events);
        }

        @Override
        public boolean isOk() {
            return true;
        }
    }

    /**
     * Backend errors reported since the previous tick, in arrival order.
     *
     * @param errors the errors
     */
    record Errors(List<WatchException> errors) implements DebounceResult {
        public Errors {
            Objects.requireNonNull(errors, "errors");
            if (errors.isEmpty()) {
                throw new IllegalArgumentException("errors must not be empty");
            }
            errors = List.copyOf(errors);
        }

        @Override
        public boolean isOk() {
            return false;
        }
    }
}
