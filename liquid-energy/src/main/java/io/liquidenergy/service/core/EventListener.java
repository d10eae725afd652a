package io.liquidenergy.service.core;

import io.liquidenergy.domain.event.Event;
import io.liquidenergy.domain.event.EventKind;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Subscriber registered with an {@link EventEngine}.
 *
 * Handlers run on the engine's dispatch thread, one listener at a time.
 * An exception thrown from {@link #onEvent(Event)} is logged by the engine
 * and does not affect other listeners.
 */
public interface EventListener {

    /**
     * Name used in diagnostics. Not required to be unique.
     */
    String getName();

    /**
     * Event kinds this listener wants to receive.
     */
    Set<EventKind> getAcceptedKinds();

    void onEvent(Event event);

    default boolean accepts(EventKind kind) {
        return getAcceptedKinds().contains(kind);
    }

    /**
     * Create a listener from a lambda.
     */
    static EventListener of(String name, Set<EventKind> kinds, Consumer<Event> handler) {
        Objects.requireNonNull(handler, "handler");
        Set<EventKind> accepted = kinds.isEmpty()
            ? EnumSet.noneOf(EventKind.class)
            : EnumSet.copyOf(kinds);
        return new EventListener() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public Set<EventKind> getAcceptedKinds() {
                return accepted;
            }

            @Override
            public void onEvent(Event event) {
                handler.accept(event);
            }

            @Override
            public String toString() {
                return "EventListener(" + name + ", " + accepted + ")";
            }
        };
    }
}
