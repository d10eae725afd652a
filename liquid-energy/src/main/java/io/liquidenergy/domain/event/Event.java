package io.liquidenergy.domain.event;

import java.lang.reflect.Array;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Event dispatched through the {@code EventEngine}.
 *
 * The payload is deep-copied on construction and exposed read-only, so a
 * producer that keeps mutating its own map never changes an event that has
 * already been published.
 *
 * Equality covers kind and payload only; {@code createdAt} and {@code origin}
 * are observability metadata.
 */
public record Event(
    EventKind kind,
    Map<String, Object> payload,
    Instant createdAt,
    String origin            // null when the producer did not tag itself
) {
    public Event {
        Objects.requireNonNull(kind, "kind");
        payload = payload == null ? Collections.emptyMap() : copyMap(payload);
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public static Event of(EventKind kind, Map<String, ?> payload) {
        return new Event(kind, widen(payload), Instant.now(), null);
    }

    public static Event of(EventKind kind, Map<String, ?> payload, String origin) {
        return new Event(kind, widen(payload), Instant.now(), origin);
    }

    /**
     * Convenience lookup into the payload.
     */
    public Object get(String key) {
        return payload.get(key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Event)) return false;
        Event other = (Event) o;
        return kind == other.kind && payload.equals(other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, payload);
    }

    @Override
    public String toString() {
        String originStr = origin != null ? ", origin=" + origin : "";
        return "Event(kind=" + kind + ", payload=" + payload + ", createdAt=" + createdAt + originStr + ")";
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> widen(Map<String, ?> payload) {
        return (Map<String, Object>) payload;
    }

    private static Map<String, Object> copyMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : source.entrySet()) {
            copy.put(String.valueOf(e.getKey()), copyValue(e.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map) {
            return copyMap((Map<?, ?>) value);
        }
        if (value instanceof Set) {
            Set<Object> copy = new LinkedHashSet<>();
            for (Object item : (Set<?>) value) {
                copy.add(copyValue(item));
            }
            return Collections.unmodifiableSet(copy);
        }
        if (value instanceof Collection) {
            Collection<?> items = (Collection<?>) value;
            List<Object> copy = new ArrayList<>(items.size());
            for (Object item : items) {
                copy.add(copyValue(item));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value.getClass().isArray()) {
            // arrays (primitive ones included) become lists
            int length = Array.getLength(value);
            List<Object> copy = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                copy.add(copyValue(Array.get(value, i)));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
