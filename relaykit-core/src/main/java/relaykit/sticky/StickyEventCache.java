package relaykit.sticky;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache holding the latest sticky event per exact event class.
 *
 * <p>At most one entry exists per class. Each {@link #put(Object)} atomically replaces the
 * previous entry for the event's runtime class; entries never expire on their own.
 */
public final class StickyEventCache {

    private final Map<Class<?>, Object> events = new ConcurrentHashMap<>();

    /**
     * Stores {@code event} under its runtime class.
     *
     * @param event the event to retain
     * @return the event it replaced, if any
     */
    public Optional<Object> put(Object event) {
        Objects.requireNonNull(event, "event");
        return Optional.ofNullable(events.put(event.getClass(), event));
    }

    public <T> Optional<T> get(Class<T> eventType) {
        Objects.requireNonNull(eventType, "eventType");
        return Optional.ofNullable(events.get(eventType)).map(eventType::cast);
    }

    /**
     * Removes the entry for {@code eventType}.
     *
     * @param eventType the event class
     * @return {@code true} if an entry was present
     */
    public boolean remove(Class<?> eventType) {
        Objects.requireNonNull(eventType, "eventType");
        return events.remove(eventType) != null;
    }

    public void clear() {
        events.clear();
    }

    public int size() {
        return events.size();
    }

    public Set<Class<?>> types() {
        return Set.copyOf(events.keySet());
    }
}
