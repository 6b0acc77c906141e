package org.dubbl.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.dubbl.runtime.model.GameEvent;

/**
 * Append-only, ordered record of the events of one game.
 * <p>
 * The only removal is {@link #removeLast()}, used by undo; the log therefore
 * doubles as the LIFO history of applied actions. Events themselves are
 * immutable and are never edited in place.
 */
public final class EventLog {

    private final List<GameEvent> events = new ArrayList<>();

    void append(GameEvent event) {
        events.add(Objects.requireNonNull(event, "event"));
    }

    Optional<GameEvent> removeLast() {
        if (events.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(events.remove(events.size() - 1));
    }

    void clear() {
        events.clear();
    }

    public Optional<GameEvent> last() {
        return events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1));
    }

    /**
     * Returns an immutable copy of the log in append order.
     */
    public List<GameEvent> events() {
        return List.copyOf(events);
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
