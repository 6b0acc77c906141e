package org.dubbl.runtime.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Occupancy of the three bases. Each slot holds a runner id or {@code null}.
 * <p>
 * A runner id may occupy at most one slot; the canonical constructor rejects
 * any state that violates this.
 *
 * @param first  Runner on first base, or null.
 * @param second Runner on second base, or null.
 * @param third  Runner on third base, or null.
 */
public record BaseState(String first, String second, String third) {

    public static final BaseState EMPTY = new BaseState(null, null, null);

    public BaseState {
        if (first != null && (first.equals(second) || first.equals(third))) {
            throw new IllegalArgumentException("Runner '" + first + "' occupies more than one base");
        }
        if (second != null && second.equals(third)) {
            throw new IllegalArgumentException("Runner '" + second + "' occupies more than one base");
        }
    }

    public String get(Base base) {
        return switch (base) {
            case FIRST -> first;
            case SECOND -> second;
            case THIRD -> third;
        };
    }

    /**
     * Returns a copy with the given slot replaced.
     *
     * @param base     The slot to replace.
     * @param runnerId The new occupant, or null to clear the slot.
     * @return A new base state.
     */
    public BaseState with(Base base, String runnerId) {
        return switch (base) {
            case FIRST -> new BaseState(runnerId, second, third);
            case SECOND -> new BaseState(first, runnerId, third);
            case THIRD -> new BaseState(first, second, runnerId);
        };
    }

    /**
     * Finds the base currently held by a runner.
     *
     * @param runnerId The runner to look for.
     * @return The base, or empty if the runner is not on base.
     */
    public Optional<Base> locate(String runnerId) {
        if (runnerId == null) {
            return Optional.empty();
        }
        for (Base base : Base.values()) {
            if (Objects.equals(get(base), runnerId)) {
                return Optional.of(base);
            }
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return first == null && second == null && third == null;
    }

    public int occupiedCount() {
        int count = 0;
        for (Base base : Base.values()) {
            if (get(base) != null) {
                count++;
            }
        }
        return count;
    }
}
