package org.dubbl.runtime.model;

/**
 * The three bases a runner can occupy, numbered by distance from home plate.
 */
public enum Base {
    FIRST(1),
    SECOND(2),
    THIRD(3);

    /** Bases in the order runners are moved on a hit: lead runner first. */
    public static final Base[] LEAD_FIRST = {THIRD, SECOND, FIRST};

    private final int index;

    Base(int index) {
        this.index = index;
    }

    /**
     * Returns the 1-based position of this base.
     *
     * @return 1 for first, 2 for second, 3 for third.
     */
    public int index() {
        return index;
    }

    /**
     * Looks up a base by its 1-based index.
     *
     * @param index 1, 2 or 3.
     * @return The base at that index.
     * @throws IllegalArgumentException if the index is outside 1..3.
     */
    public static Base ofIndex(int index) {
        return switch (index) {
            case 1 -> FIRST;
            case 2 -> SECOND;
            case 3 -> THIRD;
            default -> throw new IllegalArgumentException("No base at index " + index);
        };
    }
}
