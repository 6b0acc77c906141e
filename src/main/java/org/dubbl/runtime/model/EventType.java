package org.dubbl.runtime.model;

/**
 * The closed set of scoring event kinds written to the event log.
 * <p>
 * Hit kinds carry the number of bases the batter takes; every other kind
 * reports zero.
 */
public enum EventType {
    SINGLE("single", 1),
    DOUBLE("double", 2),
    TRIPLE("triple", 3),
    HOMERUN("homerun", 4),
    STRIKE("strike", 0),
    ERROR("error", 0),
    STRIKEOUT("strikeout", 0),
    CAUGHT_OUT("caught_out", 0),
    STEAL_SUCCESS("steal_success", 0),
    STEAL_FAIL("steal_fail", 0);

    private final String wireName;
    private final int basesAdvanced;

    EventType(String wireName, int basesAdvanced) {
        this.wireName = wireName;
        this.basesAdvanced = basesAdvanced;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Returns the total bases credited for this kind: 1 to 4 for hits, 0 otherwise.
     */
    public int basesAdvanced() {
        return basesAdvanced;
    }

    public boolean isHit() {
        return basesAdvanced > 0;
    }

    public boolean isSteal() {
        return this == STEAL_SUCCESS || this == STEAL_FAIL;
    }

    /**
     * Parses the persisted form of an event kind.
     *
     * @param value Wire name such as {@code caught_out}.
     * @return The matching kind.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static EventType fromWire(String value) {
        for (EventType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }
}
