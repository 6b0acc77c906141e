package org.dubbl.runtime.model;

/**
 * One team's turn at bat within an inning.
 * <p>
 * The first team of a game's team order always bats in the {@link #TOP} half.
 */
public enum Half {
    TOP("top"),
    BOTTOM("bottom");

    private final String wireName;

    Half(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public Half flip() {
        return this == TOP ? BOTTOM : TOP;
    }

    /**
     * Parses the persisted form ({@code top} or {@code bottom}).
     *
     * @param value The wire name.
     * @return The matching half.
     * @throws IllegalArgumentException for any other value.
     */
    public static Half fromWire(String value) {
        for (Half half : values()) {
            if (half.wireName.equals(value)) {
                return half;
            }
        }
        throw new IllegalArgumentException("Unknown half: " + value);
    }
}
