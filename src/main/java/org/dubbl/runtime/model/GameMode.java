package org.dubbl.runtime.model;

import java.util.Locale;

/**
 * Whether a game belongs to a league season or is a one-off friendly.
 */
public enum GameMode {
    FRIENDLY,
    LEAGUE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static GameMode fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
