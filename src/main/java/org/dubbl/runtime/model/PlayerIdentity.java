package org.dubbl.runtime.model;

import java.util.Objects;

/**
 * A participant as recorded for one game.
 * <p>
 * The same real person may appear under different {@code id}s across games;
 * {@code identityKey} is the stable key (a member id) used to merge those
 * records in leaderboards. Guests have no identity key.
 *
 * @param id          Per-game player id referenced by events.
 * @param displayName Name shown on scoreboards.
 * @param identityKey Stable identity of the real person, or null.
 * @param guest       Whether the player is a guest participant.
 * @param teamId      Team the player batted for, or null if unknown.
 */
public record PlayerIdentity(String id, String displayName, String identityKey, boolean guest, String teamId) {

    public PlayerIdentity {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Player id must not be blank");
        }
        displayName = displayName == null || displayName.isBlank() ? id : displayName;
        identityKey = identityKey == null || identityKey.isBlank() ? null : identityKey;
    }

    public static PlayerIdentity member(String id, String displayName, String identityKey) {
        return new PlayerIdentity(id, displayName, identityKey, false, null);
    }

    public static PlayerIdentity guest(String id, String displayName) {
        return new PlayerIdentity(id, displayName, null, true, null);
    }

    /**
     * Returns a copy assigned to the given team.
     */
    public PlayerIdentity onTeam(String newTeamId) {
        return new PlayerIdentity(id, displayName, identityKey, guest, newTeamId);
    }
}
