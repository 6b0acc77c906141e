package org.dubbl.stats;

import java.util.Objects;

import org.dubbl.runtime.model.PlayerIdentity;

/**
 * A participant record as it was used in one game. Player ids are only unique
 * within their game.
 *
 * @param gameId   The game.
 * @param identity The participant, with the team they played for.
 */
public record GamePlayer(String gameId, PlayerIdentity identity) {

    public GamePlayer {
        Objects.requireNonNull(gameId, "gameId");
        Objects.requireNonNull(identity, "identity");
    }
}
