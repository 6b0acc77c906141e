package org.dubbl.stats;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.dubbl.runtime.model.LineupSlot;
import org.dubbl.runtime.model.LivePlayState;
import org.dubbl.runtime.model.PlayerIdentity;

/**
 * Lookup of player identities by game and the per-game player id used in events.
 * <p>
 * The same id may name different people in different games; records of one
 * person are merged later, on their identity key.
 */
public final class PlayerDirectory {

    private final Map<String, Map<String, PlayerIdentity>> playersByGame;
    private final int size;

    private PlayerDirectory(Map<String, Map<String, PlayerIdentity>> playersByGame) {
        this.playersByGame = playersByGame;
        this.size = playersByGame.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Builds a directory from stored participant records.
     *
     * @throws IllegalArgumentException if one game lists the same player id twice.
     */
    public static PlayerDirectory of(Collection<GamePlayer> players) {
        Map<String, Map<String, PlayerIdentity>> map = new HashMap<>();
        for (GamePlayer player : players) {
            add(map, player.gameId(), player.identity());
        }
        return new PlayerDirectory(map);
    }

    /**
     * Builds a directory from the lineups of one or more games, finished or not.
     */
    public static PlayerDirectory ofStates(Collection<LivePlayState> states) {
        Map<String, Map<String, PlayerIdentity>> map = new HashMap<>();
        for (LivePlayState state : states) {
            for (String teamId : state.teamOrder()) {
                for (LineupSlot slot : state.lineups().get(teamId).slots()) {
                    add(map, state.gameId(), slot.player());
                }
            }
        }
        return new PlayerDirectory(map);
    }

    public static PlayerDirectory of(LivePlayState state) {
        return ofStates(List.of(state));
    }

    private static void add(Map<String, Map<String, PlayerIdentity>> map, String gameId, PlayerIdentity identity) {
        PlayerIdentity previous = map.computeIfAbsent(gameId, k -> new HashMap<>()).put(identity.id(), identity);
        if (previous != null && !previous.equals(identity)) {
            throw new IllegalArgumentException("Player id '" + identity.id() + "' used twice in game " + gameId);
        }
    }

    /**
     * @param gameId   The game the reference comes from.
     * @param playerId The per-game player id.
     * @return The identity, or empty if the game has no such player.
     */
    public Optional<PlayerIdentity> find(String gameId, String playerId) {
        if (gameId == null || playerId == null) {
            return Optional.empty();
        }
        Map<String, PlayerIdentity> game = playersByGame.get(gameId);
        return game == null ? Optional.empty() : Optional.ofNullable(game.get(playerId));
    }

    public int size() {
        return size;
    }
}
