package org.dubbl.archive;

import java.util.List;
import java.util.Optional;

import org.dubbl.runtime.CompletedGame;
import org.dubbl.runtime.model.GameEvent;
import org.dubbl.stats.GamePlayer;
import org.dubbl.stats.GameRecord;

/**
 * Storage for completed games.
 * <p>
 * The scoring engine hands each completed game over exactly once through
 * {@link #store(CompletedGame)}. Storing the same game again overwrites the
 * earlier copy with identical rows.
 * <p>
 * All methods throw {@link ArchiveException} on storage failures.
 */
public interface IGameArchive extends AutoCloseable {

    /**
     * Persists a completed game in a single transaction.
     *
     * @param game The frozen game.
     */
    void store(CompletedGame game);

    /**
     * Returns all stored games, oldest first.
     */
    List<GameRecord> loadGames();

    /**
     * Returns all stored events, grouped by game (oldest game first) and in log
     * order within each game.
     */
    List<GameEvent> loadEvents();

    /**
     * Returns the event log of one game, or an empty list for an unknown game.
     */
    List<GameEvent> loadEvents(String gameId);

    /**
     * Returns every stored participant record with the game it belongs to,
     * oldest game first. Player ids repeat across games.
     */
    List<GamePlayer> loadPlayers();

    /**
     * Reads back a game with everything needed to replay it.
     *
     * @param gameId The game id.
     * @return The game, or empty if it is not stored.
     */
    Optional<ArchivedGame> loadGame(String gameId);

    @Override
    void close();
}
