package org.dubbl.runtime;

import java.util.List;

import org.dubbl.runtime.model.GameEvent;
import org.dubbl.runtime.model.GameSetup;
import org.dubbl.runtime.model.LivePlayState;

/**
 * The frozen record of a finished game, handed to persistence once.
 *
 * @param setup       Setup the game started from.
 * @param finalState  Final play state, with its completion flag set.
 * @param events      Full event log in order.
 * @param startedAt   Epoch milliseconds when the game started.
 * @param completedAt Epoch milliseconds when the game was completed.
 */
public record CompletedGame(GameSetup setup, LivePlayState finalState, List<GameEvent> events,
                            long startedAt, long completedAt) {

    public CompletedGame {
        events = List.copyOf(events);
    }

    public String gameId() {
        return finalState.gameId();
    }
}
