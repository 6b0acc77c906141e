package org.dubbl.runtime;

import java.util.List;
import java.util.Objects;

import org.dubbl.runtime.action.EventStamp;
import org.dubbl.runtime.action.Reduction;
import org.dubbl.runtime.action.ScoringAction;
import org.dubbl.runtime.action.ScoringReducers;
import org.dubbl.runtime.model.GameEvent;
import org.dubbl.runtime.model.GameSetup;
import org.dubbl.runtime.model.LivePlayState;

/**
 * Rebuilds play state by folding an event log through the scoring reducers.
 * <p>
 * Each logged event is turned back into the action that produced it and reduced
 * with the event's own id and timestamp, so a replay reproduces both the state
 * and the events of the original run.
 */
public final class Replayer {

    private Replayer() {
    }

    /**
     * Folds events onto a starting state without checking them.
     *
     * @param initial State before the first event.
     * @param events  Events in log order.
     * @return State after the last event.
     */
    public static LivePlayState fold(LivePlayState initial, List<GameEvent> events) {
        LivePlayState state = Objects.requireNonNull(initial, "initial");
        for (GameEvent event : events) {
            state = reduce(state, event).state();
        }
        return state;
    }

    /**
     * Replays a stored game and verifies that every event comes out the same.
     *
     * @param setup  Setup the game was started with.
     * @param gameId Id of the stored game.
     * @param events Stored events in log order.
     * @return State after the last event.
     * @throws InvalidActionException if an event cannot be replayed or differs
     *                                from what the reducers produce.
     * @throws GameSetupException     if the setup itself is invalid.
     */
    public static LivePlayState replay(GameSetup setup, String gameId, List<GameEvent> events) {
        LivePlayState state = LivePlayState.initial(setup, gameId);
        for (int i = 0; i < events.size(); i++) {
            GameEvent stored = events.get(i);
            Reduction reduction;
            try {
                reduction = reduce(state, stored);
            } catch (InvalidActionException e) {
                throw new InvalidActionException("Event #" + i + " (" + stored.id() + ") cannot be replayed: "
                        + e.getMessage());
            }
            if (!reduction.event().sameContentAs(stored)) {
                throw new InvalidActionException("Event #" + i + " (" + stored.id() + ") does not match replay: stored "
                        + stored + ", replayed " + reduction.event());
            }
            state = reduction.state();
        }
        return state;
    }

    private static Reduction reduce(LivePlayState state, GameEvent event) {
        return ScoringReducers.reduce(
                state,
                ScoringAction.fromEvent(event),
                new EventStamp(event.id(), event.timestamp()),
                event.notes());
    }
}
