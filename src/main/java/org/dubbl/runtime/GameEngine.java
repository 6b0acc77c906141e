package org.dubbl.runtime;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.dubbl.runtime.action.IEventIdentitySource;
import org.dubbl.runtime.action.Reduction;
import org.dubbl.runtime.action.ScoringAction;
import org.dubbl.runtime.action.ScoringReducers;
import org.dubbl.runtime.model.EventType;
import org.dubbl.runtime.model.GameEvent;
import org.dubbl.runtime.model.GameSetup;
import org.dubbl.runtime.model.LivePlayState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live scoring engine for one game.
 * <p>
 * Owns the event log and the current {@link LivePlayState}. Every accepted
 * action appends exactly one event and replaces the state with the reducer's
 * output. Undo removes the last event and rebuilds the state by folding the
 * remaining log from the initial state, so the state after an undo is always
 * the state a fresh replay would give.
 * <p>
 * <strong>Threading:</strong> not thread-safe. One engine serves one game on a
 * single timeline; calls are applied strictly in the order they are made.
 */
public final class GameEngine {

    private static final Logger log = LoggerFactory.getLogger(GameEngine.class);

    private final GameSetup setup;
    private final IEventIdentitySource identity;
    private final LivePlayState initialState;
    private final long startedAt;
    private final EventLog eventLog = new EventLog();

    private LivePlayState state;

    private GameEngine(GameSetup setup, IEventIdentitySource identity, LivePlayState initialState, long startedAt) {
        this.setup = setup;
        this.identity = identity;
        this.initialState = initialState;
        this.startedAt = startedAt;
        this.state = initialState;
    }

    /**
     * Starts a game with random ids and the system clock.
     *
     * @param setup Teams, lineups and mode.
     * @return A running engine with an empty log.
     * @throws GameSetupException if the setup cannot be played.
     */
    public static GameEngine start(GameSetup setup) {
        return start(setup, IEventIdentitySource.system());
    }

    /**
     * Starts a game using the given id and time source.
     *
     * @param setup    Teams, lineups and mode.
     * @param identity Source of game ids, event ids and timestamps.
     * @return A running engine with an empty log.
     * @throws GameSetupException if the setup cannot be played.
     */
    public static GameEngine start(GameSetup setup, IEventIdentitySource identity) {
        Objects.requireNonNull(setup, "setup");
        Objects.requireNonNull(identity, "identity");
        LivePlayState initial = LivePlayState.initial(setup, identity.nextGameId());
        log.info("Started {} game {}: {} vs {}", setup.mode().wireName(), initial.gameId(),
                initial.teamLabels().get(initial.teamOrder().get(0)),
                initial.teamLabels().get(initial.teamOrder().get(1)));
        return new GameEngine(setup, identity, initial, identity.now());
    }

    /**
     * Records a hit of the given kind ({@code SINGLE} to {@code HOMERUN}) for the current batter.
     */
    public GameEvent applyHit(EventType kind) {
        return apply(ScoringAction.hit(kind));
    }

    /** Records a strike; the third one is a strikeout. */
    public GameEvent applyStrike() {
        return apply(ScoringAction.strike());
    }

    /** Charges a fielding error to a defender; it counts as a strike on the batter. */
    public GameEvent applyError(String defenderId) {
        return apply(ScoringAction.error(defenderId));
    }

    /** Records the current batter caught out by a defender. */
    public GameEvent applyCaughtOut(String defenderId) {
        return apply(ScoringAction.caughtOut(defenderId));
    }

    /** Records a steal attempt by a runner against a defender. */
    public GameEvent applySteal(String runnerId, String defenderId, boolean success) {
        return apply(ScoringAction.steal(runnerId, defenderId, success));
    }

    /** Applies an action without a note. */
    public GameEvent apply(ScoringAction action) {
        return apply(action, null);
    }

    /**
     * Applies an action and appends its event.
     *
     * @param action The scoring action.
     * @param notes  Optional free-text note for the event.
     * @return The appended event.
     * @throws InvalidActionException if the action is rejected; nothing changes.
     */
    public GameEvent apply(ScoringAction action, String notes) {
        Reduction reduction;
        try {
            reduction = ScoringReducers.reduce(state, action, identity.nextEvent(), notes);
        } catch (InvalidActionException e) {
            log.debug("Rejected {} in game {}: {}", action, state.gameId(), e.getMessage());
            throw e;
        }
        LivePlayState previous = state;
        eventLog.append(reduction.event());
        state = reduction.state();
        if (state.half() != previous.half()) {
            log.info("Side retired in game {}: now {} of inning {}", state.gameId(),
                    state.half().wireName(), state.inning());
        }
        return reduction.event();
    }

    /**
     * Removes the most recent event and restores the state that preceded it.
     *
     * @return The removed event, or empty if the log was already empty (no change).
     * @throws InvalidActionException if the game is complete.
     */
    public Optional<GameEvent> undoLast() {
        requireRunning("undo");
        Optional<GameEvent> removed = eventLog.removeLast();
        if (removed.isEmpty()) {
            log.debug("Nothing to undo in game {}", state.gameId());
            return removed;
        }
        state = Replayer.fold(initialState, eventLog.events());
        log.debug("Undid {} in game {}", removed.get().eventType().wireName(), state.gameId());
        return removed;
    }

    /**
     * Freezes the game and hands back its full record. The engine keeps the
     * frozen state for display but drops its log; further actions are rejected.
     *
     * @return Final state and all events.
     * @throws InvalidActionException if the game was already completed.
     */
    public CompletedGame completeGame() {
        requireRunning("complete");
        state = state.toBuilder().complete(true).build();
        CompletedGame completed = new CompletedGame(setup, state, eventLog.events(), startedAt, identity.now());
        eventLog.clear();
        log.info("Completed game {} after {} events, {} total runs", state.gameId(),
                completed.events().size(), state.totalRuns());
        return completed;
    }

    private void requireRunning(String operation) {
        if (state.complete()) {
            throw new InvalidActionException("Cannot " + operation + ": game " + state.gameId() + " is complete");
        }
    }

    public LivePlayState state() {
        return state;
    }

    public LivePlayState initialState() {
        return initialState;
    }

    public List<GameEvent> events() {
        return eventLog.events();
    }

    public int undoDepth() {
        return eventLog.size();
    }

    public GameSetup setup() {
        return setup;
    }

    public long startedAt() {
        return startedAt;
    }
}
