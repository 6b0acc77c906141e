package org.dubbl.runtime.action;

import java.util.Objects;

import org.dubbl.runtime.InvalidActionException;
import org.dubbl.runtime.bases.BaseStateAlgebra;
import org.dubbl.runtime.bases.HitAdvance;
import org.dubbl.runtime.bases.StealResolution;
import org.dubbl.runtime.model.BaseState;
import org.dubbl.runtime.model.EventType;
import org.dubbl.runtime.model.GameEvent;
import org.dubbl.runtime.model.LivePlayState;
import org.dubbl.runtime.model.Lineup;
import org.dubbl.runtime.rotation.Rotation;

/**
 * One reducer per action kind, each turning a play state and an action into
 * the next play state and exactly one event.
 * <p>
 * Reducers are pure: the event id and timestamp are passed in, so reducing the
 * same state and action with the same stamp always yields equal results. This
 * is what lets the engine rebuild its state by folding the event log.
 * <p>
 * Preconditions are checked before anything is built. A violated precondition
 * raises {@link InvalidActionException} and produces nothing.
 */
public final class ScoringReducers {

    private static final int STRIKES_PER_OUT = 3;

    private ScoringReducers() {
    }

    /**
     * Applies one action.
     *
     * @param state  Current play state.
     * @param action Action to apply.
     * @param stamp  Id and timestamp for the produced event.
     * @param notes  Optional note stored on the event.
     * @return The next state and the event describing the action.
     * @throws InvalidActionException if the action is not allowed in this state.
     */
    public static Reduction reduce(LivePlayState state, ScoringAction action, EventStamp stamp, String notes) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(stamp, "stamp");
        if (state.complete()) {
            throw new InvalidActionException("Game " + state.gameId() + " is complete");
        }
        return action.accept(new Reducer(state, stamp, notes));
    }

    private static final class Reducer implements IScoringActionVisitor<Reduction> {

        private final LivePlayState state;
        private final EventStamp stamp;
        private final String notes;

        Reducer(LivePlayState state, EventStamp stamp, String notes) {
            this.state = state;
            this.stamp = stamp;
            this.notes = notes;
        }

        @Override
        public Reduction visitHit(ScoringAction.Hit hit) {
            if (!hit.kind().isHit()) {
                throw new InvalidActionException("'" + hit.kind().wireName() + "' is not a hit");
            }
            Lineup lineup = state.offenseLineup();
            String batterId = lineup.currentBatter().playerId();
            HitAdvance advance = BaseStateAlgebra.advanceForHit(state.bases(), hit.kind().basesAdvanced(), batterId);

            String offense = state.offenseTeamId();
            LivePlayState next = state.toBuilder()
                    .bases(advance.after())
                    .strikes(0)
                    .lineup(Rotation.advanceBatter(lineup))
                    .score(offense, state.score(offense).plusRuns(state.inning(), advance.runsScored()).plusHit())
                    .build();

            GameEvent event = event(hit.kind(), batterId, null, null,
                    advance.before(), advance.after(), advance.runsScored(), advance.rbi());
            return new Reduction(next, event);
        }

        @Override
        public Reduction visitStrike(ScoringAction.Strike strike) {
            String batterId = state.currentBatter().playerId();
            if (state.strikes() + 1 < STRIKES_PER_OUT) {
                LivePlayState next = state.toBuilder().strikes(state.strikes() + 1).build();
                return new Reduction(next, event(EventType.STRIKE, batterId, null, null,
                        state.bases(), state.bases(), 0, 0));
            }
            return new Reduction(batterOut(state.toBuilder()),
                    event(EventType.STRIKEOUT, batterId, null, null, state.bases(), state.bases(), 0, 0));
        }

        @Override
        public Reduction visitError(ScoringAction.FieldingError error) {
            requireDefender(error.defenderId());
            String batterId = state.currentBatter().playerId();
            String defense = state.defenseTeamId();
            LivePlayState.Builder builder = state.toBuilder()
                    .score(defense, state.score(defense).plusError());

            // An error on what would be the third strike still retires the batter.
            LivePlayState next = state.strikes() + 1 < STRIKES_PER_OUT
                    ? builder.strikes(state.strikes() + 1).build()
                    : batterOut(builder);
            return new Reduction(next, event(EventType.ERROR, batterId, error.defenderId(), null,
                    state.bases(), state.bases(), 0, 0));
        }

        @Override
        public Reduction visitCaughtOut(ScoringAction.CaughtOut caughtOut) {
            requireDefender(caughtOut.defenderId());
            String batterId = state.currentBatter().playerId();
            return new Reduction(batterOut(state.toBuilder()),
                    event(EventType.CAUGHT_OUT, batterId, caughtOut.defenderId(), null,
                            state.bases(), state.bases(), 0, 0));
        }

        @Override
        public Reduction visitSteal(ScoringAction.Steal steal) {
            if (steal.runnerId() == null || steal.runnerId().isBlank()) {
                throw new InvalidActionException("A steal needs a runner");
            }
            if (state.bases().isEmpty()) {
                throw new InvalidActionException("No runner on base to steal");
            }
            requireDefender(steal.defenderId());

            StealResolution resolution = BaseStateAlgebra.resolveSteal(state.bases(), steal.runnerId(), steal.success());
            LivePlayState.Builder builder = state.toBuilder().bases(resolution.after());
            if (resolution.runsScored() > 0) {
                String offense = state.offenseTeamId();
                builder.score(offense, state.score(offense).plusRuns(state.inning(), resolution.runsScored()));
            }
            if (!steal.success()) {
                builder.outs(state.outs() + 1);
            }
            LivePlayState next = Rotation.rotateIfRetired(builder.build());

            EventType type = steal.success() ? EventType.STEAL_SUCCESS : EventType.STEAL_FAIL;
            GameEvent event = event(type, state.currentBatter().playerId(), steal.defenderId(), steal.runnerId(),
                    resolution.before(), resolution.after(), resolution.runsScored(), resolution.runsScored());
            return new Reduction(next, event);
        }

        private LivePlayState batterOut(LivePlayState.Builder builder) {
            LivePlayState out = builder
                    .strikes(0)
                    .outs(state.outs() + 1)
                    .lineup(Rotation.advanceBatter(state.offenseLineup()))
                    .build();
            return Rotation.rotateIfRetired(out);
        }

        private void requireDefender(String defenderId) {
            if (defenderId == null || defenderId.isBlank()) {
                throw new InvalidActionException("A defender is required");
            }
            if (!state.defenseLineup().contains(defenderId)) {
                throw new InvalidActionException("Player '" + defenderId + "' is not on the defending roster of "
                        + state.teamLabels().get(state.defenseTeamId()));
            }
        }

        private GameEvent event(EventType type, String batterId, String defenderId, String runnerId,
                                BaseState before, BaseState after, int runs, int rbi) {
            return new GameEvent(
                    stamp.eventId(),
                    state.gameId(),
                    type,
                    state.inning(),
                    state.half(),
                    batterId,
                    defenderId,
                    runnerId,
                    before,
                    after,
                    runs,
                    rbi,
                    stamp.timestamp(),
                    notes);
        }
    }
}
