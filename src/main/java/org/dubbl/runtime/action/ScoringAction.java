package org.dubbl.runtime.action;

import java.util.Objects;

import org.dubbl.runtime.model.EventType;
import org.dubbl.runtime.model.GameEvent;

/**
 * An operator's scoring input. Each variant carries only the payload its
 * reducer needs; who is batting and where the runners stand come from the
 * play state.
 */
public sealed interface ScoringAction
        permits ScoringAction.Hit, ScoringAction.Strike, ScoringAction.FieldingError,
                ScoringAction.CaughtOut, ScoringAction.Steal {

    <R> R accept(IScoringActionVisitor<R> visitor);

    /**
     * A base hit.
     *
     * @param kind One of single, double, triple or homerun.
     */
    record Hit(EventType kind) implements ScoringAction {
        public Hit {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public <R> R accept(IScoringActionVisitor<R> visitor) {
            return visitor.visitHit(this);
        }
    }

    /** A strike on the current batter. */
    record Strike() implements ScoringAction {
        @Override
        public <R> R accept(IScoringActionVisitor<R> visitor) {
            return visitor.visitStrike(this);
        }
    }

    /**
     * A fielding error charged to a defender.
     *
     * @param defenderId The defender committing the error.
     */
    record FieldingError(String defenderId) implements ScoringAction {
        @Override
        public <R> R accept(IScoringActionVisitor<R> visitor) {
            return visitor.visitError(this);
        }
    }

    /**
     * A ball caught for an out.
     *
     * @param defenderId The defender making the catch.
     */
    record CaughtOut(String defenderId) implements ScoringAction {
        @Override
        public <R> R accept(IScoringActionVisitor<R> visitor) {
            return visitor.visitCaughtOut(this);
        }
    }

    /**
     * A steal attempt.
     *
     * @param runnerId   The runner attempting the steal.
     * @param defenderId The defender covering the base.
     * @param success    Whether the runner was safe.
     */
    record Steal(String runnerId, String defenderId, boolean success) implements ScoringAction {
        @Override
        public <R> R accept(IScoringActionVisitor<R> visitor) {
            return visitor.visitSteal(this);
        }
    }

    static ScoringAction hit(EventType kind) {
        return new Hit(kind);
    }

    static ScoringAction strike() {
        return new Strike();
    }

    static ScoringAction error(String defenderId) {
        return new FieldingError(defenderId);
    }

    static ScoringAction caughtOut(String defenderId) {
        return new CaughtOut(defenderId);
    }

    static ScoringAction steal(String runnerId, String defenderId, boolean success) {
        return new Steal(runnerId, defenderId, success);
    }

    /**
     * Recovers the action that produced a logged event. Feeding the result back
     * through the reducers from the same state reproduces the event.
     *
     * @param event A logged event.
     * @return The originating action.
     */
    static ScoringAction fromEvent(GameEvent event) {
        return switch (event.eventType()) {
            case SINGLE, DOUBLE, TRIPLE, HOMERUN -> new Hit(event.eventType());
            case STRIKE, STRIKEOUT -> new Strike();
            case ERROR -> new FieldingError(event.defenderId());
            case CAUGHT_OUT -> new CaughtOut(event.defenderId());
            case STEAL_SUCCESS -> new Steal(event.runnerId(), event.defenderId(), true);
            case STEAL_FAIL -> new Steal(event.runnerId(), event.defenderId(), false);
        };
    }
}
