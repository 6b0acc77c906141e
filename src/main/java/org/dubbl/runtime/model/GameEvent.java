package org.dubbl.runtime.model;

import java.util.Objects;

/**
 * One entry of the event log. Events are created once per accepted scoring
 * action and never modified; undo removes the event from the active log.
 * <p>
 * {@link #equals(Object)} compares every component. Use
 * {@link #sameContentAs(GameEvent)} to compare what happened on the field,
 * ignoring the id and timestamp.
 *
 * @param id              Unique event id.
 * @param gameId          Game the event belongs to.
 * @param eventType       Kind of event.
 * @param inning          Inning in which the action happened (&gt;= 1).
 * @param half            Half in which the action happened.
 * @param batterId        Batter at the plate.
 * @param defenderId      Fielder credited or charged, or null.
 * @param runnerId        Runner attempting a steal, or null.
 * @param baseStateBefore Bases before the action.
 * @param baseStateAfter  Bases after the action, before any half-inning rotation.
 * @param runsScored      Runs scored by the action.
 * @param rbi             Runs batted in credited by the action.
 * @param timestamp       Epoch milliseconds when the action was recorded.
 * @param notes           Free-text note, or null.
 */
public record GameEvent(
        String id,
        String gameId,
        EventType eventType,
        int inning,
        Half half,
        String batterId,
        String defenderId,
        String runnerId,
        BaseState baseStateBefore,
        BaseState baseStateAfter,
        int runsScored,
        int rbi,
        long timestamp,
        String notes
) {

    public GameEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(gameId, "gameId");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(half, "half");
        Objects.requireNonNull(batterId, "batterId");
        Objects.requireNonNull(baseStateBefore, "baseStateBefore");
        Objects.requireNonNull(baseStateAfter, "baseStateAfter");
        if (inning < 1) {
            throw new IllegalArgumentException("Inning must be >= 1, got " + inning);
        }
        if (runsScored < 0 || rbi < 0) {
            throw new IllegalArgumentException("Runs and RBI must not be negative");
        }
    }

    /**
     * Compares everything except {@code id} and {@code timestamp}.
     *
     * @param other Event to compare with.
     * @return true if both events describe the same play.
     */
    public boolean sameContentAs(GameEvent other) {
        return other != null
                && gameId.equals(other.gameId)
                && eventType == other.eventType
                && inning == other.inning
                && half == other.half
                && batterId.equals(other.batterId)
                && Objects.equals(defenderId, other.defenderId)
                && Objects.equals(runnerId, other.runnerId)
                && baseStateBefore.equals(other.baseStateBefore)
                && baseStateAfter.equals(other.baseStateAfter)
                && runsScored == other.runsScored
                && rbi == other.rbi
                && Objects.equals(notes, other.notes);
    }
}
