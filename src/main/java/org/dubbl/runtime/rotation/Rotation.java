package org.dubbl.runtime.rotation;

import java.util.Objects;

import org.dubbl.runtime.model.BaseState;
import org.dubbl.runtime.model.Half;
import org.dubbl.runtime.model.LivePlayState;
import org.dubbl.runtime.model.Lineup;

/**
 * Batting-order and half-inning transitions.
 */
public final class Rotation {

    /** Outs that end a half inning. */
    public static final int OUTS_PER_HALF = 3;

    private Rotation() {
    }

    /**
     * Moves the batting cursor to the next slot, wrapping at the end of the order.
     *
     * @param lineup The lineup, never empty.
     * @return The lineup with its cursor advanced by one.
     */
    public static Lineup advanceBatter(Lineup lineup) {
        return Objects.requireNonNull(lineup, "lineup").advance();
    }

    /**
     * Ends the current half inning.
     * <p>
     * Flips the half, increments the inning only when leaving the bottom half,
     * resets outs, strikes and bases, and swaps offense and defense. Planned
     * innings grow to cover extra innings.
     *
     * @param state State whose half has just recorded its third out.
     * @return State at the start of the next half.
     */
    public static LivePlayState rotateSides(LivePlayState state) {
        int nextInning = state.half() == Half.BOTTOM ? state.inning() + 1 : state.inning();
        return state.toBuilder()
                .half(state.half().flip())
                .inning(nextInning)
                .plannedInnings(Math.max(state.plannedInnings(), nextInning))
                .outs(0)
                .strikes(0)
                .bases(BaseState.EMPTY)
                .offense(state.defenseTeamId(), state.offenseTeamId())
                .build();
    }

    /**
     * Rotates sides if, and only if, the state has reached three outs.
     *
     * @param state State after an out was recorded.
     * @return The same state, or the rotated one.
     */
    public static LivePlayState rotateIfRetired(LivePlayState state) {
        return state.outs() >= OUTS_PER_HALF ? rotateSides(state) : state;
    }
}
