package org.dubbl.runtime.bases;

import java.util.Objects;
import java.util.Optional;

import org.dubbl.runtime.model.Base;
import org.dubbl.runtime.model.BaseState;

/**
 * Pure base-occupancy transitions for hits and steal attempts.
 * <p>
 * Both operations are deterministic functions of their arguments. Replaying the
 * event log and undo depend on this: the same bases and the same input always
 * produce the same result.
 */
public final class BaseStateAlgebra {

    private static final int HOME = 4;

    private BaseStateAlgebra() {
    }

    /**
     * Advances every runner and the batter on a hit.
     * <p>
     * Runners move lead-first (third, then second, then first), each by
     * {@code basesAdvanced}. A runner whose destination passes third scores.
     * On a homerun ({@code basesAdvanced == 4}) the batter scores as well;
     * otherwise the batter takes the base at index {@code basesAdvanced}.
     * <p>
     * In a short lineup the batter may come up again while still on base. That
     * base is vacated first and scores nothing; the batter then hits as usual.
     *
     * @param bases         Bases before the hit.
     * @param basesAdvanced Bases taken, 1 (single) to 4 (homerun).
     * @param batterId      The batter.
     * @return The new bases with runs scored and RBI.
     * @throws IllegalArgumentException if {@code basesAdvanced} is outside 1..4.
     */
    public static HitAdvance advanceForHit(BaseState bases, int basesAdvanced, String batterId) {
        Objects.requireNonNull(bases, "bases");
        Objects.requireNonNull(batterId, "batterId");
        if (basesAdvanced < 1 || basesAdvanced > HOME) {
            throw new IllegalArgumentException("Bases advanced must be 1..4, got " + basesAdvanced);
        }

        BaseState runners = bases.locate(batterId).map(base -> bases.with(base, null)).orElse(bases);
        BaseState next = BaseState.EMPTY;
        int runs = 0;
        for (Base base : Base.LEAD_FIRST) {
            String runner = runners.get(base);
            if (runner == null) {
                continue;
            }
            int destination = base.index() + basesAdvanced;
            if (destination >= HOME) {
                runs++;
            } else {
                next = next.with(Base.ofIndex(destination), runner);
            }
        }

        if (basesAdvanced == HOME) {
            runs++;
        } else {
            next = next.with(Base.ofIndex(basesAdvanced), batterId);
        }
        return new HitAdvance(bases, next, runs, runs);
    }

    /**
     * Resolves a steal attempt.
     * <p>
     * On failure the named runner is removed from whichever base holds them; if
     * they are not on base nothing changes. On success only the lead runner
     * moves, exactly one base, scoring if they started on third.
     *
     * @param bases    Bases before the attempt.
     * @param runnerId Runner attempting the steal.
     * @param success  Whether the attempt succeeded.
     * @return The resolution.
     */
    public static StealResolution resolveSteal(BaseState bases, String runnerId, boolean success) {
        Objects.requireNonNull(bases, "bases");
        if (!success) {
            Optional<Base> origin = bases.locate(runnerId);
            BaseState after = origin.map(base -> bases.with(base, null)).orElse(bases);
            return new StealResolution(bases, after, false, 0);
        }

        for (Base base : Base.LEAD_FIRST) {
            String runner = bases.get(base);
            if (runner == null) {
                continue;
            }
            BaseState cleared = bases.with(base, null);
            if (base == Base.THIRD) {
                return new StealResolution(bases, cleared, true, 1);
            }
            return new StealResolution(bases, cleared.with(Base.ofIndex(base.index() + 1), runner), true, 0);
        }
        return new StealResolution(bases, bases, true, 0);
    }
}
