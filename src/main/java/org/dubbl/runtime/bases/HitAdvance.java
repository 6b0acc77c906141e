package org.dubbl.runtime.bases;

import org.dubbl.runtime.model.BaseState;

/**
 * Outcome of moving runners on a hit.
 *
 * @param before     Bases before the hit.
 * @param after      Bases after the hit.
 * @param runsScored Runners (and batter, on a homerun) who crossed home.
 * @param rbi        Runs batted in; always equal to {@code runsScored} for hits.
 */
public record HitAdvance(BaseState before, BaseState after, int runsScored, int rbi) {}
