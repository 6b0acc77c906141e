package org.dubbl.runtime.bases;

import org.dubbl.runtime.model.BaseState;

/**
 * Outcome of a steal attempt.
 *
 * @param before     Bases before the attempt.
 * @param after      Bases after the attempt.
 * @param success    Whether the steal succeeded.
 * @param runsScored 1 if a runner stole home, otherwise 0.
 */
public record StealResolution(BaseState before, BaseState after, boolean success, int runsScored) {}
