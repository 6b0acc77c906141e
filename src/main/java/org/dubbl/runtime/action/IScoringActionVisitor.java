package org.dubbl.runtime.action;

/**
 * Visitor over the closed set of {@link ScoringAction}s. Every action kind has
 * its own method, so an implementation handles all kinds or does not compile.
 *
 * @param <R> Result type.
 */
public interface IScoringActionVisitor<R> {

    R visitHit(ScoringAction.Hit hit);

    R visitStrike(ScoringAction.Strike strike);

    R visitError(ScoringAction.FieldingError error);

    R visitCaughtOut(ScoringAction.CaughtOut caughtOut);

    R visitSteal(ScoringAction.Steal steal);
}
