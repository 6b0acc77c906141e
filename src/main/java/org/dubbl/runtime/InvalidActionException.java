package org.dubbl.runtime;

/**
 * Thrown when a scoring action, undo or completion is rejected because its
 * preconditions do not hold (for example a steal with nobody on base).
 * <p>
 * A rejected action never mutates engine state and never appends an event,
 * so the caller can correct the input and try again.
 */
public class InvalidActionException extends ScoringException {

    public InvalidActionException(String message) {
        super(message);
    }
}
