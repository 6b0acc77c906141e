package org.dubbl.runtime;

/**
 * Thrown when a game cannot be started from the given setup, for example
 * because a team has no players. Raised before any play state exists.
 */
public class GameSetupException extends ScoringException {

    public GameSetupException(String message) {
        super(message);
    }

    public GameSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
