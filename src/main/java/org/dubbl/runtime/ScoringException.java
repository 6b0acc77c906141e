package org.dubbl.runtime;

/**
 * Base class for failures raised by the scoring engine.
 * <p>
 * Unchecked: every scoring call is a deliberate operator step, so callers
 * decide locally whether to report the failure or let it surface.
 */
public class ScoringException extends RuntimeException {

    public ScoringException(String message) {
        super(message);
    }

    public ScoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
