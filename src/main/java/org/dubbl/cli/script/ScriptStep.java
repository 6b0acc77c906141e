package org.dubbl.cli.script;

import org.dubbl.runtime.action.ScoringAction;

/**
 * One parsed line of an action script.
 *
 * @param line   1-based line number in the script.
 * @param kind   What the line asks for.
 * @param action The scoring action for {@link Kind#ACTION}, otherwise null.
 * @param notes  Note attached after {@code |}, or null.
 */
public record ScriptStep(int line, Kind kind, ScoringAction action, String notes) {

    public enum Kind {
        ACTION,
        UNDO,
        COMPLETE
    }

    public static ScriptStep action(int line, ScoringAction action, String notes) {
        return new ScriptStep(line, Kind.ACTION, action, notes);
    }

    public static ScriptStep undo(int line) {
        return new ScriptStep(line, Kind.UNDO, null, null);
    }

    public static ScriptStep complete(int line) {
        return new ScriptStep(line, Kind.COMPLETE, null, null);
    }
}
