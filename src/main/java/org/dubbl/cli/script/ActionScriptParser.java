package org.dubbl.cli.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.dubbl.runtime.action.ScoringAction;
import org.dubbl.runtime.model.EventType;

/**
 * Parses the line-oriented action scripts fed to {@code dubbl score}.
 * <p>
 * One step per line, blank lines and lines starting with {@code #} are skipped.
 * Anything after a {@code |} is attached to the event as a note.
 * <pre>
 * single | lead-off
 * double
 * homerun
 * strike
 * error &lt;defender&gt;
 * catch &lt;defender&gt;
 * steal &lt;runner&gt; &lt;defender&gt; success|fail
 * undo
 * complete
 * </pre>
 * Only the syntax is checked here; whether a step is legal in the current game
 * is decided by the engine.
 */
public final class ActionScriptParser {

    private ActionScriptParser() {
    }

    public static List<ScriptStep> parse(Reader reader) throws IOException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader buffered = new BufferedReader(reader)) {
            String line;
            while ((line = buffered.readLine()) != null) {
                lines.add(line);
            }
        }
        return parse(lines);
    }

    /**
     * @param lines Script lines in order.
     * @return The steps, in order.
     * @throws ScriptParseException on the first malformed line.
     */
    public static List<ScriptStep> parse(List<String> lines) {
        List<ScriptStep> steps = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            ScriptStep step = parseLine(i + 1, lines.get(i));
            if (step != null) {
                steps.add(step);
            }
        }
        return steps;
    }

    /**
     * @return The step, or null for a blank or comment line.
     */
    static ScriptStep parseLine(int lineNumber, String raw) {
        String text = raw.strip();
        if (text.isEmpty() || text.startsWith("#")) {
            return null;
        }
        String notes = null;
        int bar = text.indexOf('|');
        if (bar >= 0) {
            notes = text.substring(bar + 1).strip();
            notes = notes.isEmpty() ? null : notes;
            text = text.substring(0, bar).strip();
        }
        String[] words = text.split("\\s+");
        String verb = words[0].toLowerCase(Locale.ROOT);

        return switch (verb) {
            case "single", "double", "triple", "homerun" -> {
                expectArgs(lineNumber, verb, words, 0);
                yield ScriptStep.action(lineNumber, ScoringAction.hit(EventType.fromWire(verb)), notes);
            }
            case "strike" -> {
                expectArgs(lineNumber, verb, words, 0);
                yield ScriptStep.action(lineNumber, ScoringAction.strike(), notes);
            }
            case "error" -> {
                expectArgs(lineNumber, verb, words, 1);
                yield ScriptStep.action(lineNumber, ScoringAction.error(words[1]), notes);
            }
            case "catch" -> {
                expectArgs(lineNumber, verb, words, 1);
                yield ScriptStep.action(lineNumber, ScoringAction.caughtOut(words[1]), notes);
            }
            case "steal" -> {
                expectArgs(lineNumber, verb, words, 3);
                yield ScriptStep.action(lineNumber,
                        ScoringAction.steal(words[1], words[2], parseOutcome(lineNumber, words[3])), notes);
            }
            case "undo" -> {
                expectArgs(lineNumber, verb, words, 0);
                yield ScriptStep.undo(lineNumber);
            }
            case "complete" -> {
                expectArgs(lineNumber, verb, words, 0);
                yield ScriptStep.complete(lineNumber);
            }
            default -> throw new ScriptParseException(lineNumber, "unknown step '" + words[0] + "'");
        };
    }

    private static void expectArgs(int lineNumber, String verb, String[] words, int count) {
        if (words.length - 1 != count) {
            throw new ScriptParseException(lineNumber,
                    "'" + verb + "' takes " + count + " argument(s), got " + (words.length - 1));
        }
    }

    private static boolean parseOutcome(int lineNumber, String word) {
        return switch (word.toLowerCase(Locale.ROOT)) {
            case "success", "safe" -> true;
            case "fail", "out" -> false;
            default -> throw new ScriptParseException(lineNumber,
                    "steal outcome must be success or fail, got '" + word + "'");
        };
    }
}
