package org.dubbl.cli.script;

/**
 * Raised for a script line that does not parse. The message names the line.
 */
public class ScriptParseException extends RuntimeException {

    private final int line;

    public ScriptParseException(int line, String message) {
        super("Line " + line + ": " + message);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
