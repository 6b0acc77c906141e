package org.dubbl.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colours the level column of console log lines: errors red, warnings yellow,
 * info green. Debug and trace stay uncoloured.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_GREEN = "\u001B[32m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        String colour = colourFor(event.getLevel());
        return colour.isEmpty() ? in : colour + in + ANSI_RESET;
    }

    static String colourFor(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_RED;
            case Level.WARN_INT -> ANSI_YELLOW;
            case Level.INFO_INT -> ANSI_GREEN;
            default -> "";
        };
    }
}
