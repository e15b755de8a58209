package org.smilesforge.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter coloring the level column of the {@code STDERR} appender.
 *
 * <p>Colors:
 * <ul>
 *   <li>ERROR - Bold red</li>
 *   <li>WARN - Yellow</li>
 *   <li>INFO - Green</li>
 *   <li>DEBUG/TRACE - Grey</li>
 * </ul>
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD_RED = "\u001B[1;31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_GREY = "\u001B[90m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        Level level = event.getLevel();
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_BOLD_RED + in + ANSI_RESET;
            case Level.WARN_INT -> ANSI_YELLOW + in + ANSI_RESET;
            case Level.INFO_INT -> ANSI_GREEN + in + ANSI_RESET;
            default -> ANSI_GREY + in + ANSI_RESET;
        };
    }
}
