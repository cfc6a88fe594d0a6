package org.sportsmcp.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colours the wrapped pattern by log level for the {@code STDOUT} console appender:
 * ERROR red, WARN yellow, INFO cyan, DEBUG and TRACE grey.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String RESET = "\u001B[0m";

    @Override
    protected String transform(final ILoggingEvent event, final String in) {
        final String colour = colourFor(event.getLevel());
        return colour == null ? in : colour + in + RESET;
    }

    static String colourFor(final Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> "\u001B[31m";
            case Level.WARN_INT -> "\u001B[33m";
            case Level.INFO_INT -> "\u001B[36m";
            case Level.DEBUG_INT, Level.TRACE_INT -> "\u001B[90m";
            default -> null;
        };
    }
}
