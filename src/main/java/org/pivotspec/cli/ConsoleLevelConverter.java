package org.pivotspec.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter colouring the log level on ANSI consoles.
 * <p>
 * ERROR is red, WARN yellow and DEBUG/TRACE dimmed; INFO keeps the terminal colour so that
 * CLI output stays readable. Colouring is disabled when the {@code NO_COLOR} environment
 * variable is set or the converter option is {@code plain}, e.g. {@code %level_color(%-5level){plain}}.
 */
public class ConsoleLevelConverter extends CompositeConverter<ILoggingEvent> {

    static final String RESET = "\u001B[0m";
    static final String RED = "\u001B[31m";
    static final String YELLOW = "\u001B[33m";
    static final String DIM = "\u001B[2m";

    private boolean plain;

    @Override
    public void start() {
        plain = "plain".equalsIgnoreCase(getFirstOption()) || System.getenv("NO_COLOR") != null;
        super.start();
    }

    @Override
    protected String transform(ILoggingEvent event, String in) {
        if (plain) {
            return in;
        }
        return colorize(event.getLevel(), in);
    }

    static String colorize(Level level, String in) {
        if (level.isGreaterOrEqual(Level.ERROR)) {
            return RED + in + RESET;
        }
        if (level.isGreaterOrEqual(Level.WARN)) {
            return YELLOW + in + RESET;
        }
        if (level.isGreaterOrEqual(Level.INFO)) {
            return in;
        }
        return DIM + in + RESET;
    }
}
