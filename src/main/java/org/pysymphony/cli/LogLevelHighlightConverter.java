package org.pysymphony.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colours the level of console log lines: errors red, warnings yellow, everything else
 * unchanged. Registered as {@code %levelColor(...)} in {@code logback.xml}.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String ANSI_RESET = "\u001B[0m";
    static final String ANSI_RED = "\u001B[31m";
    static final String ANSI_YELLOW = "\u001B[33m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        int level = event.getLevel().toInt();
        if (level >= Level.ERROR_INT) {
            return ANSI_RED + in + ANSI_RESET;
        }
        if (level == Level.WARN_INT) {
            return ANSI_YELLOW + in + ANSI_RESET;
        }
        return in;
    }
}
