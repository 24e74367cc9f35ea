package org.pysymphony.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@Tag("unit")
class LogLevelHighlightConverterTest {

    private final LogLevelHighlightConverter converter = new LogLevelHighlightConverter();

    private String transform(Level level) {
        ILoggingEvent event = mock(ILoggingEvent.class);
        when(event.getLevel()).thenReturn(level);
        return converter.transform(event, "text");
    }

    @Test
    void errorsAreRed() {
        assertThat(transform(Level.ERROR)).isEqualTo(LogLevelHighlightConverter.ANSI_RED + "text" + LogLevelHighlightConverter.ANSI_RESET);
    }

    @Test
    void warningsAreYellow() {
        assertThat(transform(Level.WARN)).startsWith(LogLevelHighlightConverter.ANSI_YELLOW);
    }

    @Test
    void otherLevelsAreUnchanged() {
        assertThat(transform(Level.INFO)).isEqualTo("text");
        assertThat(transform(Level.DEBUG)).isEqualTo("text");
    }
}
