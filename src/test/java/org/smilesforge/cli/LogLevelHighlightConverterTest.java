package org.smilesforge.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.net.URL;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LogLevelHighlightConverterTest {

    private final LogLevelHighlightConverter converter = new LogLevelHighlightConverter();

    private static LoggingEvent event(LoggerContext context, Level level) {
        Logger logger = context.getLogger("org.smilesforge.test.highlight");
        return new LoggingEvent(LogLevelHighlightConverterTest.class.getName(), logger, level, "rendered", null, null);
    }

    @Test
    void colorsEachLevel() {
        LoggerContext context = new LoggerContext();

        assertThat(converter.transform(event(context, Level.ERROR), "ERROR")).isEqualTo("\u001B[1;31mERROR\u001B[0m");
        assertThat(converter.transform(event(context, Level.WARN), "WARN")).isEqualTo("\u001B[33mWARN\u001B[0m");
        assertThat(converter.transform(event(context, Level.INFO), "INFO")).isEqualTo("\u001B[32mINFO\u001B[0m");
        assertThat(converter.transform(event(context, Level.DEBUG), "DEBUG")).isEqualTo("\u001B[90mDEBUG\u001B[0m");
    }

    @Test
    void colorFormatSelectsHighlightingAppender() throws Exception {
        // Given: the shipped logback.xml loaded with the COLOR appender selected
        LoggerContext context = new LoggerContext();
        context.putProperty("smilesforge.logging.format", "STDERR");
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        URL logbackXml = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        assertThat(logbackXml).isNotNull();

        try {
            // When
            configurator.doConfigure(logbackXml);
            Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            @SuppressWarnings("unchecked")
            ConsoleAppender<ILoggingEvent> appender = (ConsoleAppender<ILoggingEvent>) root.getAppender("STDERR");

            // Then
            assertThat(appender).isNotNull();
            assertThat(root.getAppender("STDERR_PLAIN")).isNull();
            String line = new String(appender.getEncoder().encode(event(context, Level.WARN)), StandardCharsets.UTF_8);
            assertThat(line).contains("\u001B[33mWARN").contains("rendered");
        } finally {
            context.stop();
        }
    }
}
