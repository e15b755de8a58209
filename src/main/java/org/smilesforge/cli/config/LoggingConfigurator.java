package org.smilesforge.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValueType;
import org.slf4j.LoggerFactory;

/**
 * Applies the log levels of the {@code logging} section to Logback.
 * <pre>
 * logging {
 *   default-level = WARN
 *   levels { "org.smilesforge.codegen" = DEBUG }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * Sets the root level and the per-logger levels found in the configuration. Logger names must be
     * quoted. Unknown level names fall back to DEBUG, as Logback does.
     *
     * @param config The application configuration.
     */
    public static void configure(final Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.default-level")) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                .setLevel(Level.toLevel(config.getString("logging.default-level")));
        }
        if (config.hasPath("logging.levels")) {
            // quoted keys keep dotted logger names in one piece
            config.getConfig("logging.levels").root().forEach((loggerName, value) -> {
                if (value.valueType() == ConfigValueType.STRING) {
                    context.getLogger(loggerName).setLevel(Level.toLevel(value.unwrapped().toString()));
                }
            });
        }
    }
}
