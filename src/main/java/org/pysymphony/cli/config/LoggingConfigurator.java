package org.pysymphony.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies log levels from the {@code logging} section of the configuration:
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels { "org.pysymphony.compiler.backend" = "DEBUG" }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.default-level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME)
                    .setLevel(Level.toLevel(config.getString("logging.default-level"), Level.INFO));
        }
        if (config.hasPath("logging.levels")) {
            Config levels = config.getConfig("logging.levels");
            // keys are quoted logger names, so read them from the root object
            levels.root().keySet().forEach(loggerName ->
                    context.getLogger(loggerName).setLevel(
                            Level.toLevel(levels.root().get(loggerName).unwrapped().toString(), Level.INFO)));
        }
    }
}
