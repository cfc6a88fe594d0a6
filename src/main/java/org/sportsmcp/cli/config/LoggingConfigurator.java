package org.sportsmcp.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from configuration to Logback.
 * <pre>
 * logging {
 *   default-level = INFO
 *   levels {
 *     "org.sportsmcp.dataservice.query" = DEBUG
 *     "com.zaxxer.hikari" = WARN
 *   }
 * }
 * </pre>
 * Unknown level names fall back to the logger's current level with a warning.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * @param config the application configuration
     */
    public static void configure(final Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }

        if (config.hasPath("logging.default-level")) {
            apply(context.getLogger(Logger.ROOT_LOGGER_NAME), config.getString("logging.default-level"));
        }

        if (config.hasPath("logging.levels")) {
            final Config levels = config.getConfig("logging.levels");
            for (final Map.Entry<String, ConfigValue> entry : levels.root().entrySet()) {
                apply(context.getLogger(entry.getKey()), String.valueOf(entry.getValue().unwrapped()));
            }
        }
    }

    private static void apply(final Logger logger, final String levelName) {
        final Level level = Level.toLevel(levelName, null);
        if (level == null) {
            LoggerFactory.getLogger(LoggingConfigurator.class)
                .warn("Ignoring unknown log level '{}' for logger '{}'", levelName, logger.getName());
            return;
        }
        logger.setLevel(level);
    }
}
