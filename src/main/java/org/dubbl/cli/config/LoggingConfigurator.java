package org.dubbl.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from the configuration to Logback. Logger names may be
 * quoted or written as nested paths.
 * <pre>
 * logging {
 *   default-level = WARN
 *   levels {
 *     "org.dubbl.runtime" = INFO
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * Sets the root level from {@code logging.default-level} and per-logger levels
     * from {@code logging.levels}. Missing keys leave Logback's setup untouched.
     *
     * @param config the application configuration.
     * @throws IllegalArgumentException if a level name is not a Logback level.
     */
    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.default-level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(parse(config.getString("logging.default-level")));
        }
        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getConfig("logging.levels").entrySet()) {
                String loggerName = String.join(".", ConfigUtil.splitPath(entry.getKey()));
                String level = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(loggerName).setLevel(parse(level));
            }
        }
    }

    static Level parse(String name) {
        Level level = Level.toLevel(name, null);
        if (level == null) {
            throw new IllegalArgumentException("Unknown log level: " + name);
        }
        return level;
    }
}
