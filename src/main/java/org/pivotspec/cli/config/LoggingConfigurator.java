package org.pivotspec.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from the {@code pivotspec.logging} section to Logback.
 * <pre>
 * logging {
 *   level = INFO
 *   loggers {
 *     "org.pivotspec.distinct" = DEBUG
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
        // Utility class
    }

    /**
     * @param logging the {@code pivotspec.logging} subtree
     */
    public static void configure(Config logging) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        if (logging.hasPath("level")) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(level(logging.getString("level")));
        }
        if (logging.hasPath("loggers")) {
            for (Map.Entry<String, ConfigValue> entry : logging.getConfig("loggers").entrySet()) {
                // Quoted and nested logger names both resolve to the dotted name.
                Logger logger = context.getLogger(String.join(".", ConfigUtil.splitPath(entry.getKey())));
                logger.setLevel(level(String.valueOf(entry.getValue().unwrapped())));
            }
        }
    }

    static Level level(String name) {
        Level level = Level.toLevel(name, null);
        if (level == null) {
            throw new IllegalArgumentException("Unknown log level: " + name);
        }
        return level;
    }
}
