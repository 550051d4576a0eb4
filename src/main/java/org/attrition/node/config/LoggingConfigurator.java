package org.attrition.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging} block to Logback at runtime.
 *
 * <pre>
 * logging {
 *   format = "PLAIN"          # PLAIN or JSON, defaults to JSON
 *   default-level = "INFO"
 *   levels {
 *     "org.attrition.engine.scheduling" = "DEBUG"
 *   }
 * }
 * </pre>
 *
 * The format is exposed as the {@code attrition.logging.format} property that
 * {@code logback.xml} uses to pick its appender.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    public static final String FORMAT_PROPERTY = "attrition.logging.format";

    private static volatile boolean configured = false;

    private LoggingConfigurator() {
    }

    /**
     * Applies the configuration once; later calls are ignored until {@link #reset()}.
     */
    public static synchronized void configure(final Config config) {
        if (configured) {
            return;
        }
        configured = true;
        if (!config.hasPath("logging")) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }
        final Config logging = config.getConfig("logging");
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        final String format = logging.hasPath("format") ? logging.getString("format") : "JSON";
        final String appender = "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT";
        context.putProperty(FORMAT_PROPERTY, appender);
        System.setProperty(FORMAT_PROPERTY, appender);

        if (logging.hasPath("default-level")) {
            final Level level = Level.toLevel(logging.getString("default-level"), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        }

        if (logging.hasPath("levels")) {
            for (final Map.Entry<String, ConfigValue> entry : logging.getObject("levels").entrySet()) {
                final String levelName = String.valueOf(entry.getValue().unwrapped());
                final Level level = Level.toLevel(levelName, null);
                if (level == null) {
                    LOGGER.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, entry.getKey());
                    continue;
                }
                context.getLogger(entry.getKey()).setLevel(level);
            }
        }
        LOGGER.debug("Logging configured: format={}", appender);
    }

    /**
     * Allows {@link #configure(Config)} to run again. Used by tests.
     */
    public static synchronized void reset() {
        configured = false;
    }
}
