package org.proclient.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Configures Logback from the HOCON configuration.
 * <p>
 * All log output goes to stderr so that JSON results on stdout stay parseable.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   format = "PLAIN"  # "PLAIN" or "JSON"
 *   default-level = "WARN"
 *   levels {
 *     "org.proclient.contract" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    static final String FORMAT_PROPERTY = "pro.logging.format";
    static final String PLAIN_APPENDER = "STDERR_PLAIN";
    static final String JSON_APPENDER = "STDERR";
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
        // Private constructor to prevent instantiation
    }

    /**
     * Applies the logging settings. Calling it more than once has no additional effect.
     *
     * @param config The client configuration.
     */
    public static synchronized void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        loggingConfigured = true;

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }

        try {
            final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

            configureFormat(loggingConfig, context);
            configureDefaultLevel(loggingConfig, context);
            configureSpecificLevels(loggingConfig, context);

            LOGGER.debug("Logging configuration applied successfully.");
        } catch (final RuntimeException | JoranException e) {
            LOGGER.error("Failed to configure logging, using Logback defaults.", e);
        }
    }

    /**
     * Selects the plain or JSON appender and reloads logback.xml so the choice takes effect.
     */
    private static void configureFormat(final Config loggingConfig, final LoggerContext context) throws JoranException {
        final String format = loggingConfig.hasPath(FORMAT_KEY) ? loggingConfig.getString(FORMAT_KEY) : "PLAIN";
        final String appender = "JSON".equalsIgnoreCase(format) ? JSON_APPENDER : PLAIN_APPENDER;
        if (appender.equals(context.getProperty(FORMAT_PROPERTY))) {
            return;
        }

        System.setProperty(FORMAT_PROPERTY, appender);
        final URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        context.putProperty(FORMAT_PROPERTY, appender);
        configurator.doConfigure(configUrl);
        LOGGER.debug("Configured logging format: {}", format);
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            return;
        }
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = entry.getValue().unwrapped().toString();
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
        }
    }

    /**
     * Resets the configured flag. Used by tests.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }
}
