package org.proclient.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
        context.getLogger("org.proclient.contract").setLevel(null);
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.WARN);
    }

    @Test
    void configure_withJsonFormat_switchesToTheJsonAppender() {
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "JSON"
              default-level = "INFO"
            }
            """);

        LoggingConfigurator.configure(config);

        assertThat(context.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo(LoggingConfigurator.JSON_APPENDER);
        final ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        assertThat(root.getAppender(LoggingConfigurator.JSON_APPENDER)).isNotNull();
        assertThat(root.getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    void configure_appliesSpecificLevelsAndIgnoresUnknownOnes() {
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              levels {
                "org.proclient.contract" = "DEBUG"
                "org.proclient.state" = "LOUD"
              }
            }
            """);

        LoggingConfigurator.configure(config);

        assertThat(context.getLogger("org.proclient.contract").getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger("org.proclient.state").getLevel()).isNull();
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender(LoggingConfigurator.PLAIN_APPENDER))
            .isNotNull();
    }

    @Test
    void configure_runsOnlyOnce() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"ERROR\""));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"TRACE\""));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
    }
}
