package org.scallopsim.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.scallopsim.junit.logging.ExpectLog;
import org.scallopsim.junit.logging.LogLevel;
import org.scallopsim.junit.logging.LogWatchExtension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        // restore the shipped defaults for the tests that follow
        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.defaultReference());
        LoggingConfigurator.reset();
    }

    @Test
    void configure_withPlainFormat_shouldAttachPlainAppender() {
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "INFO"
            }
            """);

        LoggingConfigurator.configure(config);

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        assertEquals("STDOUT_PLAIN", context.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        final Appender<?> appender = context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDOUT_PLAIN");
        assertNotNull(appender, "Root logger should use the plain appender");
        assertTrue(appender instanceof ConsoleAppender);
    }

    @Test
    void configure_withJsonFormat_shouldAttachJsonAppender() {
        final Config config = ConfigFactory.parseString("logging { format = \"JSON\" }");

        LoggingConfigurator.configure(config);

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        assertEquals("STDOUT", context.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertNotNull(context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDOUT"));
        assertNull(context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDOUT_PLAIN"));
    }

    @Test
    void configure_shouldApplyDefaultAndSpecificLevels() {
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "WARN"
              levels {
                "org.scallopsim.runtime.Simulation" = "DEBUG"
                "org.scallopsim.runtime.output" = "ERROR"
              }
            }
            """);

        LoggingConfigurator.configure(config);

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        assertEquals(Level.WARN, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger("org.scallopsim.runtime.Simulation").getLevel());
        assertEquals(Level.ERROR, context.getLogger("org.scallopsim.runtime.output").getLevel());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring unknown level 'LOUD' for logger 'org.scallopsim.cli'")
    void configure_shouldIgnoreUnknownLevel() {
        final Config config = ConfigFactory.parseString("""
            logging {
              levels {
                "org.scallopsim.cli" = "LOUD"
              }
            }
            """);

        assertDoesNotThrow(() -> LoggingConfigurator.configure(config));

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        assertNull(context.getLogger("org.scallopsim.cli").getLevel());
    }

    @Test
    void configure_shouldBeIdempotent() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { default-level = \"ERROR\" }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { default-level = \"TRACE\" }"));

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }
}
