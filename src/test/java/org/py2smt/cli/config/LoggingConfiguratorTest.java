package org.py2smt.cli.config;

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

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        originalRootLevel = context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { format = \"PLAIN\" }"));
        LoggingConfigurator.reset();
        context().getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context().getLogger("org.py2smt.translator").setLevel(null);
    }

    private static LoggerContext context() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    @Test
    void configure_withPlainFormat_shouldSelectPlainAppender() {
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "INFO"
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals("STDOUT_PLAIN", context().getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertEquals(Level.INFO, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void configure_withJsonFormat_shouldSelectJsonAppender() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { format = \"JSON\" }"));

        assertEquals("STDOUT", context().getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertNotNull(context().getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDOUT"));
    }

    @Test
    void configure_shouldApplySpecificLevels() {
        final Config config = ConfigFactory.parseString("""
            logging {
              levels {
                "org.py2smt.translator" = "DEBUG"
              }
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals(Level.DEBUG, context().getLogger("org.py2smt.translator").getLevel());
    }

    @Test
    void configure_isIdempotentUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { default-level = \"ERROR\" }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { default-level = \"DEBUG\" }"));

        assertEquals(Level.ERROR, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void appenderFor_shouldMapFormatNames() {
        assertEquals("STDOUT_PLAIN", LoggingConfigurator.appenderFor("plain"));
        assertEquals("STDOUT", LoggingConfigurator.appenderFor("JSON"));
    }
}
