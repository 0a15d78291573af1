package org.tensorscript.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.tensorscript.junit.extensions.logging.ExpectLog;
import org.tensorscript.junit.extensions.logging.LogLevel;
import org.tensorscript.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String IRGEN_LOGGER = "org.tensorscript.compiler.frontend.irgen";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level rootLevel;
    private Level irgenLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        irgenLevel = context.getLogger(IRGEN_LOGGER).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(IRGEN_LOGGER).setLevel(irgenLevel);
        LoggingConfigurator.reset();
    }

    @Test
    void configure_shouldApplyDefaultAndLoggerLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            tensorscript.logging {
              default-level = "ERROR"
              levels {
                "org.tensorscript.compiler.frontend.irgen" = "DEBUG"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger(IRGEN_LOGGER).getLevel());
    }

    @Test
    void configure_shouldBeIdempotent() {
        // Given
        LoggingConfigurator.configure(ConfigFactory.parseString("tensorscript.logging.default-level = \"ERROR\""));

        // When
        LoggingConfigurator.configure(ConfigFactory.parseString("tensorscript.logging.default-level = \"TRACE\""));

        // Then
        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring unknown level 'LOUD' for logger 'org\\.tensorscript\\.compiler\\.frontend\\.irgen'\\.")
    void configure_shouldSkipUnknownLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            tensorscript.logging.levels {
              "org.tensorscript.compiler.frontend.irgen" = "LOUD"
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(irgenLevel, context.getLogger(IRGEN_LOGGER).getLevel());
    }

    @Test
    void configure_withoutLoggingSection_shouldLeaveLevelsUnchanged() {
        // When
        LoggingConfigurator.configure(ConfigFactory.empty());

        // Then
        assertEquals(rootLevel, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }
}
