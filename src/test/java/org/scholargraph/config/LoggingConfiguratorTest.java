package org.scholargraph.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
class LoggingConfiguratorTest {

    private static final String PROBE_LOGGER = "org.scholargraph.config.probe";

    private String previousFormat;
    private Level previousRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        previousFormat = System.getProperty(LoggingConfigurator.FORMAT_PROPERTY);
        // Keep the test logback configuration in place.
        System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, "STDOUT_PLAIN");
        previousRootLevel = context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        if (previousFormat == null) {
            System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
        } else {
            System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, previousFormat);
        }
        context().getLogger(Logger.ROOT_LOGGER_NAME).setLevel(previousRootLevel);
        context().getLogger(PROBE_LOGGER).setLevel(null);
    }

    private static LoggerContext context() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    @Test
    void testConfigure_AppliesDefaultAndLoggerLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "WARN"
              levels {
                "org.scholargraph.config.probe" = "TRACE"
              }
            }
            """));

        assertThat(context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
        assertThat(context().getLogger(PROBE_LOGGER).getLevel()).isEqualTo(Level.TRACE);
        assertThat(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT_PLAIN");
    }

    @Test
    void testConfigure_OnlyFirstCallTakesEffect() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.scholargraph.config.probe\" = \"DEBUG\" }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.scholargraph.config.probe\" = \"ERROR\" }"));

        assertThat(context().getLogger(PROBE_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void testConfigure_UnknownLevelIsIgnored() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.scholargraph.config.probe\" = \"LOUD\" }"));

        assertThat(context().getLogger(PROBE_LOGGER).getLevel()).isNull();
    }

    @Test
    void testConfigure_WithoutLoggingBlockChangesNothing() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(previousRootLevel);
    }
}
