package org.cachegrid.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.cachegrid.junit.extensions.logging.ExpectLog;
import org.cachegrid.junit.extensions.logging.LogLevel;
import org.cachegrid.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String TEST_LOGGER = "org.cachegrid.test.logging";

    private LoggerContext context;
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger(TEST_LOGGER).setLevel(null);
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
        LoggingConfigurator.reset();
    }

    @Test
    void appliesDefaultAndSpecificLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
            "logging { default-level = ERROR, levels { \"" + TEST_LOGGER + "\" = DEBUG } }"));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(TEST_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void selectsAppenderFromFormat() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.format = json"));

        assertThat(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT_JSON");
        assertThat(LoggingConfigurator.appenderFor("PLAIN")).isEqualTo("STDOUT_PLAIN");
        assertThat(LoggingConfigurator.appenderFor("something-else")).isEqualTo("STDOUT_PLAIN");
    }

    @Test
    void isIdempotentUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + TEST_LOGGER + "\" = ERROR }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + TEST_LOGGER + "\" = DEBUG }"));
        assertThat(context.getLogger(TEST_LOGGER).getLevel()).isEqualTo(Level.ERROR);

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + TEST_LOGGER + "\" = DEBUG }"));
        assertThat(context.getLogger(TEST_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring unknown log level 'LOUD'.*")
    void unknownLevelIsIgnoredWithWarning() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + TEST_LOGGER + "\" = LOUD }"));

        assertThat(context.getLogger(TEST_LOGGER).getLevel()).isNull();
    }
}
