package org.empiresim.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.empiresim.junit.extensions.logging.ExpectLog;
import org.empiresim.junit.extensions.logging.LogLevel;
import org.empiresim.junit.extensions.logging.LogWatchExtension;
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

    private static final String SAMPLE_LOGGER = "org.empiresim.sample";
    private static final String OTHER_LOGGER = "org.empiresim.other";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(SAMPLE_LOGGER).setLevel(null);
        context.getLogger(OTHER_LOGGER).setLevel(null);
        context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.INFO);
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
        LoggingConfigurator.reset();
    }

    @Test
    void configure_appliesFormatAndLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
            logging {
              format = PLAIN
              default-level = INFO
              levels { "org.empiresim.sample" = DEBUG }
            }
            """));

        assertThat(context.getLogger(SAMPLE_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT_PLAIN");
        assertThat(context.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT_PLAIN");
    }

    @Test
    void configure_selectsJsonAppenderByDefault() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = INFO"));

        assertThat(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring unknown level 'LOUD' for logger 'org.empiresim.other'")
    void configure_ignoresUnknownLevel() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
            logging.levels {
              "org.empiresim.sample" = WARN
              "org.empiresim.other" = LOUD
            }
            """));

        assertThat(context.getLogger(SAMPLE_LOGGER).getLevel()).isEqualTo(Level.WARN);
        assertThat(context.getLogger(OTHER_LOGGER).getLevel()).isNull();
    }

    @Test
    void configure_runsOnlyOnce() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.empiresim.sample\" = ERROR }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.empiresim.sample\" = TRACE }"));

        assertThat(context.getLogger(SAMPLE_LOGGER).getLevel()).isEqualTo(Level.ERROR);
    }
}
