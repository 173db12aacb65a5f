package org.pivotspec.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

@Tag("unit")
@DisplayName("LoggingConfigurator")
class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level rootLevel;
    private Level distinctLevel;
    private Level sessionLevel;

    @BeforeEach
    void rememberLevels() {
        rootLevel = logger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel();
        distinctLevel = logger("org.pivotspec.distinct").getLevel();
        sessionLevel = logger("org.pivotspec.session").getLevel();
    }

    @AfterEach
    void restoreLevels() {
        logger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        logger("org.pivotspec.distinct").setLevel(distinctLevel);
        logger("org.pivotspec.session").setLevel(sessionLevel);
    }

    @Test
    @DisplayName("Applies root and per-logger levels")
    void appliesLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString("""
            level = ERROR
            loggers {
              "org.pivotspec.distinct" = DEBUG
              org.pivotspec.session = TRACE
            }
            """));

        assertThat(logger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(logger("org.pivotspec.distinct").getLevel()).isEqualTo(Level.DEBUG);
        assertThat(logger("org.pivotspec.session").getLevel()).isEqualTo(Level.TRACE);
    }

    @Test
    @DisplayName("An empty section changes nothing")
    void emptySection() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(logger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(rootLevel);
    }

    @Test
    @DisplayName("Unknown levels are rejected")
    void unknownLevel() {
        assertThatThrownBy(() -> LoggingConfigurator.level("LOUD"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("LOUD");
        assertThat(LoggingConfigurator.level("warn")).isEqualTo(Level.WARN);
    }

    private Logger logger(String name) {
        return context.getLogger(name);
    }
}
