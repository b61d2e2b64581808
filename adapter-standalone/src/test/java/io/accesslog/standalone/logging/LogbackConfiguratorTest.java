package io.accesslog.standalone.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogbackConfiguratorTest {

    private static Logger root() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        return context.getLogger(Logger.ROOT_LOGGER_NAME);
    }

    private static final String ACCESS_LOGGER = "configurator-test-access";

    @AfterEach
    void restore() {
        LogbackConfigurator.configure("text", "INFO");
        Logger access = (Logger) LoggerFactory.getLogger(ACCESS_LOGGER);
        access.detachAndStopAllAppenders();
        access.setAdditive(true);
        access.setLevel(null);
    }

    @Test
    void jsonFormatInstallsJsonEncoder() {
        LogbackConfigurator.configure("json", "DEBUG");

        Appender<ILoggingEvent> appender = root().getAppender("STDOUT");
        assertThat(root().getLevel()).isEqualTo(Level.DEBUG);
        assertThat(appender).isInstanceOf(ConsoleAppender.class);
        assertThat(((ConsoleAppender<ILoggingEvent>) appender).getEncoder()).isInstanceOf(JsonEncoder.class);
    }

    @Test
    void textFormatUsesPatternWithRequestId() {
        LogbackConfigurator.configure("text", "WARN");

        ConsoleAppender<ILoggingEvent> appender = (ConsoleAppender<ILoggingEvent>) root().getAppender("STDOUT");
        assertThat(root().getLevel()).isEqualTo(Level.WARN);
        assertThat(appender.getEncoder()).isInstanceOf(PatternLayoutEncoder.class);
        assertThat(((PatternLayoutEncoder) appender.getEncoder()).getPattern()).contains("%X{requestId");
    }

    @Test
    void unknownLevelFallsBackToInfo() {
        LogbackConfigurator.configure("text", "chatty");

        assertThat(root().getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    void accessLoggerGetsOwnNonAdditiveAppender() {
        LogbackConfigurator.configure("text", "WARN", ACCESS_LOGGER);

        Logger access = (Logger) LoggerFactory.getLogger(ACCESS_LOGGER);
        ConsoleAppender<ILoggingEvent> appender = (ConsoleAppender<ILoggingEvent>) access.getAppender("ACCESS");
        assertThat(access.isAdditive()).isFalse();
        assertThat(access.getLevel()).isEqualTo(Level.INFO);
        assertThat(((PatternLayoutEncoder) appender.getEncoder()).getPattern())
                .isEqualTo(LogbackConfigurator.ACCESS_PATTERN)
                .doesNotContain("%logger");
    }

    @Test
    void accessLoggerUsesJsonEncoderInJsonMode() {
        LogbackConfigurator.configure("json", "INFO", ACCESS_LOGGER);

        Logger access = (Logger) LoggerFactory.getLogger(ACCESS_LOGGER);
        ConsoleAppender<ILoggingEvent> appender = (ConsoleAppender<ILoggingEvent>) access.getAppender("ACCESS");
        assertThat(appender.getEncoder()).isInstanceOf(JsonEncoder.class);
    }
}
