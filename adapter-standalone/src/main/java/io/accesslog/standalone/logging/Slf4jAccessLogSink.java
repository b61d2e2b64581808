package io.accesslog.standalone.logging;

import io.accesslog.core.spi.AccessLogSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each access log line at INFO to a dedicated SLF4J logger, so the
 * backend decides on timestamp prefix, encoder and destination. MDC entries
 * set by the request's span are visible to the appender.
 */
public final class Slf4jAccessLogSink implements AccessLogSink {

    public static final String DEFAULT_LOGGER_NAME = "access-log";

    private final Logger logger;

    public Slf4jAccessLogSink() {
        this(DEFAULT_LOGGER_NAME);
    }

    public Slf4jAccessLogSink(String loggerName) {
        this.logger = LoggerFactory.getLogger(loggerName);
    }

    @Override
    public void emit(String line) {
        logger.info(line);
    }

    public String loggerName() {
        return logger.getName();
    }
}
