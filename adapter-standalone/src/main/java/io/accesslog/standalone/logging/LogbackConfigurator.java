package io.accesslog.standalone.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import org.slf4j.LoggerFactory;

/**
 * Programmatic Logback setup for the standalone server.
 *
 * <p>
 * Two console appenders are installed after config is loaded:
 * <ul>
 * <li>{@value #ROOT_APPENDER} on the root logger for application
 * diagnostics, at {@code logging.level}</li>
 * <li>{@value #ACCESS_APPENDER} on the access log logger only, always at
 * INFO and not additive, so an access line is printed once, as rendered,
 * prefixed only by a timestamp and the request id</li>
 * </ul>
 * With {@code logging.format: json} both use Logback's {@link JsonEncoder},
 * which carries MDC entries such as {@code requestId} as fields.
 */
public final class LogbackConfigurator {

    static final String ROOT_APPENDER = "STDOUT";
    static final String ACCESS_APPENDER = "ACCESS";

    /** Diagnostic lines: time, level, request id, logger, message. */
    static final String TEXT_PATTERN =
            "%d{yyyy-MM-dd'T'HH:mm:ss.SSS} %-5level [%X{requestId:-}] %logger{36} - %msg%n";

    /** Access lines: the rendered line is the message. */
    static final String ACCESS_PATTERN = "%d{yyyy-MM-dd'T'HH:mm:ss.SSS} [%X{requestId:-}] %msg%n";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Configures the root logger only.
     *
     * @param format "json" for structured output, anything else for text
     * @param level  root log level (TRACE, DEBUG, INFO, WARN, ERROR)
     */
    public static void configure(String format, String level) {
        configure(format, level, null);
    }

    /**
     * Configures the root logger and, when {@code accessLoggerName} is given,
     * a dedicated appender for access log lines.
     *
     * @param format           "json" for structured output, anything else for text
     * @param level            root log level; unknown values fall back to INFO
     * @param accessLoggerName logger the access log sink writes to, or {@code null}
     */
    public static void configure(String format, String level, String accessLoggerName) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        boolean json = "json".equalsIgnoreCase(format);

        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.setLevel(Level.toLevel(level, Level.INFO));
        rootLogger.detachAndStopAllAppenders();
        rootLogger.addAppender(consoleAppender(context, ROOT_APPENDER, json, TEXT_PATTERN));

        if (accessLoggerName != null) {
            Logger accessLogger = context.getLogger(accessLoggerName);
            accessLogger.detachAndStopAllAppenders();
            accessLogger.setLevel(Level.INFO);
            accessLogger.setAdditive(false);
            accessLogger.addAppender(consoleAppender(context, ACCESS_APPENDER, json, ACCESS_PATTERN));
        }

        // Keep Jetty/Javalin noise suppressed
        context.getLogger("org.eclipse.jetty").setLevel(Level.WARN);
        context.getLogger("io.javalin").setLevel(Level.INFO);
    }

    private static ConsoleAppender<ILoggingEvent> consoleAppender(
            LoggerContext context, String name, boolean json, String pattern) {
        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(name);
        appender.setEncoder(json ? jsonEncoder(context) : patternEncoder(context, pattern));
        appender.start();
        return appender;
    }

    private static Encoder<ILoggingEvent> jsonEncoder(LoggerContext context) {
        JsonEncoder encoder = new JsonEncoder();
        encoder.setContext(context);
        encoder.start();
        return encoder;
    }

    private static Encoder<ILoggingEvent> patternEncoder(LoggerContext context, String pattern) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(pattern);
        encoder.start();
        return encoder;
    }
}
