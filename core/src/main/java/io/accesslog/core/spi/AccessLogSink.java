package io.accesslog.core.spi;

/**
 * Receives finished access log lines. Owns the actual output (console, file,
 * network) and any line prefix such as a wall-clock timestamp or level.
 *
 * <p>
 * Called on the request thread while the request's span, if any, is active.
 * Implementations MUST be thread-safe.
 */
@FunctionalInterface
public interface AccessLogSink {

    void emit(String line);
}
