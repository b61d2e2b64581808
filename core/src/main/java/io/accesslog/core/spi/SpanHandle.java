package io.accesslog.core.spi;

/**
 * Opaque correlation context produced by a {@link SpanFactory}. The engine
 * never looks inside; it only guarantees the access log line is emitted
 * before {@link #close()} is called.
 */
public interface SpanHandle extends AutoCloseable {

    /** Handle used when no span factory is configured. */
    SpanHandle NONE = () -> {};

    /** Deactivates the span. Must be idempotent. */
    @Override
    void close();
}
