package io.accesslog.core.spi;

import io.accesslog.core.model.RequestView;

/**
 * Derives a correlation span from an inbound request. Invoked synchronously,
 * once per logged request, before the request is handled; the returned handle
 * stays active until the access log line has been emitted.
 *
 * <p>
 * Implementations MUST be thread-safe and non-blocking.
 */
@FunctionalInterface
public interface SpanFactory {

    /**
     * @param request read-only view of the request (response data is not yet known)
     * @return an active span handle, never {@code null}
     */
    SpanHandle open(RequestView request);
}
