package io.accesslog.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of one request/response exchange, used to resolve every directive
 * of one log line.
 *
 * <p>
 * Assembled by the caller once the response is known, consumed by a single
 * render call and then discarded. Timing is measured by the caller; the engine
 * only formats it.
 *
 * @param request   the request view
 * @param response  the response view
 * @param startTime wall-clock instant at which handling started
 * @param elapsed   time between start of handling and response-ready
 */
public record RenderContext(RequestView request, ResponseView response, Instant startTime, Duration elapsed) {

    public RenderContext {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(response, "response must not be null");
        Objects.requireNonNull(startTime, "startTime must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
        if (elapsed.isNegative()) {
            throw new IllegalArgumentException("elapsed must not be negative, got: " + elapsed);
        }
    }
}
