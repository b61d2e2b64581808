package io.accesslog.core.spi;

import io.accesslog.core.model.RequestView;

/**
 * Resolves a custom request tag ({@code %{NAME}xi}) to the text written into
 * the log line.
 *
 * <p>
 * Implementations MUST be thread-safe: one evaluator is shared by every
 * concurrent request. By convention they return {@code "-"} rather than an
 * empty string when they have nothing to print. A {@code null} result or a
 * thrown exception is rendered as {@code -}.
 */
@FunctionalInterface
public interface RequestTagEvaluator {

    /**
     * @param request read-only view of the request
     * @return the text to log
     */
    String evaluate(RequestView request);
}
