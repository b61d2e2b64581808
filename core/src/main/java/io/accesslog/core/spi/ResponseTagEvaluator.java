package io.accesslog.core.spi;

import io.accesslog.core.model.ResponseView;

/**
 * Resolves a custom response tag ({@code %{NAME}xo}) to the text written into
 * the log line. Same thread-safety and placeholder rules as
 * {@link RequestTagEvaluator}.
 */
@FunctionalInterface
public interface ResponseTagEvaluator {

    /**
     * @param response read-only view of the response
     * @return the text to log
     */
    String evaluate(ResponseView response);
}
