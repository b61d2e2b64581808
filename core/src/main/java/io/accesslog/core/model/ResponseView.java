package io.accesslog.core.model;

/**
 * Read-only view of the outbound response.
 *
 * @param status    HTTP status code
 * @param bodyBytes size of the response body in bytes, excluding headers
 * @param headers   response headers
 */
public record ResponseView(int status, long bodyBytes, HttpHeaders headers) {

    public ResponseView {
        if (bodyBytes < 0) {
            throw new IllegalArgumentException("bodyBytes must not be negative, got: " + bodyBytes);
        }
        headers = headers != null ? headers : HttpHeaders.empty();
    }
}
