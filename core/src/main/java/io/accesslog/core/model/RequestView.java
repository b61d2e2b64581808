package io.accesslog.core.model;

import java.util.Objects;

/**
 * Read-only view of the inbound request, as seen by built-in directives and
 * custom request-tag evaluators.
 *
 * @param method        HTTP method, e.g. {@code GET}
 * @param path          request path without query string
 * @param queryString   raw query string without leading {@code ?}, nullable
 * @param httpVersion   protocol string, e.g. {@code HTTP/1.1}, nullable
 * @param remoteAddress client address, honouring forwarding headers, nullable
 * @param peerAddress   address of the socket peer, nullable
 * @param headers       request headers
 */
public record RequestView(
        String method,
        String path,
        String queryString,
        String httpVersion,
        String remoteAddress,
        String peerAddress,
        HttpHeaders headers) {

    public RequestView {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        headers = headers != null ? headers : HttpHeaders.empty();
    }

    /** Returns {@code true} if the request carried a query string. */
    public boolean hasQuery() {
        return queryString != null && !queryString.isEmpty();
    }
}
