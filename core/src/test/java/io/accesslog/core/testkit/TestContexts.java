package io.accesslog.core.testkit;

import io.accesslog.core.model.HttpHeaders;
import io.accesslog.core.model.RenderContext;
import io.accesslog.core.model.RequestView;
import io.accesslog.core.model.ResponseView;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Factory helpers for render contexts used across engine tests. */
public final class TestContexts {

    public static final Instant START = Instant.parse("2024-03-05T14:07:09.123Z");

    private TestContexts() {}

    public static RequestView request(String method, String path) {
        return new RequestView(method, path, null, "HTTP/1.1", "10.0.0.1", "10.0.0.1:54321", HttpHeaders.empty());
    }

    public static RequestView request(String method, String path, String query, Map<String, List<String>> headers) {
        return new RequestView(
                method, path, query, "HTTP/1.1", "10.0.0.1", "10.0.0.1:54321", HttpHeaders.ofMulti(headers));
    }

    public static ResponseView response(int status, long bodyBytes) {
        return new ResponseView(status, bodyBytes, HttpHeaders.empty());
    }

    public static ResponseView response(int status, long bodyBytes, Map<String, List<String>> headers) {
        return new ResponseView(status, bodyBytes, HttpHeaders.ofMulti(headers));
    }

    public static RenderContext context(RequestView request, ResponseView response, Duration elapsed) {
        return new RenderContext(request, response, START, elapsed);
    }

    /** GET /index, 200, 12 bytes, 278 µs. */
    public static RenderContext simple() {
        return context(request("GET", "/index"), response(200, 12), Duration.ofNanos(278_000));
    }
}
