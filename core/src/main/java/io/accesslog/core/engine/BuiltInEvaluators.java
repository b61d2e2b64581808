package io.accesslog.core.engine;

import io.accesslog.core.model.BuiltInDirective;
import io.accesslog.core.model.RenderContext;
import io.accesslog.core.model.RequestView;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Pure functions resolving each {@link BuiltInDirective} against a
 * {@link RenderContext}.
 *
 * <p>
 * Absent optional values render {@value #PLACEHOLDER}, except the HTTP
 * version, which renders {@code ?}.
 */
public final class BuiltInEvaluators {

    /** Rendered for any directive that has nothing to print. */
    public static final String PLACEHOLDER = "-";

    private static final String UNKNOWN_VERSION = "?";

    /** Second precision, no zone suffix, always UTC. */
    static final DateTimeFormatter REQUEST_TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss", Locale.ROOT).withZone(ZoneOffset.UTC);

    private static final Map<BuiltInDirective, Function<RenderContext, String>> EVALUATORS = createEvaluators();

    private BuiltInEvaluators() {
        // utility class
    }

    /**
     * Resolves a built-in directive.
     *
     * @param directive the directive
     * @param ctx       the exchange snapshot
     * @return the rendered value, never {@code null}
     */
    public static String evaluate(BuiltInDirective directive, RenderContext ctx) {
        return EVALUATORS.get(directive).apply(ctx);
    }

    /**
     * Formats a request line: {@code METHOD PATH[?QUERY] VERSION}.
     */
    static String requestLine(RequestView request) {
        StringBuilder line = new StringBuilder(request.method()).append(' ').append(request.path());
        if (request.hasQuery()) {
            line.append('?').append(request.queryString());
        }
        return line.append(' ').append(orDefault(request.httpVersion(), UNKNOWN_VERSION)).toString();
    }

    /** Formats nanoseconds scaled by {@code divisor} with six fractional digits. */
    static String sixDigits(long nanos, double divisor) {
        return String.format(Locale.ROOT, "%.6f", nanos / divisor);
    }

    private static Map<BuiltInDirective, Function<RenderContext, String>> createEvaluators() {
        Map<BuiltInDirective, Function<RenderContext, String>> map = new EnumMap<>(BuiltInDirective.class);
        map.put(BuiltInDirective.REQUEST_TIME, ctx -> REQUEST_TIME_FORMAT.format(ctx.startTime()));
        map.put(BuiltInDirective.REMOTE_ADDRESS, ctx -> orPlaceholder(ctx.request().remoteAddress()));
        map.put(BuiltInDirective.PEER_ADDRESS, ctx -> orPlaceholder(ctx.request().peerAddress()));
        map.put(BuiltInDirective.REQUEST_LINE, ctx -> requestLine(ctx.request()));
        map.put(BuiltInDirective.METHOD, ctx -> ctx.request().method());
        map.put(BuiltInDirective.URL_PATH, ctx -> ctx.request().path());
        map.put(
                BuiltInDirective.QUERY_STRING,
                ctx -> ctx.request().hasQuery() ? ctx.request().queryString() : PLACEHOLDER);
        map.put(BuiltInDirective.HTTP_VERSION, ctx -> orDefault(ctx.request().httpVersion(), UNKNOWN_VERSION));
        map.put(BuiltInDirective.STATUS, ctx -> Integer.toString(ctx.response().status()));
        map.put(BuiltInDirective.BODY_BYTES, ctx -> Long.toString(ctx.response().bodyBytes()));
        map.put(BuiltInDirective.ELAPSED_SECONDS, ctx -> sixDigits(ctx.elapsed().toNanos(), 1e9));
        map.put(BuiltInDirective.ELAPSED_MILLIS, ctx -> sixDigits(ctx.elapsed().toNanos(), 1e6));

        if (map.size() != BuiltInDirective.values().length) {
            throw new IllegalStateException("Missing evaluator for a built-in directive: " + map.keySet());
        }
        return Collections.unmodifiableMap(map);
    }

    private static String orPlaceholder(String value) {
        return orDefault(value, PLACEHOLDER);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }
}
