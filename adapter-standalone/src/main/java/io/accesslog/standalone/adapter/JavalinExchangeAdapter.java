package io.accesslog.standalone.adapter;

import io.accesslog.core.model.HttpHeaders;
import io.accesslog.core.model.RequestView;
import io.accesslog.core.model.ResponseView;
import io.javalin.http.Context;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the read-only {@link RequestView} / {@link ResponseView} snapshots
 * the renderer consumes from a Javalin {@link Context}.
 *
 * <p>
 * All header values are copied, so later mutation of the servlet request or
 * response does not leak into a view. Header names are normalized to
 * lowercase.
 *
 * <p>
 * The remote address honours {@code X-Forwarded-For} (first hop) and
 * {@code Forwarded: for=}; the peer address is always the socket peer.
 *
 * <p>
 * The response body size is taken while the after-handler runs, before
 * Javalin writes the body: a declared {@code Content-Length} wins, otherwise
 * it is the UTF-8 length of {@code ctx.result()}. It is therefore the size
 * before any compression, and a {@code HEAD} response reports the size of the
 * body it would have sent rather than the bytes on the wire.
 *
 * <p>
 * This class is thread-safe: all state is local to each method invocation.
 */
public final class JavalinExchangeAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(JavalinExchangeAdapter.class);

    static final String X_FORWARDED_FOR = "X-Forwarded-For";
    static final String FORWARDED = "Forwarded";

    /**
     * Snapshots the request side of the exchange.
     *
     * @param ctx the Javalin request context
     * @return an immutable request view
     */
    public RequestView wrapRequest(Context ctx) {
        HttpHeaders headers = requestHeaders(ctx);
        String queryString = ctx.queryString();
        RequestView view = new RequestView(
                ctx.method().name(),
                ctx.path(),
                queryString,
                ctx.req().getProtocol(),
                remoteAddress(headers, ctx.ip()),
                peerAddress(ctx),
                headers);
        LOG.debug("wrapRequest: {} {} (headers={})", view.method(), view.path(), headers.names().size());
        return view;
    }

    /**
     * Snapshots the response side of the exchange. Must run after the
     * endpoint handler has set status and result.
     *
     * @param ctx the Javalin context
     * @return an immutable response view
     */
    public ResponseView wrapResponse(Context ctx) {
        Map<String, List<String>> headersAll = new LinkedHashMap<>();
        for (String name : ctx.res().getHeaderNames()) {
            headersAll.putIfAbsent(name.toLowerCase(Locale.ROOT), new ArrayList<>(ctx.res().getHeaders(name)));
        }
        HttpHeaders headers = HttpHeaders.ofMulti(headersAll);
        int status = ctx.statusCode();
        long bodyBytes = bodyBytes(ctx, headers);
        LOG.debug("wrapResponse: {} {} → {} (body={} bytes)", ctx.method().name(), ctx.path(), status, bodyBytes);
        return new ResponseView(status, bodyBytes, headers);
    }

    /**
     * Client address: first {@code X-Forwarded-For} hop, else the first
     * {@code for=} of {@code Forwarded}, else {@code fallback}.
     */
    static String remoteAddress(HttpHeaders headers, String fallback) {
        String xff = headers.first(X_FORWARDED_FOR);
        if (xff != null) {
            String first = xff.split(",", 2)[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String forwarded = headers.first(FORWARDED);
        if (forwarded != null) {
            String forValue = forwardedFor(forwarded);
            if (forValue != null) {
                return forValue;
            }
        }
        return fallback;
    }

    /** Extracts the first {@code for=} parameter of an RFC 7239 header, unquoted. */
    static String forwardedFor(String forwarded) {
        for (String element : forwarded.split(",")) {
            for (String pair : element.split(";")) {
                String trimmed = pair.trim();
                int eq = trimmed.indexOf('=');
                if (eq > 0 && "for".equalsIgnoreCase(trimmed.substring(0, eq).trim())) {
                    String value = trimmed.substring(eq + 1).trim();
                    if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                        value = value.substring(1, value.length() - 1);
                    }
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }

    private static String peerAddress(Context ctx) {
        String address = ctx.req().getRemoteAddr();
        if (address == null || address.isEmpty()) {
            return null;
        }
        int port = ctx.req().getRemotePort();
        return port > 0 ? address + ":" + port : address;
    }

    /** Declared {@code Content-Length} if valid, else the size of the result body. */
    private static long bodyBytes(Context ctx, HttpHeaders headers) {
        String contentLength = headers.first("content-length");
        if (contentLength != null) {
            try {
                long declared = Long.parseLong(contentLength.trim());
                if (declared >= 0) {
                    return declared;
                }
            } catch (NumberFormatException e) {
                LOG.debug("Ignoring malformed Content-Length '{}'", contentLength);
            }
        }
        String result = ctx.result();
        return result != null ? result.getBytes(StandardCharsets.UTF_8).length : 0;
    }

    private static HttpHeaders requestHeaders(Context ctx) {
        Map<String, List<String>> headersAll = new LinkedHashMap<>();
        Enumeration<String> headerNames = ctx.req().getHeaderNames();
        if (headerNames != null) {
            while (headerNames.hasMoreElements()) {
                String name = headerNames.nextElement();
                Enumeration<String> values = ctx.req().getHeaders(name);
                List<String> valueList = new ArrayList<>();
                if (values != null) {
                    while (values.hasMoreElements()) {
                        valueList.add(values.nextElement());
                    }
                }
                headersAll.computeIfAbsent(name.toLowerCase(Locale.ROOT), k -> new ArrayList<>())
                        .addAll(valueList);
            }
        }
        return HttpHeaders.ofMulti(headersAll);
    }
}
