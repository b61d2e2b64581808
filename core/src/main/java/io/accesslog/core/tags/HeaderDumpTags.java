package io.accesslog.core.tags;

import io.accesslog.core.engine.AccessLogFormat;
import io.accesslog.core.model.AccessLogTemplate;
import io.accesslog.core.model.Direction;
import io.accesslog.core.model.HttpHeaders;
import io.accesslog.core.spi.RequestTagEvaluator;
import io.accesslog.core.spi.ResponseTagEvaluator;
import java.util.StringJoiner;

/**
 * Ready-made custom tags that dump every header of a request or response as
 * {@code {name:value,name:value}}. Header names are lowercase; several values
 * for one name are joined with a comma.
 *
 * <pre>{@code
 * AccessLogFormat.builder("%r %{ALL_REQ_HEADERS}xi")
 *         .requestTag(HeaderDumpTags.ALL_REQ_HEADERS, HeaderDumpTags.requestHeaders())
 *         .build();
 * }</pre>
 */
public final class HeaderDumpTags {

    public static final String ALL_REQ_HEADERS = "ALL_REQ_HEADERS";
    public static final String ALL_RES_HEADERS = "ALL_RES_HEADERS";

    private HeaderDumpTags() {
        // utility class
    }

    public static RequestTagEvaluator requestHeaders() {
        return request -> dump(request.headers());
    }

    public static ResponseTagEvaluator responseHeaders() {
        return response -> dump(response.headers());
    }

    /** Registers both dump tags under their standard names. */
    public static AccessLogFormat.Builder registerAll(AccessLogFormat.Builder builder) {
        return builder.requestTag(ALL_REQ_HEADERS, requestHeaders())
                .responseTag(ALL_RES_HEADERS, responseHeaders());
    }

    /**
     * Registers only the dump tags {@code template} references, so a format
     * that never uses them does not trigger the unreferenced-tag warning.
     */
    public static AccessLogFormat.Builder registerReferenced(
            AccessLogFormat.Builder builder, AccessLogTemplate template) {
        if (template.customTags(Direction.REQUEST).contains(ALL_REQ_HEADERS)) {
            builder.requestTag(ALL_REQ_HEADERS, requestHeaders());
        }
        if (template.customTags(Direction.RESPONSE).contains(ALL_RES_HEADERS)) {
            builder.responseTag(ALL_RES_HEADERS, responseHeaders());
        }
        return builder;
    }

    static String dump(HttpHeaders headers) {
        StringJoiner pairs = new StringJoiner(",", "{", "}");
        headers.forEach((name, values) -> pairs.add(name + ":" + String.join(",", values)));
        return pairs.toString();
    }
}
