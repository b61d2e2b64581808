package io.accesslog.standalone.server;

import io.accesslog.core.engine.AccessLogFormat;
import io.accesslog.core.model.RenderContext;
import io.accesslog.core.model.RequestView;
import io.accesslog.core.model.ResponseView;
import io.accesslog.core.spi.AccessLogSink;
import io.accesslog.core.spi.SpanHandle;
import io.accesslog.standalone.adapter.JavalinExchangeAdapter;
import io.javalin.Javalin;
import io.javalin.http.Context;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps every Javalin route with access logging.
 *
 * <p>
 * The before-handler records the start instant and {@link System#nanoTime()},
 * snapshots the request and opens the span. The after-handler snapshots the
 * response, renders the line, hands it to the sink and then closes the span,
 * so the sink always runs inside the request's span. Excluded paths skip both
 * steps.
 *
 * <p>
 * Logging never fails a request: render or sink failures are logged at WARN.
 */
public final class AccessLogHandlers {

    private static final Logger LOG = LoggerFactory.getLogger(AccessLogHandlers.class);

    static final String ATTR_START_NANOS = "accesslog.startNanos";
    static final String ATTR_START_TIME = "accesslog.startTime";
    static final String ATTR_REQUEST = "accesslog.request";
    static final String ATTR_SPAN = "accesslog.span";

    private final AccessLogFormat format;
    private final JavalinExchangeAdapter adapter;
    private final AccessLogSink sink;

    public AccessLogHandlers(AccessLogFormat format, JavalinExchangeAdapter adapter, AccessLogSink sink) {
        this.format = Objects.requireNonNull(format, "format must not be null");
        this.adapter = Objects.requireNonNull(adapter, "adapter must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    /** Registers the before/after pair on every path of {@code app}. */
    public void register(Javalin app) {
        app.before(this::before);
        app.after(this::after);
    }

    void before(Context ctx) {
        if (format.isExcluded(ctx.path())) {
            return;
        }
        ctx.attribute(ATTR_START_NANOS, System.nanoTime());
        ctx.attribute(ATTR_START_TIME, Instant.now());
        RequestView request = adapter.wrapRequest(ctx);
        ctx.attribute(ATTR_REQUEST, request);
        ctx.attribute(ATTR_SPAN, format.openSpan(request));
    }

    void after(Context ctx) {
        Long startNanos = ctx.attribute(ATTR_START_NANOS);
        if (startNanos == null) {
            // excluded, or the before-handler never ran
            return;
        }
        Duration elapsed = Duration.ofNanos(Math.max(0L, System.nanoTime() - startNanos));
        SpanHandle span = ctx.attribute(ATTR_SPAN);
        try {
            Instant startTime = ctx.attribute(ATTR_START_TIME);
            RequestView request = ctx.attribute(ATTR_REQUEST);
            ResponseView response = adapter.wrapResponse(ctx);
            String line = format.render(new RenderContext(request, response, startTime, elapsed));
            sink.emit(line);
        } catch (RuntimeException e) {
            LOG.warn("Failed to write access log for {} {}", ctx.method().name(), ctx.path(), e);
        } finally {
            if (span != null) {
                span.close();
            }
        }
    }

    public AccessLogFormat format() {
        return format;
    }
}
