package io.accesslog.standalone.logging;

import io.accesslog.core.model.RequestView;
import io.accesslog.core.spi.SpanFactory;
import io.accesslog.core.spi.SpanHandle;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.MDC;

/**
 * Correlation span backed by the SLF4J {@link MDC}.
 *
 * <p>
 * The span id is the value of a configurable request header (default
 * {@code X-Request-ID}) or, when the header is absent, a random UUID without
 * dashes. It is stored under {@value #MDC_REQUEST_ID} for the lifetime of the
 * handle; closing the handle restores whatever value was there before.
 *
 * <p>
 * MDC is thread-local: the handle must be closed on the thread that opened it.
 */
public final class MdcSpanFactory implements SpanFactory {

    /** MDC key for the request correlation id. */
    public static final String MDC_REQUEST_ID = "requestId";

    private final String headerName;

    public MdcSpanFactory(String headerName) {
        this.headerName = Objects.requireNonNull(headerName, "headerName must not be null");
    }

    @Override
    public SpanHandle open(RequestView request) {
        String requestId = request.headers().first(headerName);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString().replace("-", "");
        }
        String previous = MDC.get(MDC_REQUEST_ID);
        MDC.put(MDC_REQUEST_ID, requestId);
        return new MdcSpanHandle(previous);
    }

    public String headerName() {
        return headerName;
    }

    private static final class MdcSpanHandle implements SpanHandle {

        private final String previous;
        private final AtomicBoolean closed = new AtomicBoolean();

        MdcSpanHandle(String previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            if (previous != null) {
                MDC.put(MDC_REQUEST_ID, previous);
            } else {
                MDC.remove(MDC_REQUEST_ID);
            }
        }
    }
}
