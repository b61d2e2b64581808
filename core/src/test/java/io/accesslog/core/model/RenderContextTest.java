package io.accesslog.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

/** Validation rules of the exchange snapshot records. */
class RenderContextTest {

    private static final RequestView REQUEST = new RequestView("GET", "/", null, null, null, null, null);
    private static final ResponseView RESPONSE = new ResponseView(200, 0, null);

    @Test
    void nullHeadersBecomeEmpty() {
        assertThat(REQUEST.headers()).isSameAs(HttpHeaders.empty());
        assertThat(RESPONSE.headers()).isSameAs(HttpHeaders.empty());
    }

    @Test
    void requestRequiresMethodAndPath() {
        assertThatThrownBy(() -> new RequestView(null, "/", null, null, null, null, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("method");
        assertThatThrownBy(() -> new RequestView("GET", null, null, null, null, null, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("path");
    }

    @Test
    void emptyQueryCountsAsAbsent() {
        assertThat(new RequestView("GET", "/", "", null, null, null, null).hasQuery())
                .isFalse();
        assertThat(new RequestView("GET", "/", "a=1", null, null, null, null).hasQuery())
                .isTrue();
    }

    @Test
    void negativeBodySizeIsRejected() {
        assertThatThrownBy(() -> new ResponseView(200, -1, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void negativeElapsedIsRejected() {
        assertThatThrownBy(() -> new RenderContext(REQUEST, RESPONSE, Instant.EPOCH, Duration.ofNanos(-1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("elapsed");
    }

    @Test
    void allPartsAreRequired() {
        assertThatThrownBy(() -> new RenderContext(null, RESPONSE, Instant.EPOCH, Duration.ZERO))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new RenderContext(REQUEST, RESPONSE, null, Duration.ZERO))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void builtInKeysAreReserved() {
        assertThat(BuiltInDirective.forKey('s')).isEqualTo(BuiltInDirective.STATUS);
        assertThat(BuiltInDirective.forKey('Z')).isNull();
        assertThat(BuiltInDirective.forKey('\0')).isNull();
        assertThat(BuiltInDirective.isReservedKey("T")).isTrue();
        assertThat(BuiltInDirective.isReservedKey("TT")).isFalse();
        assertThat(BuiltInDirective.isReservedKey("r")).isTrue();
    }
}
