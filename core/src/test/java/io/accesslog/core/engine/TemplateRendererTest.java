package io.accesslog.core.engine;

import static io.accesslog.core.testkit.TestContexts.context;
import static io.accesslog.core.testkit.TestContexts.request;
import static io.accesslog.core.testkit.TestContexts.response;
import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.accesslog.core.model.AccessLogTemplate;
import io.accesslog.core.model.HttpHeaders;
import io.accesslog.core.model.RenderContext;
import io.accesslog.core.model.RequestView;
import io.accesslog.core.parser.TemplateParser;
import io.accesslog.core.testkit.TestContexts;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Tests for {@link TemplateRenderer}: built-in directives, headers, custom
 * tags, environment variables, sub-formats and placeholder handling.
 */
@DisplayName("TemplateRenderer")
class TemplateRendererTest {

    private final TemplateRenderer renderer = new TemplateRenderer(Map.of("APP_ENV", "staging")::get);

    private String render(String template, RenderContext ctx) {
        return render(template, ctx, TagRegistry.empty());
    }

    private String render(String template, RenderContext ctx, TagRegistry registry) {
        return renderer.render(TemplateParser.compile(template), ctx, registry);
    }

    @Nested
    @DisplayName("Literals and escapes")
    class Literals {

        @Test
        @DisplayName("literal-only template renders unchanged for any context")
        void literalOnly() {
            String template = "  no directives\there  ";
            assertThat(render(template, TestContexts.simple())).isEqualTo(template);
            RenderContext other = context(request("POST", "/x"), response(500, 0), Duration.ofSeconds(3));
            assertThat(render(template, other)).isEqualTo(template);
        }

        @Test
        @DisplayName("%% renders a single percent")
        void escapedPercent() {
            assertThat(render("%%", TestContexts.simple())).isEqualTo("%");
            assertThat(render("%s%%", TestContexts.simple())).isEqualTo("200%");
        }
    }

    @Nested
    @DisplayName("Built-in directives")
    class BuiltIns {

        @Test
        @DisplayName("status and body size")
        void statusAndSize() {
            assertThat(render("%s %b", TestContexts.simple())).isEqualTo("200 12");
        }

        @Test
        @DisplayName("278 µs renders 0.000278 seconds and 0.278000 milliseconds")
        void elapsed() {
            RenderContext ctx = TestContexts.simple();
            assertThat(render("%T", ctx)).isEqualTo("0.000278");
            assertThat(render("%D", ctx)).isEqualTo("0.278000");
        }

        @Test
        @DisplayName("longer durations keep six fractional digits")
        void elapsedLong() {
            RenderContext ctx = context(request("GET", "/"), response(200, 0), Duration.ofMillis(1500));
            assertThat(render("%T %D", ctx)).isEqualTo("1.500000 1500.000000");
        }

        @Test
        @DisplayName("zero elapsed renders zeros")
        void elapsedZero() {
            RenderContext ctx = context(request("GET", "/"), response(200, 0), Duration.ZERO);
            assertThat(render("%T|%D", ctx)).isEqualTo("0.000000|0.000000");
        }

        @Test
        @DisplayName("%t is the start time in UTC at second precision")
        void requestTime() {
            assertThat(render("%t", TestContexts.simple())).isEqualTo("2024-03-05T14:07:09");
        }

        @Test
        @DisplayName("request line, method, path, query and version")
        void requestParts() {
            RequestView request = request("GET", "/search", "q=java&page=2", Map.of());
            RenderContext ctx = context(request, response(200, 0), Duration.ZERO);
            assertThat(render("%r|%M|%U|%Q|%V", ctx))
                    .isEqualTo("GET /search?q=java&page=2 HTTP/1.1|GET|/search|q=java&page=2|HTTP/1.1");
        }

        @Test
        @DisplayName("absent query renders - and is left out of the request line")
        void noQuery() {
            assertThat(render("%r %Q", TestContexts.simple())).isEqualTo("GET /index HTTP/1.1 -");
        }

        @Test
        @DisplayName("unknown version renders ? and unknown addresses render -")
        void unknownValues() {
            RequestView request = new RequestView("GET", "/", null, null, null, null, HttpHeaders.empty());
            RenderContext ctx = context(request, response(204, 0), Duration.ZERO);
            assertThat(render("%V|%a|%{r}a|%r", ctx)).isEqualTo("?|-|-|GET / ?");
        }

        @Test
        @DisplayName("remote and peer address")
        void addresses() {
            assertThat(render("%a %{r}a", TestContexts.simple())).isEqualTo("10.0.0.1 10.0.0.1:54321");
        }
    }

    @Nested
    @DisplayName("Sub-formats")
    class SubFormats {

        @Test
        @DisplayName("%b(bytes) renders the value followed by the parenthesized text")
        void bytesLabel() {
            assertThat(render("%b(bytes)", TestContexts.simple())).isEqualTo("12(bytes)");
        }

        @Test
        @DisplayName("% inside a sub-format is not evaluated")
        void notEvaluated() {
            assertThat(render("%r(%M %U)", TestContexts.simple())).isEqualTo("GET /index HTTP/1.1(%M %U)");
        }

        @Test
        @DisplayName("empty sub-format renders empty parentheses")
        void emptySubFormat() {
            assertThat(render("%s()", TestContexts.simple())).isEqualTo("200()");
        }
    }

    @Nested
    @DisplayName("Headers")
    class Headers {

        @Test
        @DisplayName("request header lookup is case-insensitive")
        void caseInsensitive() {
            RequestView request = request("GET", "/", null, Map.of("User-Agent", List.of("curl/8.4")));
            RenderContext ctx = context(request, response(200, 0), Duration.ZERO);
            assertThat(render("%{user-agent}i", ctx)).isEqualTo("curl/8.4");
            assertThat(render("%{USER-AGENT}i", ctx)).isEqualTo("curl/8.4");
        }

        @Test
        @DisplayName("absent header renders -")
        void absent() {
            assertThat(render("\"%{Referer}i\"", TestContexts.simple())).isEqualTo("\"-\"");
        }

        @Test
        @DisplayName("several values render as a JSON array")
        void multiValued() {
            RequestView request = request("GET", "/", null, Map.of("Accept", List.of("a", "b")));
            RenderContext ctx = context(request, response(200, 0), Duration.ZERO);
            assertThat(render("%{Accept}i", ctx)).isEqualTo("[\"a\",\"b\"]");
        }

        @Test
        @DisplayName("response headers are read from the response view")
        void responseHeader() {
            RenderContext ctx = context(
                    request("GET", "/"),
                    response(200, 5, Map.of("Content-Type", List.of("text/plain"))),
                    Duration.ZERO);
            assertThat(render("%{content-type}o %{content-type}i", ctx)).isEqualTo("text/plain -");
        }
    }

    @Nested
    @DisplayName("Custom tags")
    class CustomTags {

        private ListAppender<ILoggingEvent> logAppender;
        private Logger rendererLogger;

        @BeforeEach
        void attach() {
            rendererLogger = (Logger) LoggerFactory.getLogger(TemplateRenderer.class);
            logAppender = new ListAppender<>();
            logAppender.start();
            rendererLogger.addAppender(logAppender);
        }

        @AfterEach
        void detach() {
            rendererLogger.detachAppender(logAppender);
            logAppender.stop();
        }

        @Test
        @DisplayName("registered request tag renders its evaluator's value")
        void requestTag() {
            TagRegistry registry =
                    TagRegistry.builder().registerRequestTag("X", r -> "hi").build();
            assertThat(render("%{X}xi", TestContexts.simple(), registry)).isEqualTo("hi");
        }

        @Test
        @DisplayName("response tag sees the response view")
        void responseTag() {
            TagRegistry registry = TagRegistry.builder()
                    .registerResponseTag("class", r -> (r.status() / 100) + "xx")
                    .build();
            assertThat(render("%{class}xo", TestContexts.simple(), registry)).isEqualTo("2xx");
        }

        @Test
        @DisplayName("unregistered tag renders -")
        void unregistered() {
            assertThat(render("%{X}xi", TestContexts.simple())).isEqualTo("-");
        }

        @Test
        @DisplayName("tags are direction-scoped")
        void directionScoped() {
            TagRegistry registry =
                    TagRegistry.builder().registerRequestTag("X", r -> "req").build();
            assertThat(render("%{X}xo", TestContexts.simple(), registry)).isEqualTo("-");
        }

        @Test
        @DisplayName("failing evaluator renders - and logs a WARN naming the tag")
        void failingEvaluator() {
            TagRegistry registry = TagRegistry.builder()
                    .registerRequestTag("boom", r -> {
                        throw new IllegalStateException("kaput");
                    })
                    .build();

            assertThat(render("[%{boom}xi]", TestContexts.simple(), registry)).isEqualTo("[-]");
            assertThat(logAppender.list)
                    .anySatisfy(event -> {
                        assertThat(event.getLevel()).isEqualTo(Level.WARN);
                        assertThat(event.getFormattedMessage()).contains("'boom'").contains("request");
                    });
        }

        @Test
        @DisplayName("null result renders -")
        void nullResult() {
            TagRegistry registry =
                    TagRegistry.builder().registerResponseTag("nothing", r -> null).build();
            assertThat(render("%{nothing}xo", TestContexts.simple(), registry)).isEqualTo("-");
        }

        @Test
        @DisplayName("re-registration: the registry built after the second registration uses it")
        void lastRegistrationWins() {
            TagRegistry.Builder builder = TagRegistry.builder().registerRequestTag("X", r -> "first");
            TagRegistry before = builder.build();
            TagRegistry after = builder.registerRequestTag("X", r -> "second").build();

            assertThat(render("%{X}xi", TestContexts.simple(), after)).isEqualTo("second");
            assertThat(render("%{X}xi", TestContexts.simple(), before)).isEqualTo("first");
        }
    }

    @Nested
    @DisplayName("Environment variables")
    class Environment {

        @Test
        @DisplayName("set variable renders its value")
        void set() {
            assertThat(render("%{APP_ENV}e", TestContexts.simple())).isEqualTo("staging");
        }

        @Test
        @DisplayName("unset variable renders -")
        void unset() {
            assertThat(render("%{NOT_SET_ANYWHERE}e", TestContexts.simple())).isEqualTo("-");
        }
    }

    @Test
    @DisplayName("rendering twice with identical inputs yields identical strings")
    void deterministic() {
        AccessLogTemplate template = TemplateParser.compile(AccessLogFormat.DEFAULT_PATTERN);
        RenderContext ctx = TestContexts.simple();
        assertThat(renderer.render(template, ctx, TagRegistry.empty()))
                .isEqualTo(renderer.render(template, ctx, TagRegistry.empty()));
    }

    @Test
    @DisplayName("default pattern renders the combined-style line")
    void defaultPattern() {
        RequestView request = request(
                "GET",
                "/index",
                null,
                Map.of("Referer", List.of("https://example.com/"), "User-Agent", List.of("curl/8.4")));
        RenderContext ctx = context(request, response(200, 12), Duration.ofNanos(278_000));
        assertThat(render(AccessLogFormat.DEFAULT_PATTERN, ctx))
                .isEqualTo("10.0.0.1 \"GET /index HTTP/1.1\" 200 12 \"https://example.com/\" \"curl/8.4\" 0.000278");
    }

    @Test
    @DisplayName("one template and registry render concurrently without interference")
    void concurrentRendering() throws Exception {
        AccessLogTemplate template = TemplateParser.compile("%U %s %{id}xi");
        TagRegistry registry = TagRegistry.builder()
                .registerRequestTag("id", r -> r.path().substring(1))
                .build();

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                int n = i;
                tasks.add(() -> {
                    RenderContext ctx = context(request("GET", "/" + n), response(200 + (n % 3), n), Duration.ZERO);
                    String expected = "/" + n + " " + (200 + (n % 3)) + " " + n;
                    return expected.equals(renderer.render(template, ctx, registry));
                });
            }
            for (Future<Boolean> result : pool.invokeAll(tasks)) {
                assertThat(result.get()).isTrue();
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
