package io.accesslog.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.accesslog.core.model.AccessLogTemplate;
import io.accesslog.core.model.Direction;
import io.accesslog.core.model.DirectiveKind;
import io.accesslog.core.model.DirectiveSpec;
import io.accesslog.core.model.HttpHeaders;
import io.accesslog.core.model.RenderContext;
import io.accesslog.core.model.Segment;
import io.accesslog.core.spi.RequestTagEvaluator;
import io.accesslog.core.spi.ResponseTagEvaluator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a compiled {@link AccessLogTemplate} plus one {@link RenderContext}
 * into a log line.
 *
 * <p>
 * Rendering never throws for a well-formed context. Whatever cannot be
 * resolved (absent header, unset environment variable, unregistered or
 * failing custom tag) renders as {@value BuiltInEvaluators#PLACEHOLDER}.
 *
 * <p>
 * Thread-safe: holds no mutable state. One instance may serve every request.
 */
public final class TemplateRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateRenderer.class);

    private static final ObjectMapper HEADER_MAPPER = new ObjectMapper();

    private final Function<String, String> envLookup;

    /** Renderer resolving {@code %{NAME}e} against the process environment. */
    public TemplateRenderer() {
        this(System::getenv);
    }

    /**
     * @param envLookup resolves environment variable names for {@code %{NAME}e};
     *                  returns {@code null} for unset variables
     */
    public TemplateRenderer(Function<String, String> envLookup) {
        this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
    }

    /**
     * Renders one log line.
     *
     * @param template the compiled template
     * @param ctx      the exchange snapshot
     * @param registry custom tag evaluators
     * @return the rendered line, without a trailing newline
     */
    public String render(AccessLogTemplate template, RenderContext ctx, TagRegistry registry) {
        Objects.requireNonNull(template, "template must not be null");
        Objects.requireNonNull(ctx, "ctx must not be null");
        Objects.requireNonNull(registry, "registry must not be null");

        StringBuilder line = new StringBuilder(template.source().length() + 64);
        for (Segment segment : template.segments()) {
            if (segment instanceof Segment.Literal literal) {
                line.append(literal.text());
            } else if (segment instanceof Segment.Directive directive) {
                DirectiveSpec spec = directive.spec();
                line.append(resolve(spec.kind(), ctx, registry));
                if (spec.hasSubFormat()) {
                    line.append('(').append(spec.subFormat()).append(')');
                }
            }
        }
        return line.toString();
    }

    private String resolve(DirectiveKind kind, RenderContext ctx, TagRegistry registry) {
        if (kind instanceof DirectiveKind.BuiltIn builtIn) {
            return BuiltInEvaluators.evaluate(builtIn.directive(), ctx);
        }
        if (kind instanceof DirectiveKind.Header header) {
            HttpHeaders headers = header.direction() == Direction.REQUEST
                    ? ctx.request().headers()
                    : ctx.response().headers();
            return headerValue(headers.all(header.name()));
        }
        if (kind instanceof DirectiveKind.CustomTag tag) {
            return customTag(tag, ctx, registry);
        }
        if (kind instanceof DirectiveKind.Environment env) {
            String value = envLookup.apply(env.name());
            return value == null || value.isEmpty() ? BuiltInEvaluators.PLACEHOLDER : value;
        }
        throw new IllegalStateException("Unhandled directive kind: " + kind);
    }

    private static String customTag(DirectiveKind.CustomTag tag, RenderContext ctx, TagRegistry registry) {
        String value;
        try {
            if (tag.direction() == Direction.REQUEST) {
                RequestTagEvaluator evaluator = registry.requestTag(tag.name());
                value = evaluator != null ? evaluator.evaluate(ctx.request()) : null;
            } else {
                ResponseTagEvaluator evaluator = registry.responseTag(tag.name());
                value = evaluator != null ? evaluator.evaluate(ctx.response()) : null;
            }
        } catch (RuntimeException e) {
            LOG.warn(
                    "Custom {} tag '{}' failed, rendering '{}'",
                    tag.direction().name().toLowerCase(),
                    tag.name(),
                    BuiltInEvaluators.PLACEHOLDER,
                    e);
            return BuiltInEvaluators.PLACEHOLDER;
        }
        return value != null ? value : BuiltInEvaluators.PLACEHOLDER;
    }

    /**
     * One value renders as-is; several render as a JSON array
     * ({@code ["a","b"]}); none render the placeholder.
     */
    static String headerValue(List<String> values) {
        if (values.isEmpty()) {
            return BuiltInEvaluators.PLACEHOLDER;
        }
        if (values.size() == 1) {
            String value = values.get(0);
            return value.isEmpty() ? BuiltInEvaluators.PLACEHOLDER : value;
        }
        try {
            return HEADER_MAPPER.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            LOG.warn("Failed to serialize header values {}", values, e);
            return String.join(",", values);
        }
    }
}
