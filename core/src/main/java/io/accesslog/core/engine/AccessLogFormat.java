package io.accesslog.core.engine;

import io.accesslog.core.model.AccessLogTemplate;
import io.accesslog.core.model.Direction;
import io.accesslog.core.model.RenderContext;
import io.accesslog.core.model.RequestView;
import io.accesslog.core.parser.TemplateParser;
import io.accesslog.core.spi.RequestTagEvaluator;
import io.accesslog.core.spi.ResponseTagEvaluator;
import io.accesslog.core.spi.SpanFactory;
import io.accesslog.core.spi.SpanHandle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for gateway adapters: one compiled template, its tag registry,
 * an optional span factory and the paths that are never logged.
 *
 * <p>
 * Typical per-request flow in an adapter:
 *
 * <pre>{@code
 * if (!format.isExcluded(path)) {
 *     try (SpanHandle span = format.openSpan(requestView)) {
 *         // ... handle request, measure elapsed ...
 *         sink.emit(format.render(ctx));
 *     }
 * }
 * }</pre>
 *
 * <p>
 * Immutable and thread-safe once built.
 */
public final class AccessLogFormat {

    private static final Logger LOG = LoggerFactory.getLogger(AccessLogFormat.class);

    /** Combined-style default: remote address, request line, status, size, referer, agent, seconds. */
    public static final String DEFAULT_PATTERN = "%a \"%r\" %s %b \"%{Referer}i\" \"%{User-Agent}i\" %T";

    private final AccessLogTemplate template;
    private final TagRegistry registry;
    private final TemplateRenderer renderer;
    private final SpanFactory spanFactory;
    private final Set<String> excludedPaths;
    private final List<Pattern> excludedPatterns;

    private AccessLogFormat(Builder builder, AccessLogTemplate template, TagRegistry registry) {
        this.template = template;
        this.registry = registry;
        this.renderer = builder.renderer;
        this.spanFactory = builder.spanFactory;
        this.excludedPaths = Collections.unmodifiableSet(new LinkedHashSet<>(builder.excludedPaths));
        this.excludedPatterns = List.copyOf(builder.excludedPatterns);
    }

    /** A format using {@link #DEFAULT_PATTERN}, no custom tags and no exclusions. */
    public static AccessLogFormat defaultFormat() {
        return builder(DEFAULT_PATTERN).build();
    }

    /**
     * Starts a builder for the given format string. The string is compiled by
     * {@link Builder#build()}.
     */
    public static Builder builder(String pattern) {
        return new Builder(pattern);
    }

    /**
     * Renders the log line for one exchange.
     *
     * @param ctx the exchange snapshot
     * @return the rendered line
     */
    public String render(RenderContext ctx) {
        return renderer.render(template, ctx, registry);
    }

    /**
     * Opens the correlation span for a request. Returns {@link SpanHandle#NONE}
     * when no factory is configured, and also when the factory fails or
     * returns {@code null}; a failing factory is logged and never blocks the
     * request.
     */
    public SpanHandle openSpan(RequestView request) {
        if (spanFactory == null) {
            return SpanHandle.NONE;
        }
        try {
            SpanHandle handle = spanFactory.open(request);
            return handle != null ? handle : SpanHandle.NONE;
        } catch (RuntimeException e) {
            LOG.warn("Span factory failed for {} {}; continuing without a span", request.method(), request.path(), e);
            return SpanHandle.NONE;
        }
    }

    /**
     * Returns {@code true} if requests for {@code path} must not be logged:
     * the path equals an excluded path, or an exclusion regex matches
     * anywhere in it.
     */
    public boolean isExcluded(String path) {
        if (path == null) {
            return false;
        }
        if (excludedPaths.contains(path)) {
            return true;
        }
        for (Pattern pattern : excludedPatterns) {
            if (pattern.matcher(path).find()) {
                return true;
            }
        }
        return false;
    }

    public AccessLogTemplate template() {
        return template;
    }

    public TagRegistry registry() {
        return registry;
    }

    public boolean hasSpanFactory() {
        return spanFactory != null;
    }

    public Set<String> excludedPaths() {
        return excludedPaths;
    }

    public List<Pattern> excludedPatterns() {
        return excludedPatterns;
    }

    @Override
    public String toString() {
        return "AccessLogFormat[" + template.source() + "]";
    }

    /** Builder for {@link AccessLogFormat}. */
    public static final class Builder {

        private final String pattern;
        private final TagRegistry.Builder tags = TagRegistry.builder();
        private final Set<String> excludedPaths = new LinkedHashSet<>();
        private final List<Pattern> excludedPatterns = new ArrayList<>();
        private SpanFactory spanFactory;
        private TemplateRenderer renderer = new TemplateRenderer();

        private Builder(String pattern) {
            this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        }

        /** Never log requests whose path equals {@code path}. */
        public Builder exclude(String path) {
            excludedPaths.add(Objects.requireNonNull(path, "path must not be null"));
            return this;
        }

        /**
         * Never log requests whose path contains a match for {@code regex}.
         *
         * @throws java.util.regex.PatternSyntaxException if the regex is invalid
         */
        public Builder excludeRegex(String regex) {
            excludedPatterns.add(Pattern.compile(Objects.requireNonNull(regex, "regex must not be null")));
            return this;
        }

        /** @see TagRegistry.Builder#registerRequestTag(String, RequestTagEvaluator) */
        public Builder requestTag(String name, RequestTagEvaluator evaluator) {
            tags.registerRequestTag(name, evaluator);
            return this;
        }

        /** @see TagRegistry.Builder#registerResponseTag(String, ResponseTagEvaluator) */
        public Builder responseTag(String name, ResponseTagEvaluator evaluator) {
            tags.registerResponseTag(name, evaluator);
            return this;
        }

        public Builder spanFactory(SpanFactory spanFactory) {
            this.spanFactory = spanFactory;
            return this;
        }

        /** Replaces the default renderer, e.g. to inject an environment lookup. */
        public Builder renderer(TemplateRenderer renderer) {
            this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
            return this;
        }

        /**
         * Compiles the pattern and snapshots the registrations.
         *
         * @throws io.accesslog.core.error.TemplateSyntaxException if the pattern is malformed
         */
        public AccessLogFormat build() {
            TagRegistry registry = tags.build();
            AccessLogTemplate template = TemplateParser.compile(pattern, registry.allTagNames());
            warnUnreferencedTags(template, registry);
            LOG.debug(
                    "Compiled access log format: segments={}, customTags={}, excludedPaths={}, excludedPatterns={}",
                    template.segments().size(),
                    registry.size(),
                    excludedPaths.size(),
                    excludedPatterns.size());
            return new AccessLogFormat(this, template, registry);
        }

        private static void warnUnreferencedTags(AccessLogTemplate template, TagRegistry registry) {
            for (Direction direction : Direction.values()) {
                Set<String> referenced = template.customTags(direction);
                String marker = direction == Direction.REQUEST ? "xi" : "xo";
                for (String name : registry.tagNames(direction)) {
                    if (!referenced.contains(name)) {
                        LOG.warn(
                                "Custom {} tag '{}' is registered but the format never references {}",
                                direction.name().toLowerCase(),
                                name,
                                "%{" + name + "}" + marker);
                    }
                }
            }
        }
    }
}
