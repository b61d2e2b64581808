package io.accesslog.core.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A compiled log format: the source string and its ordered segments.
 *
 * <p>
 * Immutable and thread-safe. Compiled once by
 * {@link io.accesslog.core.parser.TemplateParser} and rendered concurrently by
 * any number of requests.
 */
public final class AccessLogTemplate {

    private final String source;
    private final List<Segment> segments;

    public AccessLogTemplate(String source, List<Segment> segments) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.segments = List.copyOf(Objects.requireNonNull(segments, "segments must not be null"));
    }

    /** The format string this template was compiled from. */
    public String source() {
        return source;
    }

    /** Compiled segments in output order. */
    public List<Segment> segments() {
        return segments;
    }

    /**
     * Names of the custom tags this template references in the given
     * direction, in order of first appearance.
     */
    public Set<String> customTags(Direction direction) {
        Set<String> names = new LinkedHashSet<>();
        for (Segment segment : segments) {
            if (segment instanceof Segment.Directive directive
                    && directive.spec().kind() instanceof DirectiveKind.CustomTag tag
                    && tag.direction() == direction) {
                names.add(tag.name());
            }
        }
        return names;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AccessLogTemplate that)) return false;
        return source.equals(that.source) && segments.equals(that.segments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, segments);
    }

    @Override
    public String toString() {
        return "AccessLogTemplate[" + source + "]";
    }
}
