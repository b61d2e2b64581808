package io.accesslog.core.model;

import java.util.Objects;

/** One compiled piece of a template: passthrough text or a directive. */
public sealed interface Segment {

    /** Literal text, copied to the output verbatim. */
    record Literal(String text) implements Segment {
        public Literal {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /** A directive resolved at render time. */
    record Directive(DirectiveSpec spec) implements Segment {
        public Directive {
            Objects.requireNonNull(spec, "spec must not be null");
        }
    }
}
