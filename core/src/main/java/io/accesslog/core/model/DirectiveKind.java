package io.accesslog.core.model;

import java.util.Objects;

/**
 * What a directive resolves against. A closed set: built-in keys, header
 * lookups, custom tags and environment variables.
 */
public sealed interface DirectiveKind {

    /** A fixed built-in directive such as {@code %s} or {@code %T}. */
    record BuiltIn(BuiltInDirective directive) implements DirectiveKind {
        public BuiltIn {
            Objects.requireNonNull(directive, "directive must not be null");
        }
    }

    /** {@code %{NAME}i} or {@code %{NAME}o}: a header lookup, case-insensitive. */
    record Header(String name, Direction direction) implements DirectiveKind {
        public Header {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(direction, "direction must not be null");
        }
    }

    /** {@code %{NAME}xi} or {@code %{NAME}xo}: resolved by a registered evaluator. */
    record CustomTag(String name, Direction direction) implements DirectiveKind {
        public CustomTag {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(direction, "direction must not be null");
        }
    }

    /** {@code %{NAME}e}: an environment variable read at render time. */
    record Environment(String name) implements DirectiveKind {
        public Environment {
            Objects.requireNonNull(name, "name must not be null");
        }
    }
}
