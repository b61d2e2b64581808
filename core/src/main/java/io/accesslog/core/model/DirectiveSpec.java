package io.accesslog.core.model;

import java.util.Objects;

/**
 * A parsed directive: what to resolve, plus the optional sub-format that was
 * written in parentheses right after it.
 *
 * <p>
 * The sub-format is static text. {@code %b(bytes)} renders as
 * {@code 12(bytes)}; a {@code %} inside the parentheses is never evaluated.
 *
 * @param kind      the directive kind
 * @param subFormat text between the parentheses, or {@code null} if none
 */
public record DirectiveSpec(DirectiveKind kind, String subFormat) {

    public DirectiveSpec {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    /** Creates a directive without a sub-format. */
    public static DirectiveSpec of(DirectiveKind kind) {
        return new DirectiveSpec(kind, null);
    }

    public boolean hasSubFormat() {
        return subFormat != null;
    }
}
