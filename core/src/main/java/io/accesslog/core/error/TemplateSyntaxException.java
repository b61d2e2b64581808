package io.accesslog.core.error;

/**
 * Thrown when a log format template is malformed: a dangling {@code %}, an
 * unterminated {@code {} or sub-format parenthesis, an invalid tag name, or an
 * unknown directive key. Compilation is atomic, so no partially usable
 * template ever escapes alongside this exception.
 */
public final class TemplateSyntaxException extends AccessLogException {

    private static final long serialVersionUID = 1L;

    private final String template;
    private final int offset;

    public TemplateSyntaxException(String message, String template, int offset) {
        super(message + " at offset " + offset + " in template '" + template + "'", Phase.COMPILE);
        this.template = template;
        this.offset = offset;
    }

    /** The template source that failed to compile. */
    public String template() {
        return template;
    }

    /** UTF-8 byte offset of the directive that failed to parse. */
    public int offset() {
        return offset;
    }
}
