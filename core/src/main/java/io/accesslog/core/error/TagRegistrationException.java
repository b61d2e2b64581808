package io.accesslog.core.error;

/**
 * Thrown when a custom tag is registered under a name that can never be
 * referenced from a template, or that collides with a built-in directive key.
 */
public final class TagRegistrationException extends AccessLogException {

    private static final long serialVersionUID = 1L;

    private final String tagName;

    public TagRegistrationException(String message, String tagName) {
        super(message, Phase.REGISTRATION);
        this.tagName = tagName;
    }

    /** The rejected tag name (may be {@code null}). */
    public String tagName() {
        return tagName;
    }
}
