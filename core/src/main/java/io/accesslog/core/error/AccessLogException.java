package io.accesslog.core.error;

/**
 * Abstract base for all access-log exceptions. Never thrown directly; use
 * {@link TemplateSyntaxException} or {@link TagRegistrationException}.
 *
 * <p>
 * Every exception in this hierarchy is raised at startup, while a template is
 * compiled or a tag registry is assembled. Rendering itself never throws:
 * unresolved directives degrade to the {@code -} placeholder.
 */
public abstract class AccessLogException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        COMPILE,
        REGISTRATION
    }

    private final Phase phase;

    protected AccessLogException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected AccessLogException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
