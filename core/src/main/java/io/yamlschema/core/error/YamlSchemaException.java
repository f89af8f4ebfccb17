package io.yamlschema.core.error;

/**
 * Abstract base for all yaml-schema exceptions. Never thrown directly, use one of the concrete
 * subclasses.
 */
public abstract class YamlSchemaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        COMPILE,
        VALIDATION
    }

    private final Phase phase;

    protected YamlSchemaException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected YamlSchemaException(String message, Throwable cause, Phase phase) {
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
