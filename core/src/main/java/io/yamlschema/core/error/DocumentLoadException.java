package io.yamlschema.core.error;

/** Thrown when a YAML file cannot be read or does not contain valid YAML. */
public final class DocumentLoadException extends YamlSchemaException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public DocumentLoadException(String message, String source) {
        super(message, Phase.LOAD);
        this.source = source;
    }

    public DocumentLoadException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
