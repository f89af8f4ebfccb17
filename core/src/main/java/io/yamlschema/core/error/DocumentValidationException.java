package io.yamlschema.core.error;

/**
 * Thrown by callers that prefer exceptions over {@code Optional} results when a document does not
 * satisfy a schema.
 */
public final class DocumentValidationException extends YamlSchemaException {

    private static final long serialVersionUID = 1L;

    private final String uri;
    private final transient ValidationError error;

    public DocumentValidationException(String uri, ValidationError error) {
        super(error.render(), Phase.VALIDATION);
        this.uri = uri;
        this.error = error;
    }

    /** URI of the schema the document was validated against. */
    public String uri() {
        return uri;
    }

    /** The validation error tree. */
    public ValidationError error() {
        return error;
    }
}
