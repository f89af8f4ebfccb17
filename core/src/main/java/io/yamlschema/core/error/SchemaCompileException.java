package io.yamlschema.core.error;

/**
 * Thrown when one or more schema documents violate the schema grammar. Carries the complete error
 * tree; the message is its rendered report.
 */
public final class SchemaCompileException extends YamlSchemaException {

    private static final long serialVersionUID = 1L;

    private final transient SchemaError error;

    public SchemaCompileException(SchemaError error) {
        super(error.render(), Phase.COMPILE);
        this.error = error;
    }

    public SchemaCompileException(SchemaErrorKind kind) {
        this(SchemaError.of(kind));
    }

    /** The compile error tree. */
    public SchemaError error() {
        return error;
    }

    /** Returns a copy of this exception whose error has {@code name} pushed onto its path. */
    public SchemaCompileException withPathName(String name) {
        return new SchemaCompileException(error.withPathName(name));
    }

    /** Returns a copy of this exception whose error has {@code index} pushed onto its path. */
    public SchemaCompileException withPathIndex(int index) {
        return new SchemaCompileException(error.withPathIndex(index));
    }
}
