package io.yamlschema.core.error;

import java.util.List;
import java.util.Optional;

/**
 * A compile-time error tree node. Paths refer to locations inside the schema document.
 *
 * @param kind       what went wrong
 * @param breadcrumb where, relative to the enclosing aggregate
 */
public record SchemaError(SchemaErrorKind kind, Breadcrumb breadcrumb) implements PathError {

    /** Factory used by the structural contract when checking schema mappings. */
    public static final ErrorFactory<SchemaError> FACTORY = new ErrorFactory<>() {
        @Override
        public SchemaError wrongType(String expected, String actual) {
            return of(new SchemaErrorKind.WrongType(expected, actual));
        }

        @Override
        public SchemaError fieldMissing(String field) {
            return of(new SchemaErrorKind.FieldMissing(field));
        }

        @Override
        public SchemaError extraField(String field) {
            return of(new SchemaErrorKind.ExtraField(field));
        }

        @Override
        public SchemaError multiple(List<SchemaError> errors) {
            return of(new SchemaErrorKind.Multiple(errors));
        }
    };

    public static SchemaError of(SchemaErrorKind kind) {
        return new SchemaError(kind, Breadcrumb.empty());
    }

    public static Optional<SchemaError> condense(List<SchemaError> errors) {
        return FACTORY.condense(errors);
    }

    public SchemaError withPathName(String name) {
        return new SchemaError(kind, breadcrumb.push(Breadcrumb.name(name)));
    }

    public SchemaError withPathIndex(int index) {
        return new SchemaError(kind, breadcrumb.push(Breadcrumb.index(index)));
    }

    @Override
    public List<SchemaError> children() {
        return kind instanceof SchemaErrorKind.Multiple multiple ? multiple.errors() : List.of();
    }

    @Override
    public String message() {
        return kind.message();
    }

    @Override
    public String toString() {
        return render();
    }
}
