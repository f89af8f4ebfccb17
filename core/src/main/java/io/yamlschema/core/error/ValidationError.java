package io.yamlschema.core.error;

import java.util.List;
import java.util.Optional;

/**
 * A validation error tree node. Paths refer to locations inside the validated document.
 *
 * @param kind       what went wrong
 * @param breadcrumb where, relative to the enclosing aggregate
 */
public record ValidationError(ValidationErrorKind kind, Breadcrumb breadcrumb) implements PathError {

    /** Factory used by the structural contract when checking document mappings. */
    public static final ErrorFactory<ValidationError> FACTORY = new ErrorFactory<>() {
        @Override
        public ValidationError wrongType(String expected, String actual) {
            return of(new ValidationErrorKind.WrongType(expected, actual));
        }

        @Override
        public ValidationError fieldMissing(String field) {
            return of(new ValidationErrorKind.FieldMissing(field));
        }

        @Override
        public ValidationError extraField(String field) {
            return of(new ValidationErrorKind.ExtraField(field));
        }

        @Override
        public ValidationError multiple(List<ValidationError> errors) {
            return of(new ValidationErrorKind.Multiple(errors));
        }
    };

    public static ValidationError of(ValidationErrorKind kind) {
        return new ValidationError(kind, Breadcrumb.empty());
    }

    /** Shorthand for a constraint violation at the current node. */
    public static ValidationError violation(String error) {
        return of(new ValidationErrorKind.Violation(error));
    }

    public static Optional<ValidationError> condense(List<ValidationError> errors) {
        return FACTORY.condense(errors);
    }

    public ValidationError withPathName(String name) {
        return new ValidationError(kind, breadcrumb.push(Breadcrumb.name(name)));
    }

    public ValidationError withPathIndex(int index) {
        return new ValidationError(kind, breadcrumb.push(Breadcrumb.index(index)));
    }

    @Override
    public List<ValidationError> children() {
        return kind instanceof ValidationErrorKind.Multiple multiple ? multiple.errors() : List.of();
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
