package io.yamlschema.core.error;

import java.util.List;

/** What went wrong while validating a document against a compiled schema. */
public sealed interface ValidationErrorKind {

    String message();

    record WrongType(String expected, String actual) implements ValidationErrorKind {
        @Override
        public String message() {
            return "wrong type, expected " + expected + " got " + actual;
        }
    }

    record FieldMissing(String field) implements ValidationErrorKind {
        @Override
        public String message() {
            return "missing field, '" + field + "' not found";
        }
    }

    record ExtraField(String field) implements ValidationErrorKind {
        @Override
        public String message() {
            return "field '" + field + "' is not specified in the schema";
        }
    }

    /** A type-specific constraint (length, bounds, pattern, inversion, ambiguity) was violated. */
    record Violation(String error) implements ValidationErrorKind {
        @Override
        public String message() {
            return "special requirements for field not met: " + error;
        }
    }

    record UnknownSchema(String uri) implements ValidationErrorKind {
        @Override
        public String message() {
            return "schema '" + uri + "' references was not found";
        }
    }

    record Multiple(List<ValidationError> errors) implements ValidationErrorKind {
        public Multiple {
            errors = List.copyOf(errors);
        }

        @Override
        public String message() {
            return "multiple errors were encountered: " + errors.size();
        }
    }
}
