package io.yamlschema.core.error;

import java.util.List;

/** What went wrong while compiling a schema document. */
public sealed interface SchemaErrorKind {

    String message();

    record WrongType(String expected, String actual) implements SchemaErrorKind {
        @Override
        public String message() {
            return "wrong type, expected " + expected + " got " + actual;
        }
    }

    record FieldMissing(String field) implements SchemaErrorKind {
        @Override
        public String message() {
            return "field '" + field + "' missing";
        }
    }

    record ExtraField(String field) implements SchemaErrorKind {
        @Override
        public String message() {
            return "field '" + field + "' is not specified in the schema";
        }
    }

    record UnknownType(String unknownType) implements SchemaErrorKind {
        @Override
        public String message() {
            return "unknown type specified: " + unknownType;
        }
    }

    /** A field is present and well-typed but its value is unusable (bad regex, empty range...). */
    record MalformedField(String error) implements SchemaErrorKind {
        @Override
        public String message() {
            return "malformed field: " + error;
        }
    }

    record UnknownSchema(String uri) implements SchemaErrorKind {
        @Override
        public String message() {
            return "schema '" + uri + "' references was not found";
        }
    }

    record Multiple(List<SchemaError> errors) implements SchemaErrorKind {
        public Multiple {
            errors = List.copyOf(errors);
        }

        @Override
        public String message() {
            return "multiple errors were encountered: " + errors.size();
        }
    }
}
