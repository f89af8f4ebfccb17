package io.yamlschema.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.yamlschema.core.engine.Context;
import io.yamlschema.core.engine.NodeType;
import io.yamlschema.core.error.ValidationError;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@code type: string} with optional length bounds and pattern.
 *
 * <p>
 * Checks run in order (length, then pattern) and the first failing one is reported. Lengths count
 * Unicode code points; the pattern matches anywhere in the value.
 *
 * @param minLength minimum length, or null
 * @param maxLength maximum length, or null
 * @param pattern   compiled pattern, or null
 */
public record SchemaString(Integer minLength, Integer maxLength, Pattern pattern) implements PropertyType {

    /** An unconstrained string node. */
    public static SchemaString any() {
        return new SchemaString(null, null, null);
    }

    @Override
    public Optional<ValidationError> validate(Context ctx, JsonNode node) {
        if (!NodeType.STRING.matches(node)) {
            return Optional.of(ValidationError.FACTORY.wrongType(NodeType.STRING.typeName(), NodeType.nameOf(node)));
        }

        String value = node.textValue();
        int length = value.codePointCount(0, value.length());

        if (minLength != null && length < minLength) {
            return Optional.of(ValidationError.violation("string length is less than minLength"));
        }
        if (maxLength != null && length > maxLength) {
            return Optional.of(ValidationError.violation("string length is greater than maxLength"));
        }
        if (pattern != null && !pattern.matcher(value).find()) {
            return Optional.of(ValidationError.violation("supplied value does not match regex pattern for field"));
        }
        return Optional.empty();
    }
}
