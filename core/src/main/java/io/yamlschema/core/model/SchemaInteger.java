package io.yamlschema.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.yamlschema.core.engine.Context;
import io.yamlschema.core.engine.NodeType;
import io.yamlschema.core.error.ValidationError;
import java.math.BigInteger;
import java.util.Optional;

/**
 * {@code type: integer} with optional bounds and {@code multipleOf}.
 *
 * @param lower      lower bound ({@code minimum} or {@code exclusiveMinimum}), or null
 * @param upper      upper bound ({@code maximum} or {@code exclusiveMaximum}), or null
 * @param multipleOf strictly positive divisor, or null
 */
public record SchemaInteger(NumericLimit<Long> lower, NumericLimit<Long> upper, Long multipleOf)
        implements PropertyType {

    /** An unconstrained integer node. */
    public static SchemaInteger any() {
        return new SchemaInteger(null, null, null);
    }

    @Override
    public Optional<ValidationError> validate(Context ctx, JsonNode node) {
        if (!NodeType.INTEGER.matches(node)) {
            return Optional.of(ValidationError.FACTORY.wrongType(NodeType.INTEGER.typeName(), NodeType.nameOf(node)));
        }

        if (!node.canConvertToLong()) {
            return validateWide(node.bigIntegerValue());
        }
        long value = node.longValue();

        if (lower != null && !lower.admitsAbove(value)) {
            return Optional.of(ValidationError.violation("value violates lower limit constraint"));
        }
        if (upper != null && !upper.admitsBelow(value)) {
            return Optional.of(ValidationError.violation("value violates upper limit constraint"));
        }
        if (multipleOf != null && value % multipleOf != 0) {
            return Optional.of(ValidationError.violation("value must be a multiple of the multipleOf field"));
        }
        return Optional.empty();
    }

    // Beyond the long range, so above every upper bound or below every lower bound.
    private Optional<ValidationError> validateWide(BigInteger value) {
        if (value.signum() < 0 && lower != null) {
            return Optional.of(ValidationError.violation("value violates lower limit constraint"));
        }
        if (value.signum() > 0 && upper != null) {
            return Optional.of(ValidationError.violation("value violates upper limit constraint"));
        }
        if (multipleOf != null && value.mod(BigInteger.valueOf(multipleOf)).signum() != 0) {
            return Optional.of(ValidationError.violation("value must be a multiple of the multipleOf field"));
        }
        return Optional.empty();
    }
}
