package io.yamlschema.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.yamlschema.core.engine.Context;
import io.yamlschema.core.engine.NodeType;
import io.yamlschema.core.error.ValidationError;
import java.util.Optional;

/**
 * {@code type: real} with optional bounds and {@code multipleOf}. Only floating point document
 * values are reals; {@code 10} is an integer and is rejected.
 *
 * <p>
 * {@code multipleOf} uses the floating point remainder, so divisors without an exact binary
 * representation (such as {@code 0.1}) rarely divide anything evenly.
 *
 * @param lower      lower bound, or null
 * @param upper      upper bound, or null
 * @param multipleOf strictly positive divisor, or null
 */
public record SchemaReal(NumericLimit<Double> lower, NumericLimit<Double> upper, Double multipleOf)
        implements PropertyType {

    /** An unconstrained real node. */
    public static SchemaReal any() {
        return new SchemaReal(null, null, null);
    }

    @Override
    public Optional<ValidationError> validate(Context ctx, JsonNode node) {
        if (!NodeType.REAL.matches(node)) {
            return Optional.of(ValidationError.FACTORY.wrongType(NodeType.REAL.typeName(), NodeType.nameOf(node)));
        }

        double value = node.doubleValue();

        if (lower != null && !lower.admitsAbove(value)) {
            return Optional.of(ValidationError.violation("value violates lower limit constraint"));
        }
        if (upper != null && !upper.admitsBelow(value)) {
            return Optional.of(ValidationError.violation("value violates upper limit constraint"));
        }
        if (multipleOf != null && value % multipleOf != 0.0) {
            return Optional.of(ValidationError.violation("value must be a multiple of the multipleOf field"));
        }
        return Optional.empty();
    }
}
