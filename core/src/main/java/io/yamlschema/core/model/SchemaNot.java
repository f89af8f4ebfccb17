package io.yamlschema.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.yamlschema.core.engine.Context;
import io.yamlschema.core.error.ValidationError;
import java.util.List;
import java.util.Optional;

/**
 * {@code not: <node>}: succeeds exactly when the inner node fails. The inner node's errors are
 * discarded.
 *
 * @param item the inverted node
 */
public record SchemaNot(PropertyType item) implements PropertyType {

    @Override
    public Optional<ValidationError> validate(Context ctx, JsonNode node) {
        if (item.validate(ctx, node).isPresent()) {
            return Optional.empty();
        }
        return Optional.of(ValidationError.violation("validation inversion failed because inner result matched"));
    }

    @Override
    public List<PropertyType> children() {
        return List.of(item);
    }
}
