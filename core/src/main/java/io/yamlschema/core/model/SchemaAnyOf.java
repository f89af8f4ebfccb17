package io.yamlschema.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.yamlschema.core.engine.Context;
import io.yamlschema.core.error.ValidationError;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code anyOf: [...]}: at least one branch must validate. When none does, the errors of every
 * branch are reported.
 *
 * @param items the branches, never empty
 */
public record SchemaAnyOf(List<PropertyType> items) implements PropertyType {

    public SchemaAnyOf {
        items = List.copyOf(items);
    }

    @Override
    public Optional<ValidationError> validate(Context ctx, JsonNode node) {
        List<ValidationError> errors = new ArrayList<>();
        for (PropertyType branch : items) {
            Optional<ValidationError> result = branch.validate(ctx, node);
            if (result.isEmpty()) {
                return Optional.empty();
            }
            errors.add(result.get());
        }
        return ValidationError.condense(errors);
    }

    @Override
    public List<PropertyType> children() {
        return items;
    }
}
