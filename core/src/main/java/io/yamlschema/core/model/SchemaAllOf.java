package io.yamlschema.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.yamlschema.core.engine.Context;
import io.yamlschema.core.error.ValidationError;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code allOf: [...]}: every branch must validate. Errors of all failing branches are reported.
 *
 * @param items the branches, never empty
 */
public record SchemaAllOf(List<PropertyType> items) implements PropertyType {

    public SchemaAllOf {
        items = List.copyOf(items);
    }

    @Override
    public Optional<ValidationError> validate(Context ctx, JsonNode node) {
        List<ValidationError> errors = new ArrayList<>();
        for (PropertyType branch : items) {
            branch.validate(ctx, node).ifPresent(errors::add);
        }
        return ValidationError.condense(errors);
    }

    @Override
    public List<PropertyType> children() {
        return items;
    }
}
