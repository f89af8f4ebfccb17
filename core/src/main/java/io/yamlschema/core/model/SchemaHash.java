package io.yamlschema.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.yamlschema.core.engine.Context;
import io.yamlschema.core.engine.NodeType;
import io.yamlschema.core.error.ValidationError;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code type: hash}: a mapping with arbitrary keys whose values all share one schema. Failing
 * entries are reported together, each under its key.
 *
 * @param items schema for every value, or null to accept any mapping
 */
public record SchemaHash(PropertyType items) implements PropertyType {

    @Override
    public Optional<ValidationError> validate(Context ctx, JsonNode node) {
        if (!NodeType.HASH.matches(node)) {
            return Optional.of(ValidationError.FACTORY.wrongType(NodeType.HASH.typeName(), NodeType.nameOf(node)));
        }
        if (items == null) {
            return Optional.empty();
        }

        List<ValidationError> errors = new ArrayList<>();
        for (Map.Entry<String, JsonNode> entry : node.properties()) {
            String key = entry.getKey();
            items.validate(ctx, entry.getValue()).map(e -> e.withPathName(key)).ifPresent(errors::add);
        }
        return ValidationError.condense(errors);
    }

    @Override
    public List<PropertyType> children() {
        return items == null ? List.of() : List.of(items);
    }
}
