package io.yamlschema.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.yamlschema.core.engine.Context;
import io.yamlschema.core.engine.NodeType;
import io.yamlschema.core.error.ValidationError;
import java.util.Optional;

/** {@code type: boolean}. No constraints beyond the node kind. */
public record SchemaBool() implements PropertyType {

    @Override
    public Optional<ValidationError> validate(Context ctx, JsonNode node) {
        if (!NodeType.BOOLEAN.matches(node)) {
            return Optional.of(ValidationError.FACTORY.wrongType(NodeType.BOOLEAN.typeName(), NodeType.nameOf(node)));
        }
        return Optional.empty();
    }
}
