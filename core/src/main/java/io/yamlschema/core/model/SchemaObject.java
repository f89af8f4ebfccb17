package io.yamlschema.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.yamlschema.core.engine.Context;
import io.yamlschema.core.engine.NodeType;
import io.yamlschema.core.engine.StrictContents;
import io.yamlschema.core.error.ValidationError;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * {@code type: object}: a mapping with a fixed set of declared fields.
 *
 * <p>
 * Keys that are not declared are always rejected. Without a {@code required} list every declared
 * field is optional; with one, only the listed fields must be present. A field whose value is
 * YAML null counts as absent. Fields are checked in key order and all failures are reported.
 *
 * @param items    declared fields, sorted by name
 * @param required names of mandatory fields, or null if none were listed
 */
public record SchemaObject(Map<String, PropertyType> items, List<String> required) implements PropertyType {

    public SchemaObject {
        items = Collections.unmodifiableMap(new TreeMap<>(items));
        required = required == null ? null : List.copyOf(required);
    }

    @Override
    public Optional<ValidationError> validate(Context ctx, JsonNode node) {
        if (!NodeType.HASH.matches(node)) {
            return Optional.of(ValidationError.FACTORY.wrongType(NodeType.HASH.typeName(), NodeType.nameOf(node)));
        }

        List<String> mandatory = required == null ? List.of() : required;
        List<String> optional = new ArrayList<>();
        for (String name : items.keySet()) {
            if (!mandatory.contains(name)) {
                optional.add(name);
            }
        }

        Optional<ValidationError> contract = StrictContents.check(node, mandatory, optional, ValidationError.FACTORY);
        if (contract.isPresent()) {
            return contract;
        }

        List<ValidationError> errors = new ArrayList<>();
        for (Map.Entry<String, PropertyType> field : items.entrySet()) {
            String name = field.getKey();
            JsonNode value = node.get(name);
            if (value == null || value.isNull()) {
                if (mandatory.contains(name)) {
                    errors.add(ValidationError.FACTORY.fieldMissing(name));
                }
                continue;
            }
            field.getValue().validate(ctx, value).map(e -> e.withPathName(name)).ifPresent(errors::add);
        }
        return ValidationError.condense(errors);
    }

    @Override
    public List<PropertyType> children() {
        return List.copyOf(items.values());
    }
}
