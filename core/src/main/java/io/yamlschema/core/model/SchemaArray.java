package io.yamlschema.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.yamlschema.core.engine.Context;
import io.yamlschema.core.engine.NodeType;
import io.yamlschema.core.error.ValidationError;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@code type: array}.
 *
 * <p>
 * Validation order: node kind, item count, uniqueness (first duplicate reported at its index),
 * {@code contains} count, then every element against {@code items}. The element pass reports all
 * failing indices together; the earlier checks stop at the first failure.
 *
 * @param items       schema for every element, or null
 * @param minItems    minimum element count, or null
 * @param maxItems    maximum element count, or null
 * @param uniqueItems whether elements must be pairwise distinct
 * @param contains    schema some elements must satisfy, or null
 * @param minContains minimum number of matching elements, or null (1 when {@code contains} is set)
 * @param maxContains maximum number of matching elements, or null
 */
public record SchemaArray(
        PropertyType items,
        Integer minItems,
        Integer maxItems,
        boolean uniqueItems,
        PropertyType contains,
        Integer minContains,
        Integer maxContains)
        implements PropertyType {

    /** An unconstrained array node. */
    public static SchemaArray any() {
        return new SchemaArray(null, null, null, false, null, null, null);
    }

    @Override
    public Optional<ValidationError> validate(Context ctx, JsonNode node) {
        if (!NodeType.ARRAY.matches(node)) {
            return Optional.of(ValidationError.FACTORY.wrongType(NodeType.ARRAY.typeName(), NodeType.nameOf(node)));
        }

        int size = node.size();
        if (minItems != null && size < minItems) {
            return Optional.of(ValidationError.violation("array contains fewer than minItems items"));
        }
        if (maxItems != null && size > maxItems) {
            return Optional.of(ValidationError.violation("array contains more than maxItems items"));
        }

        if (uniqueItems) {
            Set<JsonNode> seen = new HashSet<>();
            for (int i = 0; i < size; i++) {
                if (!seen.add(node.get(i))) {
                    return Optional.of(ValidationError.violation("array contains duplicate key").withPathIndex(i));
                }
            }
        }

        if (contains != null) {
            int matched = 0;
            for (JsonNode element : node) {
                if (contains.validate(ctx, element).isEmpty()) {
                    matched++;
                }
            }
            if (minContains == null && matched < 1) {
                return Optional.of(
                        ValidationError.violation("at least one item in the array must match the 'contains' schema"));
            }
            if (minContains != null && matched < minContains) {
                return Optional.of(
                        ValidationError.violation("fewer than minContains items validated against schema in 'contains'"));
            }
            if (maxContains != null && matched > maxContains) {
                return Optional.of(
                        ValidationError.violation("more than maxContains items validated against schema in 'contains'"));
            }
        }

        if (items != null) {
            List<ValidationError> errors = new ArrayList<>();
            for (int i = 0; i < size; i++) {
                int index = i;
                items.validate(ctx, node.get(i)).map(e -> e.withPathIndex(index)).ifPresent(errors::add);
            }
            return ValidationError.condense(errors);
        }
        return Optional.empty();
    }

    @Override
    public List<PropertyType> children() {
        List<PropertyType> children = new ArrayList<>(2);
        if (items != null) {
            children.add(items);
        }
        if (contains != null) {
            children.add(contains);
        }
        return children;
    }
}
