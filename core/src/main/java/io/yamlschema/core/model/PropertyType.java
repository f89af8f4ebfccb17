package io.yamlschema.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.yamlschema.core.engine.Context;
import io.yamlschema.core.error.ValidationError;
import java.util.List;
import java.util.Optional;

/**
 * One compiled node of a schema tree: exactly one type or one combinator.
 *
 * <p>
 * The set of node kinds is closed. Nodes are immutable and own their children; the only edge that
 * may lead back up the tree is {@link SchemaReference}, which is resolved by URI through the
 * {@link Context} on every validation call instead of being stored as a pointer.
 */
public sealed interface PropertyType
        permits SchemaObject,
                SchemaArray,
                SchemaHash,
                SchemaString,
                SchemaInteger,
                SchemaReal,
                SchemaBool,
                SchemaReference,
                SchemaNot,
                SchemaOneOf,
                SchemaAnyOf,
                SchemaAllOf {

    /**
     * Validates {@code node} against this schema node.
     *
     * @param ctx  registry used to resolve references
     * @param node the document node to check
     * @return empty if the node is valid, otherwise the error tree describing every failure found
     */
    Optional<ValidationError> validate(Context ctx, JsonNode node);

    /** Directly owned child nodes, in declaration order. */
    default List<PropertyType> children() {
        return List.of();
    }
}
