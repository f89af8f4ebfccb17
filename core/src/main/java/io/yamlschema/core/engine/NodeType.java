package io.yamlschema.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.function.Predicate;

/**
 * Kinds of YAML node the engine distinguishes, with the names used in {@code wrong type} messages.
 *
 * <p>
 * Integer and real are distinct kinds: {@code 10} is never accepted where a real is expected and
 * {@code 10.0} is never accepted where an integer is expected.
 */
public enum NodeType {
    HASH("hash", JsonNode::isObject),
    ARRAY("array", JsonNode::isArray),
    STRING("string", JsonNode::isTextual),
    INTEGER("integer", JsonNode::isIntegralNumber),
    REAL("real", JsonNode::isFloatingPointNumber),
    BOOLEAN("boolean", JsonNode::isBoolean),
    NULL("null", JsonNode::isNull),
    BAD_VALUE("bad_value", node -> false);

    private final String typeName;
    private final Predicate<JsonNode> test;

    NodeType(String typeName, Predicate<JsonNode> test) {
        this.typeName = typeName;
        this.test = test;
    }

    /** Name used in error messages, e.g. {@code hash}. */
    public String typeName() {
        return typeName;
    }

    /** Returns {@code true} if {@code node} is of this kind. */
    public boolean matches(JsonNode node) {
        return node != null && test.test(node);
    }

    /** Classifies a node; {@code null}, missing, binary and POJO nodes are {@link #BAD_VALUE}. */
    public static NodeType of(JsonNode node) {
        if (node == null) {
            return BAD_VALUE;
        }
        for (NodeType type : values()) {
            if (type.matches(node)) {
                return type;
            }
        }
        return BAD_VALUE;
    }

    /** Shorthand for {@code NodeType.of(node).typeName()}. */
    public static String nameOf(JsonNode node) {
        return of(node).typeName();
    }
}
