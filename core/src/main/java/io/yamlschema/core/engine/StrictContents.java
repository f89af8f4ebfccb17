package io.yamlschema.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.yamlschema.core.error.ErrorFactory;
import io.yamlschema.core.error.PathError;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Structural contract check for mappings: every required key must be present and no key outside
 * {@code required ∪ optional} may appear.
 *
 * <p>
 * All violations are reported at once, one {@code FieldMissing} per missing key followed by one
 * {@code ExtraField} per unrecognized key, condensed into a single error. Used by every schema node
 * compiler before it reads its own fields, and by the object validator on documents.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
public final class StrictContents {

    private StrictContents() {}

    /**
     * Checks {@code node} against the given key sets.
     *
     * @param node     the node to check
     * @param required keys that must be present
     * @param optional keys that may be present
     * @param errors   factory for the error tree to produce
     * @return the condensed error, or empty if the mapping satisfies the contract
     */
    public static <E extends PathError> Optional<E> check(
            JsonNode node, Collection<String> required, Collection<String> optional, ErrorFactory<E> errors) {
        if (!NodeType.HASH.matches(node)) {
            return Optional.of(errors.wrongType(NodeType.HASH.typeName(), NodeType.nameOf(node)));
        }

        Set<String> present = new LinkedHashSet<>();
        for (Iterator<String> names = node.fieldNames(); names.hasNext(); ) {
            present.add(names.next());
        }

        List<E> violations = new ArrayList<>();
        for (String key : required) {
            if (!present.contains(key)) {
                violations.add(errors.fieldMissing(key));
            }
        }
        for (String key : present) {
            if (!required.contains(key) && !optional.contains(key)) {
                violations.add(errors.extraField(key));
            }
        }
        return errors.condense(violations);
    }
}
