package io.yamlschema.core.error;

import java.util.List;
import java.util.Optional;

/**
 * Builds the error kinds shared by both error trees, so structural checks can run unchanged at
 * compile time (producing {@link SchemaError}) and at validation time (producing
 * {@link ValidationError}).
 *
 * @param <E> the error tree type
 */
public interface ErrorFactory<E extends PathError> {

    E wrongType(String expected, String actual);

    E fieldMissing(String field);

    E extraField(String field);

    E multiple(List<E> errors);

    /**
     * Aggregates sibling errors: none yields empty, one is returned unchanged, several are wrapped
     * in a single aggregate.
     */
    default Optional<E> condense(List<E> errors) {
        if (errors.isEmpty()) {
            return Optional.empty();
        }
        if (errors.size() == 1) {
            return Optional.of(errors.get(0));
        }
        return Optional.of(multiple(errors));
    }
}
