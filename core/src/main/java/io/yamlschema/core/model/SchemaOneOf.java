package io.yamlschema.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.yamlschema.core.engine.Context;
import io.yamlschema.core.error.ValidationError;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code oneOf: [...]}: exactly one branch must validate.
 *
 * <p>
 * Every branch is evaluated. With no valid branch the errors of all branches are reported. With
 * more than one the failure is ambiguity rather than invalidity, so the report holds one error per
 * successful branch, at that branch's index.
 *
 * @param items the branches, never empty
 */
public record SchemaOneOf(List<PropertyType> items) implements PropertyType {

    static final String AMBIGUOUS = "multiple branches validated successfully, oneOf must match exactly one";

    public SchemaOneOf {
        items = List.copyOf(items);
    }

    @Override
    public Optional<ValidationError> validate(Context ctx, JsonNode node) {
        List<ValidationError> errors = new ArrayList<>();
        List<Integer> valid = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            Optional<ValidationError> result = items.get(i).validate(ctx, node);
            if (result.isPresent()) {
                errors.add(result.get());
            } else {
                valid.add(i);
            }
        }

        if (valid.size() == 1) {
            return Optional.empty();
        }
        if (valid.isEmpty()) {
            return ValidationError.condense(errors);
        }

        List<ValidationError> ambiguous = new ArrayList<>(valid.size());
        for (int index : valid) {
            ambiguous.add(ValidationError.violation(AMBIGUOUS).withPathIndex(index));
        }
        return ValidationError.condense(ambiguous);
    }

    @Override
    public List<PropertyType> children() {
        return items;
    }
}
