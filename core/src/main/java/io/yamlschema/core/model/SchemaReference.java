package io.yamlschema.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.yamlschema.core.engine.Context;
import io.yamlschema.core.error.ValidationError;
import io.yamlschema.core.error.ValidationErrorKind;
import java.util.Optional;

/**
 * {@code $ref: <uri>}: delegates to another schema registered in the {@link Context}.
 *
 * <p>
 * The target is looked up on every call, so schemas may refer to themselves or to each other
 * regardless of the order they were registered in. A URI that is not registered fails validation
 * with {@code UnknownSchema}.
 *
 * @param uri the referenced schema's URI
 */
public record SchemaReference(String uri) implements PropertyType {

    @Override
    public Optional<ValidationError> validate(Context ctx, JsonNode node) {
        return ctx.getSchema(uri)
                .map(schema -> schema.validate(ctx, node))
                .orElseGet(() -> Optional.of(ValidationError.of(new ValidationErrorKind.UnknownSchema(uri))));
    }
}
