package io.yamlschema.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.yamlschema.core.engine.Context;
import io.yamlschema.core.error.DocumentValidationException;
import io.yamlschema.core.error.ValidationError;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A compiled top-level schema document: the URI it is registered under and its root node.
 *
 * <p>
 * Immutable and thread-safe. Validating many documents against the same schema from several
 * threads is safe as long as the {@link Context} is not mutated, which it never is.
 *
 * @param uri  the schema URI, unique within a {@link Context}
 * @param root the root node
 */
public record Schema(String uri, PropertyType root) {

    private static final Logger LOG = LoggerFactory.getLogger(Schema.class);

    public Schema {
        Objects.requireNonNull(uri, "uri must not be null");
        Objects.requireNonNull(root, "root must not be null");
    }

    /**
     * Validates a document against this schema.
     *
     * @param ctx      registry used to resolve {@code $ref} nodes
     * @param document the document root
     * @return empty if the document is valid, otherwise the complete error tree
     */
    public Optional<ValidationError> validate(Context ctx, JsonNode document) {
        Optional<ValidationError> result = root.validate(ctx, document);
        if (LOG.isDebugEnabled()) {
            result.ifPresentOrElse(
                    error -> LOG.debug("Document rejected by schema '{}': {} error(s)", uri, error.leafCount()),
                    () -> LOG.debug("Document accepted by schema '{}'", uri));
        }
        return result;
    }

    /**
     * Validates a document and throws if it does not conform.
     *
     * @throws DocumentValidationException carrying the error tree
     */
    public void requireValid(Context ctx, JsonNode document) {
        Optional<ValidationError> error = validate(ctx, document);
        if (error.isPresent()) {
            throw new DocumentValidationException(uri, error.get());
        }
    }
}
