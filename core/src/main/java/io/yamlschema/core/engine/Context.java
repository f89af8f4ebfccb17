package io.yamlschema.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.yamlschema.core.error.SchemaCompileException;
import io.yamlschema.core.error.SchemaError;
import io.yamlschema.core.error.SchemaErrorKind;
import io.yamlschema.core.model.PropertyType;
import io.yamlschema.core.model.Schema;
import io.yamlschema.core.model.SchemaReference;
import io.yamlschema.core.spec.SchemaCompiler;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable registry of compiled schemas keyed by URI.
 *
 * <p>
 * {@code $ref} nodes are resolved against this registry at validation time, never at compile time,
 * so schemas may reference themselves or each other in any registration order. A reference to a
 * URI that is not registered only fails when a document actually reaches it; use
 * {@link #unresolvedReferences()} to detect such references up front.
 *
 * <p>
 * When two schemas share a URI the one registered last replaces the earlier one.
 *
 * <p>
 * Thread-safe: all fields are final and the map is unmodifiable.
 */
public final class Context {

    private static final Logger LOG = LoggerFactory.getLogger(Context.class);

    private final Map<String, Schema> schemas;

    private Context(Map<String, Schema> schemas) {
        this.schemas = Collections.unmodifiableMap(new TreeMap<>(schemas));
    }

    /** Returns a context with no schemas. */
    public static Context empty() {
        return new Context(Map.of());
    }

    /** Returns a new {@link Builder} for registering schemas one at a time. */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Compiles every top-level schema document and registers the results in order.
     *
     * <p>
     * All documents are compiled even after one fails; the errors of every failing document are
     * condensed into a single report.
     *
     * @param documents parsed {@code {uri, schema}} documents
     * @return the populated context
     * @throws SchemaCompileException if any document fails to compile
     */
    public static Context fromDocuments(List<JsonNode> documents) {
        Builder builder = builder();
        List<SchemaError> errors = new ArrayList<>();
        for (JsonNode document : documents) {
            try {
                builder.add(SchemaCompiler.compileSchema(document));
            } catch (SchemaCompileException e) {
                errors.add(e.error());
            }
        }
        Optional<SchemaError> failure = SchemaError.condense(errors);
        if (failure.isPresent()) {
            LOG.debug("{} of {} schema document(s) failed to compile", errors.size(), documents.size());
            throw new SchemaCompileException(failure.get());
        }
        return builder.build();
    }

    /**
     * Looks up a schema by URI.
     *
     * @param uri the schema URI
     * @return the schema, or empty if none is registered under {@code uri}
     */
    public Optional<Schema> getSchema(String uri) {
        return Optional.ofNullable(schemas.get(uri));
    }

    /**
     * Looks up a schema by URI, failing if it is not registered.
     *
     * @throws SchemaCompileException with an {@code UnknownSchema} error
     */
    public Schema requireSchema(String uri) {
        Schema schema = schemas.get(uri);
        if (schema == null) {
            throw new SchemaCompileException(new SchemaErrorKind.UnknownSchema(uri));
        }
        return schema;
    }

    /** Registered URIs in sorted order. */
    public Set<String> uris() {
        return schemas.keySet();
    }

    public int size() {
        return schemas.size();
    }

    /**
     * Reports every {@code $ref} whose target URI is not registered. Each dangling reference yields
     * one {@code UnknownSchema} error at the path of the schema that contains it; a URI referenced
     * several times from the same schema is reported once.
     *
     * @return the condensed error, or empty if every reference resolves
     */
    public Optional<SchemaError> unresolvedReferences() {
        List<SchemaError> errors = new ArrayList<>();
        for (Schema schema : schemas.values()) {
            for (String target : referencedUris(schema.root())) {
                if (!schemas.containsKey(target)) {
                    errors.add(SchemaError.of(new SchemaErrorKind.UnknownSchema(target)).withPathName(schema.uri()));
                }
            }
        }
        return SchemaError.condense(errors);
    }

    private static Set<String> referencedUris(PropertyType root) {
        Set<String> uris = new LinkedHashSet<>();
        Deque<PropertyType> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            PropertyType node = pending.pop();
            if (node instanceof SchemaReference reference) {
                uris.add(reference.uri());
            }
            List<PropertyType> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return uris;
    }

    /** Collects schemas for a {@link Context}. Not thread-safe. */
    public static final class Builder {

        private final Map<String, Schema> schemas = new TreeMap<>();

        Builder() {}

        /**
         * Registers a schema under its URI, replacing any schema already registered there.
         *
         * @return this builder
         */
        public Builder add(Schema schema) {
            Schema previous = schemas.put(schema.uri(), schema);
            if (previous != null) {
                LOG.warn("Schema URI '{}' registered more than once, the last definition wins", schema.uri());
            } else {
                LOG.debug("Registered schema '{}'", schema.uri());
            }
            return this;
        }

        public Context build() {
            return new Context(schemas);
        }
    }
}
