package io.yamlschema.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.yamlschema.cli.config.CliConfig;
import io.yamlschema.core.engine.Context;
import io.yamlschema.core.error.DocumentLoadException;
import io.yamlschema.core.error.SchemaCompileException;
import io.yamlschema.core.error.SchemaError;
import io.yamlschema.core.error.ValidationError;
import io.yamlschema.core.model.Schema;
import io.yamlschema.core.spec.DocumentLoader;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the schema files into one {@link Context}, then validates every document of every file
 * against the selected schema.
 *
 * <p>
 * Validation does not stop at the first failing document. Each failure is printed to {@code err}
 * as the file name, a colon and a newline, then the rendered report. A file holding several
 * documents is labelled {@code <file>#<n>}, counting from 1.
 */
public final class ValidateCommand {

    private static final Logger LOG = LoggerFactory.getLogger(ValidateCommand.class);

    static final String SUCCESS = "all files validated successfully!";
    static final String NO_SCHEMAS = "no schemas supplied, see the --schema option for information";
    static final String NO_FILES = "no files to validate were supplied, use --help for more information";
    static final String NO_URI = "no schema uri supplied, see the --uri option for information";

    private ValidateCommand() {
        // utility class
    }

    /**
     * Runs one validation pass.
     *
     * @return the process exit code: 0 if every document is valid, 1 otherwise
     */
    public static int run(CliConfig config, PrintStream out, PrintStream err) {
        if (config.schemas().isEmpty()) {
            err.println(NO_SCHEMAS);
            return 1;
        }
        if (config.files().isEmpty()) {
            err.println(NO_FILES);
            return 1;
        }
        if (config.uri() == null) {
            err.println(NO_URI);
            return 1;
        }

        Optional<Context> context = loadContext(config.schemas(), err);
        if (context.isEmpty()) {
            return 1;
        }
        Context ctx = context.get();

        if (config.checkRefs()) {
            Optional<SchemaError> dangling = ctx.unresolvedReferences();
            if (dangling.isPresent()) {
                err.print(dangling.get().render());
                return 1;
            }
        }

        Optional<Schema> selected = ctx.getSchema(config.uri());
        if (selected.isEmpty()) {
            err.println("schema referenced by uri `" + config.uri() + "` not found in context");
            return 1;
        }
        Schema schema = selected.get();

        int failures = 0;
        int validated = 0;
        for (Path file : config.files()) {
            List<JsonNode> documents;
            try {
                documents = DocumentLoader.loadAll(file);
            } catch (DocumentLoadException e) {
                err.println(e.getMessage());
                failures++;
                continue;
            }
            for (int i = 0; i < documents.size(); i++) {
                validated++;
                Optional<ValidationError> error = schema.validate(ctx, documents.get(i));
                if (error.isPresent()) {
                    String label = documents.size() > 1 ? file + "#" + (i + 1) : file.toString();
                    err.print(label + ":\n" + error.get().render());
                    failures++;
                }
            }
        }

        LOG.info("Validated {} document(s) against '{}', {} failure(s)", validated, schema.uri(), failures);
        if (failures > 0) {
            return 1;
        }
        out.println(SUCCESS);
        return 0;
    }

    private static Optional<Context> loadContext(List<Path> schemaFiles, PrintStream err) {
        List<JsonNode> documents = new ArrayList<>();
        boolean readable = true;
        for (Path file : schemaFiles) {
            try {
                documents.addAll(DocumentLoader.loadAll(file));
            } catch (DocumentLoadException e) {
                err.println(e.getMessage());
                readable = false;
            }
        }
        if (!readable) {
            return Optional.empty();
        }

        try {
            Context ctx = Context.fromDocuments(documents);
            LOG.debug("Loaded {} schema(s) from {} file(s)", ctx.size(), schemaFiles.size());
            return Optional.of(ctx);
        } catch (SchemaCompileException e) {
            err.print(e.error().render());
            return Optional.empty();
        }
    }
}
