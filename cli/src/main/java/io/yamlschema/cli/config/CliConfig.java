package io.yamlschema.cli.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolved settings for one validator run.
 *
 * <p>
 * Use {@link #builder()} to construct instances. Lists are copied, so a config never changes after
 * it is built.
 *
 * @param schemas       schema files, loaded into one context in this order
 * @param uri           URI of the schema every document is validated against
 * @param files         document files to validate
 * @param checkRefs     report dangling {@code $ref} targets before validating
 * @param loggingLevel  root log level (TRACE, DEBUG, INFO, WARN, ERROR)
 * @param loggingFormat {@code text} or {@code json}
 * @param help          print usage and exit
 */
public record CliConfig(
        List<Path> schemas,
        String uri,
        List<Path> files,
        boolean checkRefs,
        String loggingLevel,
        String loggingFormat,
        boolean help) {

    public CliConfig {
        schemas = List.copyOf(schemas);
        files = List.copyOf(files);
    }

    /** Creates a new builder with defaults applied. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CliConfig}. */
    public static final class Builder {
        private List<Path> schemas = new ArrayList<>();
        private String uri;
        private List<Path> files = new ArrayList<>();
        private boolean checkRefs;
        private String loggingLevel = "WARN";
        private String loggingFormat = "text";
        private boolean help;

        Builder() {}

        /** Replaces the schema list. */
        public Builder schemas(List<Path> schemas) {
            this.schemas = new ArrayList<>(schemas);
            return this;
        }

        public Builder uri(String uri) {
            this.uri = uri;
            return this;
        }

        /** Replaces the document list. */
        public Builder files(List<Path> files) {
            this.files = new ArrayList<>(files);
            return this;
        }

        public Builder checkRefs(boolean checkRefs) {
            this.checkRefs = checkRefs;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder help(boolean help) {
            this.help = help;
            return this;
        }

        public CliConfig build() {
            return new CliConfig(schemas, uri, files, checkRefs, loggingLevel, loggingFormat, help);
        }
    }
}
