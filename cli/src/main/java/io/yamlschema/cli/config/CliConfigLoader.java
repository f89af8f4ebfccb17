package io.yamlschema.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Builds a {@link CliConfig} from three layered sources, lowest precedence first:
 * <ol>
 * <li>an optional YAML file named by {@code --config}</li>
 * <li>environment variables ({@code YAML_VALIDATOR_*})</li>
 * <li>command-line flags and positional file arguments</li>
 * </ol>
 *
 * <p>
 * An environment variable counts as set only if its trimmed value is non-empty. List-valued
 * settings are replaced, never merged, by a higher layer.
 */
public final class CliConfigLoader {

    static final String ENV_URI = "YAML_VALIDATOR_URI";
    static final String ENV_SCHEMAS = "YAML_VALIDATOR_SCHEMAS";
    static final String ENV_LOG_LEVEL = "YAML_VALIDATOR_LOG_LEVEL";
    static final String ENV_LOG_FORMAT = "YAML_VALIDATOR_LOG_FORMAT";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("schemas", "uri", "check-refs", "logging");
    private static final Set<String> KNOWN_LOGGING_KEYS = Set.of("level", "format");
    private static final Set<String> LOG_FORMATS = Set.of("text", "json");

    private CliConfigLoader() {
        // utility class
    }

    /** Loads the configuration using the process environment. */
    public static CliConfig load(String[] args) {
        return load(args, System::getenv);
    }

    /**
     * Loads the configuration.
     *
     * @param args      command-line arguments
     * @param envLookup environment lookup; {@code null} means undefined
     * @throws CliConfigException on malformed arguments or an unreadable config file
     */
    public static CliConfig load(String[] args, Function<String, String> envLookup) {
        Arguments parsed = Arguments.parse(args);
        CliConfig.Builder builder = CliConfig.builder();

        if (parsed.configFile != null) {
            applyFile(builder, parsed.configFile);
        }
        applyEnv(builder, envLookup);
        parsed.applyTo(builder);

        CliConfig config = builder.build();
        if (!LOG_FORMATS.contains(config.loggingFormat().toLowerCase(Locale.ROOT))) {
            throw new CliConfigException("unsupported log format '" + config.loggingFormat() + "', use text or json");
        }
        return config;
    }

    private static void applyFile(CliConfig.Builder builder, Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            throw new CliConfigException("configuration file not found: " + configFile);
        }

        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(configFile.toFile());
        } catch (IOException e) {
            throw new CliConfigException("failed to parse configuration file " + configFile + ": " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return;
        }
        if (!root.isObject()) {
            throw new CliConfigException("configuration file " + configFile + " must contain a mapping");
        }
        rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "configuration");

        Path base = configFile.toAbsolutePath().getParent();
        JsonNode schemas = root.path("schemas");
        if (!schemas.isMissingNode()) {
            if (!schemas.isArray()) {
                throw new CliConfigException("'schemas' must be a list of file paths");
            }
            List<Path> paths = new ArrayList<>();
            for (JsonNode schema : schemas) {
                paths.add(base.resolve(schema.asText()));
            }
            builder.schemas(paths);
        }
        if (root.hasNonNull("uri")) {
            builder.uri(root.get("uri").asText());
        }
        if (root.hasNonNull("check-refs")) {
            builder.checkRefs(root.get("check-refs").asBoolean());
        }

        JsonNode logging = root.path("logging");
        if (logging.isObject()) {
            rejectUnknownKeys(logging, KNOWN_LOGGING_KEYS, "logging");
            if (logging.hasNonNull("level")) builder.loggingLevel(logging.get("level").asText());
            if (logging.hasNonNull("format")) builder.loggingFormat(logging.get("format").asText());
        }
    }

    private static void applyEnv(CliConfig.Builder builder, Function<String, String> envLookup) {
        applyString(envLookup, ENV_URI, builder::uri);
        applyString(envLookup, ENV_LOG_LEVEL, builder::loggingLevel);
        applyString(envLookup, ENV_LOG_FORMAT, builder::loggingFormat);
        applyString(envLookup, ENV_SCHEMAS, value -> {
            List<Path> paths = new ArrayList<>();
            for (String entry : value.split(File.pathSeparator)) {
                if (!entry.isBlank()) {
                    paths.add(Path.of(entry.trim()));
                }
            }
            builder.schemas(paths);
        });
    }

    private static void applyString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        String value = envLookup.apply(envVar);
        if (value != null && !value.trim().isEmpty()) {
            setter.accept(value.trim());
        }
    }

    private static void rejectUnknownKeys(JsonNode node, Set<String> known, String block) {
        node.fieldNames().forEachRemaining(key -> {
            if (!known.contains(key)) {
                throw new CliConfigException("unknown key '" + key + "' in " + block + " block");
            }
        });
    }

    /** Command-line flags, kept apart so they can be applied after the file and environment. */
    private static final class Arguments {
        private Path configFile;
        private final List<Path> schemas = new ArrayList<>();
        private final List<Path> files = new ArrayList<>();
        private String uri;
        private boolean checkRefs;
        private String logLevel;
        private String logFormat;
        private boolean help;

        static Arguments parse(String[] args) {
            Arguments parsed = new Arguments();
            boolean positionalOnly = false;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (positionalOnly || !arg.startsWith("-") || "-".equals(arg)) {
                    parsed.files.add(Path.of(arg));
                    continue;
                }
                switch (arg) {
                    case "--":
                        positionalOnly = true;
                        break;
                    case "-h":
                    case "--help":
                        parsed.help = true;
                        break;
                    case "-s":
                    case "--schema":
                        parsed.schemas.add(Path.of(value(args, ++i, arg)));
                        break;
                    case "-u":
                    case "--uri":
                        parsed.uri = value(args, ++i, arg);
                        break;
                    case "--config":
                        parsed.configFile = Path.of(value(args, ++i, arg));
                        break;
                    case "--check-refs":
                        parsed.checkRefs = true;
                        break;
                    case "--log-level":
                        parsed.logLevel = value(args, ++i, arg);
                        break;
                    case "--log-format":
                        parsed.logFormat = value(args, ++i, arg);
                        break;
                    default:
                        throw new CliConfigException("unknown option '" + arg + "', use --help for more information");
                }
            }
            return parsed;
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new CliConfigException(option + " requires a value");
            }
            return args[index];
        }

        void applyTo(CliConfig.Builder builder) {
            if (!schemas.isEmpty()) builder.schemas(schemas);
            if (uri != null) builder.uri(uri);
            if (checkRefs) builder.checkRefs(true);
            if (logLevel != null) builder.loggingLevel(logLevel);
            if (logFormat != null) builder.loggingFormat(logFormat);
            builder.files(files);
            builder.help(help);
        }
    }
}
