package io.yamlschema.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link CliConfigLoader}: flag parsing, environment overlay and the config file. */
@DisplayName("CliConfigLoader")
class CliConfigLoaderTest {

    private static final Map<String, String> NO_ENV = Map.of();

    @TempDir
    Path tempDir;

    private static CliConfig load(Map<String, String> env, String... args) {
        return CliConfigLoader.load(args, env::get);
    }

    @Nested
    @DisplayName("flags")
    class FlagTests {

        @Test
        @DisplayName("parses short and long options and positional files")
        void parsesAll() {
            CliConfig config = load(
                    NO_ENV,
                    "-s", "a.yaml",
                    "--schema", "b.yaml",
                    "-u", "person",
                    "--check-refs",
                    "--log-level", "DEBUG",
                    "--log-format", "json",
                    "one.yaml",
                    "two.yaml");

            assertThat(config.schemas()).containsExactly(Path.of("a.yaml"), Path.of("b.yaml"));
            assertThat(config.uri()).isEqualTo("person");
            assertThat(config.files()).containsExactly(Path.of("one.yaml"), Path.of("two.yaml"));
            assertThat(config.checkRefs()).isTrue();
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.help()).isFalse();
        }

        @Test
        @DisplayName("applies defaults when nothing is given")
        void defaults() {
            CliConfig config = load(NO_ENV);

            assertThat(config.schemas()).isEmpty();
            assertThat(config.files()).isEmpty();
            assertThat(config.uri()).isNull();
            assertThat(config.checkRefs()).isFalse();
            assertThat(config.loggingLevel()).isEqualTo("WARN");
            assertThat(config.loggingFormat()).isEqualTo("text");
        }

        @Test
        @DisplayName("everything after -- is a file")
        void doubleDash() {
            CliConfig config = load(NO_ENV, "--", "--weird-name.yaml");

            assertThat(config.files()).containsExactly(Path.of("--weird-name.yaml"));
        }

        @Test
        @DisplayName("recognizes --help")
        void help() {
            assertThat(load(NO_ENV, "--help").help()).isTrue();
            assertThat(load(NO_ENV, "-h").help()).isTrue();
        }

        @Test
        @DisplayName("rejects unknown options and missing values")
        void usageErrors() {
            assertThatThrownBy(() -> load(NO_ENV, "--bogus"))
                    .isInstanceOf(CliConfigException.class)
                    .hasMessage("unknown option '--bogus', use --help for more information");
            assertThatThrownBy(() -> load(NO_ENV, "--uri"))
                    .isInstanceOf(CliConfigException.class)
                    .hasMessage("--uri requires a value");
        }

        @Test
        @DisplayName("rejects unsupported log formats")
        void logFormat() {
            assertThatThrownBy(() -> load(NO_ENV, "--log-format", "xml"))
                    .isInstanceOf(CliConfigException.class)
                    .hasMessage("unsupported log format 'xml', use text or json");
        }
    }

    @Nested
    @DisplayName("environment")
    class EnvTests {

        @Test
        @DisplayName("supplies values not given as flags")
        void overlay() {
            Map<String, String> env = new HashMap<>();
            env.put(CliConfigLoader.ENV_URI, "person");
            env.put(CliConfigLoader.ENV_SCHEMAS, "a.yaml" + File.pathSeparator + "b.yaml");
            env.put(CliConfigLoader.ENV_LOG_LEVEL, "INFO");
            env.put(CliConfigLoader.ENV_LOG_FORMAT, "json");

            CliConfig config = load(env, "doc.yaml");

            assertThat(config.uri()).isEqualTo("person");
            assertThat(config.schemas()).containsExactly(Path.of("a.yaml"), Path.of("b.yaml"));
            assertThat(config.loggingLevel()).isEqualTo("INFO");
            assertThat(config.loggingFormat()).isEqualTo("json");
        }

        @Test
        @DisplayName("flags take precedence over the environment")
        void flagsWin() {
            Map<String, String> env = Map.of(
                    CliConfigLoader.ENV_URI, "from-env",
                    CliConfigLoader.ENV_SCHEMAS, "env.yaml");

            CliConfig config = load(env, "-u", "from-flag", "-s", "flag.yaml");

            assertThat(config.uri()).isEqualTo("from-flag");
            assertThat(config.schemas()).containsExactly(Path.of("flag.yaml"));
        }

        @Test
        @DisplayName("blank values count as unset")
        void blankIgnored() {
            CliConfig config = load(Map.of(CliConfigLoader.ENV_URI, "   ", CliConfigLoader.ENV_LOG_LEVEL, ""));

            assertThat(config.uri()).isNull();
            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }
    }

    @Nested
    @DisplayName("config file")
    class FileTests {

        @Test
        @DisplayName("supplies values and resolves schema paths against its directory")
        void readsFile() throws IOException {
            Path file = tempDir.resolve("validator.yaml");
            Files.writeString(file, """
                    schemas:
                      - schemas/person.yaml
                    uri: person
                    check-refs: true
                    logging:
                      level: DEBUG
                      format: json
                    """);

            CliConfig config = load(NO_ENV, "--config", file.toString());

            assertThat(config.schemas()).containsExactly(tempDir.toAbsolutePath().resolve("schemas/person.yaml"));
            assertThat(config.uri()).isEqualTo("person");
            assertThat(config.checkRefs()).isTrue();
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
            assertThat(config.loggingFormat()).isEqualTo("json");
        }

        @Test
        @DisplayName("environment and flags override the file")
        void precedence() throws IOException {
            Path file = tempDir.resolve("validator.yaml");
            Files.writeString(file, "uri: from-file\nlogging:\n  level: ERROR\n");

            CliConfig config = load(
                    Map.of(CliConfigLoader.ENV_LOG_LEVEL, "INFO"), "--config", file.toString(), "-u", "from-flag");

            assertThat(config.uri()).isEqualTo("from-flag");
            assertThat(config.loggingLevel()).isEqualTo("INFO");
        }

        @Test
        @DisplayName("rejects unknown keys and missing files")
        void errors() throws IOException {
            Path file = tempDir.resolve("validator.yaml");
            Files.writeString(file, "uri: a\nschema: b\n");

            assertThatThrownBy(() -> load(NO_ENV, "--config", file.toString()))
                    .isInstanceOf(CliConfigException.class)
                    .hasMessage("unknown key 'schema' in configuration block");
            assertThatThrownBy(() -> load(NO_ENV, "--config", tempDir.resolve("missing.yaml").toString()))
                    .isInstanceOf(CliConfigException.class)
                    .hasMessageStartingWith("configuration file not found: ");
        }
    }
}
