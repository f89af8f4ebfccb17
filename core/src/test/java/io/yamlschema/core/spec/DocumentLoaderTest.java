package io.yamlschema.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.yamlschema.core.error.DocumentLoadException;
import io.yamlschema.core.error.YamlSchemaException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("DocumentLoader")
class DocumentLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("returns every document of a multi-document stream in order")
    void multipleDocuments() {
        List<JsonNode> documents = DocumentLoader.loadAll("""
                ---
                a: 1
                ---
                - b
                ---
                plain
                """);

        assertThat(documents).hasSize(3);
        assertThat(documents.get(0).get("a").intValue()).isEqualTo(1);
        assertThat(documents.get(1).isArray()).isTrue();
        assertThat(documents.get(2).textValue()).isEqualTo("plain");
    }

    @Test
    @DisplayName("reads documents from a file")
    void fromFile() throws IOException {
        Path file = tempDir.resolve("doc.yaml");
        Files.writeString(file, "name: test\nvalues: [1, 2.5, true]\n");

        List<JsonNode> documents = DocumentLoader.loadAll(file);

        assertThat(documents).hasSize(1);
        JsonNode values = documents.get(0).get("values");
        assertThat(values.get(0).isIntegralNumber()).isTrue();
        assertThat(values.get(1).isFloatingPointNumber()).isTrue();
        assertThat(values.get(2).isBoolean()).isTrue();
    }

    @Test
    @DisplayName("an unreadable file fails with the file name")
    void missingFile() {
        Path missing = tempDir.resolve("nope.yaml");

        assertThatThrownBy(() -> DocumentLoader.loadAll(missing))
                .isInstanceOfSatisfying(DocumentLoadException.class, e -> {
                    assertThat(e.getMessage()).isEqualTo("could not read file " + missing + ": no such file");
                    assertThat(e.source()).isEqualTo(missing.toString());
                    assertThat(e.phase()).isEqualTo(YamlSchemaException.Phase.LOAD);
                });
    }

    @Test
    @DisplayName("malformed YAML fails with a load error")
    void malformedYaml() {
        assertThatThrownBy(() -> DocumentLoader.loadAll("a: [1, 2"))
                .isInstanceOf(DocumentLoadException.class)
                .hasMessageStartingWith("could not parse <string>: ");
    }

    @Test
    @DisplayName("loadOne insists on exactly one document")
    void loadOne() {
        assertThat(DocumentLoader.loadOne("42").intValue()).isEqualTo(42);
        assertThatThrownBy(() -> DocumentLoader.loadOne("a: 1\n---\nb: 2\n"))
                .isInstanceOf(DocumentLoadException.class)
                .hasMessage("expected exactly one YAML document but found 2");
    }
}
