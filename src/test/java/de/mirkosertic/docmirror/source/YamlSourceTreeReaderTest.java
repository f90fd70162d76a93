package de.mirkosertic.docmirror.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("YamlSourceTreeReader Tests")
class YamlSourceTreeReaderTest {

    @TempDir
    Path tempDir;

    private Path copySample() throws IOException {
        final Path target = tempDir.resolve("document.yaml");
        try (final InputStream in = getClass().getResourceAsStream("/sample-document.yaml")) {
            assertThat(in).isNotNull();
            Files.copy(in, target);
        }
        return target;
    }

    private Path write(final String yaml) throws IOException {
        final Path target = tempDir.resolve("document.yaml");
        Files.writeString(target, yaml, StandardCharsets.UTF_8);
        return target;
    }

    @Test
    @DisplayName("Should read the document id and the nested nodes")
    void shouldReadTree() throws IOException {
        // Given
        final YamlSourceTreeReader reader = new YamlSourceTreeReader(copySample());

        // When
        final String documentId = reader.documentId();
        final List<SourceNode> nodes = reader.listTopLevelNodes();

        // Then
        assertThat(documentId).isEqualTo("doc-123");
        assertThat(nodes).extracting(SourceNode::id).containsExactly("t.a");
        final SourceNode a = nodes.get(0);
        assertThat(a.title()).isEqualTo("A");
        assertThat(a.content()).isEqualTo("Alpha overview.\n");
        assertThat(a.children()).extracting(SourceNode::id).containsExactly("t.b", "t.c");
        assertThat(a.children().get(1).children()).extracting(SourceNode::title).containsExactly("D");
    }

    @Test
    @DisplayName("Should skip nodes that are not documents")
    void shouldSkipOtherKinds() throws IOException {
        final YamlSourceTreeReader reader = new YamlSourceTreeReader(copySample());

        assertThat(reader.listTopLevelNodes())
                .extracting(SourceNode::id)
                .doesNotContain("t.x");
    }

    @Test
    @DisplayName("Should pick up edits on the next read")
    void shouldRereadFile() throws IOException {
        // Given
        final Path file = write("""
                document:
                  id: d
                  nodes:
                    - id: n1
                      title: One
                """);
        final YamlSourceTreeReader reader = new YamlSourceTreeReader(file);
        assertThat(reader.listTopLevelNodes()).extracting(SourceNode::title).containsExactly("One");

        // When
        write("""
                document:
                  id: d
                  nodes:
                    - id: n1
                      title: Renamed
                """);

        // Then
        assertThat(reader.listTopLevelNodes()).extracting(SourceNode::title).containsExactly("Renamed");
    }

    @Test
    @DisplayName("Should default missing title and content to empty strings")
    void shouldDefaultMissingFields() throws IOException {
        final YamlSourceTreeReader reader = new YamlSourceTreeReader(write("""
                document:
                  id: d
                  nodes:
                    - id: n1
                """));

        final SourceNode node = reader.listTopLevelNodes().get(0);
        assertThat(node.title()).isEmpty();
        assertThat(node.content()).isEmpty();
        assertThat(node.hasChildren()).isFalse();
    }

    @Test
    @DisplayName("Should fail for a missing file")
    void shouldFailForMissingFile() {
        final YamlSourceTreeReader reader = new YamlSourceTreeReader(tempDir.resolve("missing.yaml"));

        assertThatThrownBy(reader::listTopLevelNodes)
                .isInstanceOf(IOException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    @DisplayName("Should fail for a node without id")
    void shouldFailForNodeWithoutId() throws IOException {
        final YamlSourceTreeReader reader = new YamlSourceTreeReader(write("""
                document:
                  id: d
                  nodes:
                    - title: Nameless
                """));

        assertThatThrownBy(reader::listTopLevelNodes)
                .isInstanceOf(IOException.class)
                .hasMessageContaining("has no id");
    }

    @Test
    @DisplayName("Should fail for a missing document id")
    void shouldFailForMissingDocumentId() throws IOException {
        final YamlSourceTreeReader reader = new YamlSourceTreeReader(write("""
                document:
                  nodes: []
                """));

        assertThatThrownBy(reader::documentId)
                .isInstanceOf(IOException.class)
                .hasMessageContaining("document.id");
    }

    @Test
    @DisplayName("Should fail for unexpected structure")
    void shouldFailForBadStructure() throws IOException {
        assertThatThrownBy(() -> new YamlSourceTreeReader(write("just a string")).listTopLevelNodes())
                .isInstanceOf(IOException.class)
                .hasMessageContaining("'document'");
        assertThatThrownBy(() -> new YamlSourceTreeReader(write("""
                document:
                  id: d
                  nodes: not-a-list
                """)).listTopLevelNodes())
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Expected a list");
        assertThatThrownBy(() -> new YamlSourceTreeReader(write("document: [unclosed")).listTopLevelNodes())
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Failed to parse");
    }
}
