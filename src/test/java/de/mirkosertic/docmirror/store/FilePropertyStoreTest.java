package de.mirkosertic.docmirror.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FilePropertyStore Tests")
class FilePropertyStoreTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should persist properties across instances")
    void shouldPersistAcrossInstances() {
        // Given
        final Path file = tempDir.resolve("state/properties.yaml");
        final FilePropertyStore store = new FilePropertyStore(file);

        // When
        store.setProperty("hash_t.a", "abc");
        store.setProperty("run_lock", "123");

        // Then
        assertThat(file).exists();
        final FilePropertyStore reopened = new FilePropertyStore(file);
        assertThat(reopened.getProperty("hash_t.a")).isEqualTo("abc");
        assertThat(reopened.getProperty("run_lock")).isEqualTo("123");
        assertThat(reopened.keys()).containsExactly("hash_t.a", "run_lock");
    }

    @Test
    @DisplayName("Should delete single and all properties")
    void shouldDeleteProperties() {
        final FilePropertyStore store = new FilePropertyStore(tempDir.resolve("properties.yaml"));
        store.setProperty("a", "1");
        store.setProperty("b", "2");

        store.deleteProperty("a");
        assertThat(store.getProperty("a")).isNull();
        assertThat(store.keys()).containsExactly("b");

        store.deleteAllProperties();
        assertThat(store.keys()).isEmpty();
        assertThat(new FilePropertyStore(tempDir.resolve("properties.yaml")).keys()).isEmpty();
    }

    @Test
    @DisplayName("Should start empty when the file is not valid YAML")
    void shouldStartEmptyOnCorruptFile() throws IOException {
        // Given
        final Path file = tempDir.resolve("properties.yaml");
        Files.writeString(file, "key: [unclosed", StandardCharsets.UTF_8);

        // When
        final FilePropertyStore store = new FilePropertyStore(file);

        // Then
        assertThat(store.keys()).isEmpty();
        store.setProperty("fresh", "value");
        assertThat(new FilePropertyStore(file).getProperty("fresh")).isEqualTo("value");
    }

    @Test
    @DisplayName("Should pick up changes written by another instance")
    void shouldReloadExternalChanges() throws IOException {
        // Given
        final Path file = tempDir.resolve("properties.yaml");
        final FilePropertyStore first = new FilePropertyStore(file);
        first.setProperty("run_lock", "1000");
        final FilePropertyStore second = new FilePropertyStore(file);

        // When
        second.deleteProperty("run_lock");
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2030-01-01T00:00:00Z")));

        // Then
        assertThat(first.getProperty("run_lock")).isNull();
    }
}
