package de.mirkosertic.docmirror.sync;

import de.mirkosertic.docmirror.testsupport.InMemoryPropertyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StateStore Tests")
class StateStoreTest {

    private InMemoryPropertyStore properties;
    private StateStore stateStore;

    @BeforeEach
    void setUp() {
        properties = new InMemoryPropertyStore();
        stateStore = new StateStore(properties);
    }

    @Test
    @DisplayName("Should start empty when nothing is stored")
    void shouldStartEmpty() {
        assertThat(stateStore.load().isEmpty()).isTrue();
        assertThat(stateStore.lastRunAt()).isEmpty();
    }

    @Test
    @DisplayName("Should persist entries including nulls and keep their order")
    void shouldPersistEntries() {
        // Given
        final SyncState state = new SyncState();
        state.put("t.b", new TrackedEntry("file-2", null, "B", "t.a"));
        state.put("t.a", new TrackedEntry("file-1", "folder-1", "A", TrackedEntry.ROOT_PARENT));

        // When
        stateStore.save(state);
        final SyncState loaded = stateStore.load();

        // Then
        assertThat(loaded.nodeIds()).containsExactly("t.b", "t.a");
        assertThat(loaded.get("t.a")).isEqualTo(new TrackedEntry("file-1", "folder-1", "A", "ROOT"));
        assertThat(loaded.get("t.b").getFolderId()).isNull();
    }

    @Test
    @DisplayName("Should store the state as JSON under the sync_state key")
    void shouldUseJsonBlob() {
        final SyncState state = new SyncState();
        state.put("t.a", new TrackedEntry("file-1", null, "A", "ROOT"));

        stateStore.save(state);

        assertThat(properties.getProperty(StateStore.STATE_KEY))
                .startsWith("{\"t.a\":{")
                .contains("\"fileId\":\"file-1\"", "\"parentKey\":\"ROOT\"");
    }

    @Test
    @DisplayName("Should degrade to an empty state when the blob is corrupt")
    void shouldDegradeOnCorruptBlob() {
        properties.setProperty(StateStore.STATE_KEY, "[1, 2");

        assertThat(stateStore.load().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should ignore unknown fields written by other versions")
    void shouldIgnoreUnknownFields() {
        properties.setProperty(StateStore.STATE_KEY,
                "{\"t.a\":{\"fileId\":\"f\",\"folderId\":null,\"title\":\"A\",\"parentKey\":\"ROOT\",\"color\":\"red\"}}");

        assertThat(stateStore.load().get("t.a").getFileId()).isEqualTo("f");
    }

    @Test
    @DisplayName("Should record the time of the last completed run")
    void shouldRecordLastRun() {
        final Instant completedAt = Instant.parse("2026-03-01T10:15:30Z");

        stateStore.recordRun(completedAt);

        assertThat(stateStore.lastRunAt()).contains(completedAt);
    }
}
