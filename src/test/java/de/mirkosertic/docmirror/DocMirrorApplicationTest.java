package de.mirkosertic.docmirror;

import de.mirkosertic.docmirror.config.ApplicationConfig;
import de.mirkosertic.docmirror.sync.ReconciliationResult;
import de.mirkosertic.docmirror.testsupport.InMemoryDestinationBackend;
import de.mirkosertic.docmirror.testsupport.InMemoryPropertyStore;
import de.mirkosertic.docmirror.testsupport.MutableClock;
import de.mirkosertic.docmirror.testsupport.RecordingAuditSink;
import de.mirkosertic.docmirror.testsupport.ScriptedRenderer;
import de.mirkosertic.docmirror.util.Sleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DocMirrorApplication Tests")
class DocMirrorApplicationTest {

    @TempDir
    Path tempDir;

    private final ScriptedRenderer renderer = new ScriptedRenderer();
    private final InMemoryDestinationBackend backend = new InMemoryDestinationBackend();
    private final InMemoryPropertyStore properties = new InMemoryPropertyStore();
    private final RecordingAuditSink audit = new RecordingAuditSink();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));

    private Path sourceFile;

    @BeforeEach
    void setUp() throws IOException {
        sourceFile = tempDir.resolve("document.yaml");
        try (final InputStream in = getClass().getResourceAsStream("/sample-document.yaml")) {
            assertThat(in).isNotNull();
            Files.copy(in, sourceFile);
        }
    }

    private ApplicationConfig config(final String extra) throws IOException {
        final Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, """
                docmirror:
                  source:
                    file: '%s'
                  destination:
                    root: '%s'
                  state:
                    directory: '%s'
                %s""".formatted(sourceFile, tempDir.resolve("mirror"), tempDir.resolve("state"), extra),
                StandardCharsets.UTF_8);
        return ApplicationConfig.load(file);
    }

    private DocMirrorApplication application(final ApplicationConfig config) {
        return new DocMirrorApplication(config, renderer, backend, properties, audit, Sleeper.NONE, clock);
    }

    @Test
    @DisplayName("Should mirror the configured source file")
    void shouldReconcileConfiguredSource() throws IOException {
        // Given
        final DocMirrorApplication application = application(config(""));

        // When
        final ReconciliationResult result = application.reconcile();

        // Then
        assertThat(result.isCompleted()).isTrue();
        assertThat(result.exported()).isEqualTo(4);
        assertThat(backend.livePaths()).contains("A.pdf", "A/B.pdf", "A/C.pdf", "A/C/D.pdf");
        assertThat(application.getStateStore().lastRunAt()).contains(clock.instant());
        assertThat(application.getRunLock().isHeld()).isFalse();
    }

    @Test
    @DisplayName("Should export everything again on a full resync")
    void shouldForceFullResync() throws IOException {
        // Given
        final DocMirrorApplication application = application(config(""));
        application.reconcile();
        renderer.clearRequests();

        // When
        final ReconciliationResult result = application.forceFullResync();

        // Then
        assertThat(result.isCompleted()).isTrue();
        assertThat(renderer.renderedNodeIds()).containsExactlyInAnyOrder("t.a", "t.b", "t.c", "t.d");
    }

    @Test
    @DisplayName("Should keep a single schedule registration when started twice")
    void shouldRegisterScheduleOnce() throws IOException {
        final DocMirrorApplication application = application(config("""
                  schedule:
                    interval-ms: 3600000
                """));

        application.startScheduler();
        application.startScheduler();

        assertThat(application.getScheduler().registeredNames()).containsExactly(DocMirrorApplication.SCHEDULE_NAME);
        application.shutdown();
    }

    @Test
    @DisplayName("Should refuse an incomplete configuration")
    void shouldValidateConfiguration() throws IOException {
        final Path file = tempDir.resolve("incomplete.yaml");
        Files.writeString(file, "docmirror: {}", StandardCharsets.UTF_8);
        final ApplicationConfig config = ApplicationConfig.load(file);

        assertThatThrownBy(() -> application(config))
                .isInstanceOf(IllegalStateException.class);
    }
}
