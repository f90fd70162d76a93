package de.mirkosertic.docmirror.sync;

import de.mirkosertic.docmirror.source.SourceNode;
import de.mirkosertic.docmirror.testsupport.InMemoryPropertyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ChangeDetector Tests")
class ChangeDetectorTest {

    private InMemoryPropertyStore properties;
    private ChangeDetector detector;

    @BeforeEach
    void setUp() {
        properties = new InMemoryPropertyStore();
        detector = new ChangeDetector(properties);
    }

    @Test
    @DisplayName("Should produce the MD5 hex digest of the content")
    void shouldUseMd5Hex() {
        assertThat(detector.fingerprint("")).isEqualTo("d41d8cd98f00b204e9800998ecf8427e");
        assertThat(detector.fingerprint("abc")).isEqualTo("900150983cd24fb0d6963f7d28e17f72");
    }

    @Test
    @DisplayName("Should fingerprint line ending variants identically")
    void shouldNormalizeLineEndings() {
        assertThat(detector.fingerprint("one\r\ntwo")).isEqualTo(detector.fingerprint("one\ntwo"));
        assertThat(detector.fingerprint("one\rtwo")).isEqualTo(detector.fingerprint("one\ntwo"));
    }

    @Test
    @DisplayName("Should fingerprint composed and decomposed umlauts identically")
    void shouldNormalizeUnicode() {
        assertThat(detector.fingerprint("Gr\u00FCn")).isEqualTo(detector.fingerprint("Gru\u0308n"));
    }

    @Test
    @DisplayName("Should treat a node without stored fingerprint as changed")
    void shouldReportUnknownNodeAsChanged() {
        final SourceNode node = SourceNode.document("t.a", "A", "Alpha");

        assertThat(detector.hasChanged("t.a", detector.fingerprint(node))).isTrue();
    }

    @Test
    @DisplayName("Should detect changes against the remembered fingerprint")
    void shouldCompareWithRememberedFingerprint() {
        // Given
        detector.remember("t.a", detector.fingerprint("Alpha"));

        // Then
        assertThat(detector.hasChanged("t.a", detector.fingerprint("Alpha"))).isFalse();
        assertThat(detector.hasChanged("t.a", detector.fingerprint("Alpha!"))).isTrue();
        assertThat(properties.getProperty("hash_t.a")).isEqualTo(detector.fingerprint("Alpha"));
    }

    @Test
    @DisplayName("Should forget a fingerprint")
    void shouldForgetFingerprint() {
        detector.remember("t.a", detector.fingerprint("Alpha"));

        detector.forget("t.a");

        assertThat(properties.keys()).isEmpty();
        assertThat(detector.hasChanged("t.a", detector.fingerprint("Alpha"))).isTrue();
    }
}
