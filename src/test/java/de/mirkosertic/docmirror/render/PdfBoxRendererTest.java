package de.mirkosertic.docmirror.render;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PdfBoxRenderer Tests")
class PdfBoxRendererTest {

    private final PdfBoxRenderer renderer = new PdfBoxRenderer();
    private final PDFont font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);

    @Test
    @DisplayName("Should render title and body into a PDF")
    void shouldRenderPdf() throws IOException {
        // Given
        final RenderRequest request = new RenderRequest("doc-1", "t.a", "Overview", "First line\nSecond line");

        // When
        final RenderResponse response = renderer.render(request);

        // Then
        assertThat(response.isSuccess()).isTrue();
        assertThat(new String(response.body(), 0, 5, StandardCharsets.US_ASCII)).isEqualTo("%PDF-");
        try (final PDDocument document = Loader.loadPDF(response.body())) {
            assertThat(document.getDocumentInformation().getTitle()).isEqualTo("Overview");
            final String text = new PDFTextStripper().getText(document);
            assertThat(text).contains("Overview", "First line", "Second line");
        }
    }

    @Test
    @DisplayName("Should spread long content over several pages")
    void shouldAddPages() throws IOException {
        final String content = String.join("\n", Collections.nCopies(200, "A paragraph of text."));

        final RenderResponse response = renderer.render(new RenderRequest("doc-1", "t.a", "Long", content));

        try (final PDDocument document = Loader.loadPDF(response.body())) {
            assertThat(document.getNumberOfPages()).isGreaterThan(1);
        }
    }

    @Test
    @DisplayName("Should render an empty node")
    void shouldRenderEmptyNode() throws IOException {
        final RenderResponse response = renderer.render(new RenderRequest("doc-1", "t.a", "", ""));

        assertThat(response.isSuccess()).isTrue();
        try (final PDDocument document = Loader.loadPDF(response.body())) {
            assertThat(document.getNumberOfPages()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Should wrap words to the available width")
    void shouldWrapWords() throws IOException {
        final List<String> lines = PdfBoxRenderer.wrap("one two three four five six", font, 11, 60);

        assertThat(lines).hasSizeGreaterThan(1);
        assertThat(String.join(" ", lines)).isEqualTo("one two three four five six");
    }

    @Test
    @DisplayName("Should keep a blank paragraph as an empty line")
    void shouldKeepBlankLine() throws IOException {
        assertThat(PdfBoxRenderer.wrap("   ", font, 11, 100)).containsExactly("");
    }

    @Test
    @DisplayName("Should replace characters the font cannot encode")
    void shouldSanitize() {
        assertThat(PdfBoxRenderer.sanitize(font, "a\tb")).isEqualTo("a b");
        assertThat(PdfBoxRenderer.sanitize(font, "Gr\u00FC\u00DFe")).isEqualTo("Gr\u00FC\u00DFe");
        assertThat(PdfBoxRenderer.sanitize(font, "\u4E2D")).isEqualTo("?");
    }
}
