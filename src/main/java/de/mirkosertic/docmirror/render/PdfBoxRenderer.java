package de.mirkosertic.docmirror.render;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a node locally into a simple PDF: the title as heading followed by the body text,
 * word-wrapped onto as many A4 pages as needed.
 * <p>
 * Uses the standard Helvetica fonts, so characters outside WinAnsi are replaced by {@code ?}.
 */
public class PdfBoxRenderer implements Renderer {

    private static final Logger logger = LoggerFactory.getLogger(PdfBoxRenderer.class);

    private static final float MARGIN = 56;
    private static final float TITLE_SIZE = 16;
    private static final float BODY_SIZE = 11;
    private static final float LEADING = 1.4f;

    private final PDFont titleFont = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
    private final PDFont bodyFont = new PDType1Font(Standard14Fonts.FontName.HELVETICA);

    @Override
    public RenderResponse render(final RenderRequest request) throws IOException {
        try (final PDDocument document = new PDDocument()) {
            document.getDocumentInformation().setTitle(request.title());

            final float width = PDRectangle.A4.getWidth() - 2 * MARGIN;
            final List<Line> lines = new ArrayList<>();
            for (final String wrapped : wrap(sanitize(titleFont, request.title()), titleFont, TITLE_SIZE, width)) {
                lines.add(new Line(wrapped, titleFont, TITLE_SIZE));
            }
            lines.add(new Line("", bodyFont, BODY_SIZE));
            for (final String paragraph : request.content().split("\r?\n", -1)) {
                for (final String wrapped : wrap(sanitize(bodyFont, paragraph), bodyFont, BODY_SIZE, width)) {
                    lines.add(new Line(wrapped, bodyFont, BODY_SIZE));
                }
            }

            writePages(document, lines);

            final ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            logger.debug("Rendered node {} into {} pages ({} bytes)",
                    request.nodeId(), document.getNumberOfPages(), out.size());
            return RenderResponse.ok(out.toByteArray());
        }
    }

    private void writePages(final PDDocument document, final List<Line> lines) throws IOException {
        final float top = PDRectangle.A4.getHeight() - MARGIN;
        int index = 0;
        do {
            final PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            try (final PDPageContentStream stream = new PDPageContentStream(document, page)) {
                float y = top;
                while (index < lines.size()) {
                    final Line line = lines.get(index);
                    final float step = line.size() * LEADING;
                    if (y - step < MARGIN) {
                        break;
                    }
                    y -= step;
                    if (!line.text().isEmpty()) {
                        stream.beginText();
                        stream.setFont(line.font(), line.size());
                        stream.newLineAtOffset(MARGIN, y);
                        stream.showText(line.text());
                        stream.endText();
                    }
                    index++;
                }
            }
        } while (index < lines.size());
    }

    static List<String> wrap(final String text, final PDFont font, final float size, final float maxWidth) throws IOException {
        final List<String> result = new ArrayList<>();
        if (text.isBlank()) {
            result.add("");
            return result;
        }
        StringBuilder current = new StringBuilder();
        for (final String word : text.trim().split("\\s+")) {
            final String candidate = current.length() == 0 ? word : current + " " + word;
            if (current.length() > 0 && widthOf(candidate, font, size) > maxWidth) {
                result.add(current.toString());
                current = new StringBuilder(word);
            } else {
                current = new StringBuilder(candidate);
            }
        }
        result.add(current.toString());
        return result;
    }

    private static float widthOf(final String text, final PDFont font, final float size) throws IOException {
        return font.getStringWidth(text) / 1000 * size;
    }

    static String sanitize(final PDFont font, final String text) {
        final StringBuilder result = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> {
            final String character = new String(Character.toChars(codePoint));
            if (codePoint == '\t') {
                result.append(' ');
                return;
            }
            try {
                font.encode(character);
                result.append(character);
            } catch (final IllegalArgumentException | IOException e) {
                result.append('?');
            }
        });
        return result.toString();
    }

    private record Line(String text, PDFont font, float size) {
    }
}
