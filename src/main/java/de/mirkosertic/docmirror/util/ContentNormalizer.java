package de.mirkosertic.docmirror.util;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Normalizes node body text before it is fingerprinted.
 *
 * <p>Two bodies that only differ in the following respects normalize to the same string:</p>
 * <ul>
 *   <li>Unicode composition (NFC is applied)</li>
 *   <li>Line endings ({@code \r\n} and {@code \r} become {@code \n})</li>
 *   <li>Byte order marks and zero-width characters</li>
 *   <li>Null characters</li>
 * </ul>
 * Visible whitespace is preserved, so re-indenting a paragraph still counts as a change.
 */
public final class ContentNormalizer {

    /**
     * Characters that never carry visible content:
     * <ul>
     *   <li>U+0000: Null character</li>
     *   <li>U+200B: Zero-width space</li>
     *   <li>U+200C: Zero-width non-joiner</li>
     *   <li>U+200D: Zero-width joiner</li>
     *   <li>U+FEFF: Byte order mark / zero-width no-break space</li>
     * </ul>
     */
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
        "[" +
        "\u0000" +                    // NULL
        "\u200B" +                    // Zero-width space
        "\u200C" +                    // Zero-width non-joiner
        "\u200D" +                    // Zero-width joiner
        "\uFEFF" +                    // Byte order mark
        "]"
    );

    private static final Pattern LINE_BREAKS = Pattern.compile("\r\n?");

    private ContentNormalizer() {
        // Utility class, no instances
    }

    /**
     * Normalize body text for fingerprinting.
     *
     * @param text the text to normalize (may be null)
     * @return normalized text; an empty string for null input
     */
    public static String normalize(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String result = Normalizer.normalize(text, Normalizer.Form.NFC);
        result = LINE_BREAKS.matcher(result).replaceAll("\n");
        return INVISIBLE_CHARS.matcher(result).replaceAll("");
    }

    /**
     * Turn a node title into a name that is safe as a single path segment.
     * Path separators and control characters become underscores; an empty result
     * becomes {@code "untitled"}. A leading dot gets an underscore in front, so a title
     * never turns into a hidden entry or one of the destination's own {@code .trash}
     * and {@code .detached} directories.
     */
    public static String safeName(final String title) {
        if (title == null) {
            return "untitled";
        }
        final String cleaned = title.replaceAll("[/\\\\\\p{Cntrl}]", "_").trim();
        if (cleaned.isEmpty() || ".".equals(cleaned) || "..".equals(cleaned)) {
            return "untitled";
        }
        if (cleaned.startsWith(".")) {
            return "_" + cleaned;
        }
        return cleaned;
    }
}
