package de.mirkosertic.docmirror.source;

/**
 * Kind of a node in the source tree. Only {@link #DOCUMENT} nodes are mirrored.
 */
public enum NodeKind {
    DOCUMENT,
    OTHER;

    public static NodeKind parse(final String value) {
        if (value == null || value.isBlank() || "document".equalsIgnoreCase(value.trim())) {
            return DOCUMENT;
        }
        return OTHER;
    }
}
