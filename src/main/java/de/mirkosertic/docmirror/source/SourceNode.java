package de.mirkosertic.docmirror.source;

import java.util.List;
import java.util.Objects;

/**
 * One node of the source document tree. Immutable; read-only to the reconciler.
 */
public record SourceNode(
        /** Stable, opaque identifier, unique within the document. */
        String id,
        /** Display title; may change between runs. */
        String title,
        /** Body text; may change between runs. */
        String content,
        /** Node kind, see {@link NodeKind}. */
        NodeKind kind,
        /** Children in source order; never null. */
        List<SourceNode> children
) {

    public SourceNode {
        Objects.requireNonNull(id, "id");
        title = title == null ? "" : title;
        content = content == null ? "" : content;
        kind = kind == null ? NodeKind.DOCUMENT : kind;
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static SourceNode document(final String id, final String title, final String content,
                                      final SourceNode... children) {
        return new SourceNode(id, title, content, NodeKind.DOCUMENT, List.of(children));
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }
}
