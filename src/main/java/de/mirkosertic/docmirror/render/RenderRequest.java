package de.mirkosertic.docmirror.render;

/**
 * What to render: the node identified by {@code (documentId, nodeId)}.
 * Title and content are passed along for renderers that work locally.
 */
public record RenderRequest(
        String documentId,
        String nodeId,
        String title,
        String content
) {
}
