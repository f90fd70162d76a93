package de.mirkosertic.docmirror.source;

import java.io.IOException;
import java.util.List;

/**
 * Reads the current state of the source document tree.
 * <p>
 * Implementations return only {@link NodeKind#DOCUMENT} nodes, at every level of the tree.
 */
public interface SourceTreeReader {

    /** Identifier of the source document, passed to the renderer. */
    String documentId() throws IOException;

    List<SourceNode> listTopLevelNodes() throws IOException;
}
