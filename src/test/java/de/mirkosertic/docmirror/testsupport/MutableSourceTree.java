package de.mirkosertic.docmirror.testsupport;

import de.mirkosertic.docmirror.source.SourceNode;
import de.mirkosertic.docmirror.source.SourceTreeReader;

import java.io.IOException;
import java.util.List;

/**
 * Source tree that tests replace between runs.
 */
public class MutableSourceTree implements SourceTreeReader {

    private final String documentId;
    private List<SourceNode> nodes = List.of();
    private IOException failure;

    public MutableSourceTree(final String documentId) {
        this.documentId = documentId;
    }

    public synchronized void setNodes(final SourceNode... nodes) {
        this.nodes = List.of(nodes);
    }

    public synchronized void failWith(final IOException failure) {
        this.failure = failure;
    }

    @Override
    public String documentId() {
        return documentId;
    }

    @Override
    public synchronized List<SourceNode> listTopLevelNodes() throws IOException {
        if (failure != null) {
            throw failure;
        }
        return nodes;
    }
}
