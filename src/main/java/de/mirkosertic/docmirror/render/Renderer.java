package de.mirkosertic.docmirror.render;

import java.io.IOException;

/**
 * Turns one node of the source document into a downloadable artifact.
 */
public interface Renderer {

    /**
     * @return the response; non-200 statuses are reported, not thrown
     * @throws IOException on transport failures
     */
    RenderResponse render(RenderRequest request) throws IOException;
}
