package de.mirkosertic.docmirror.testsupport;

import de.mirkosertic.docmirror.render.RenderRequest;
import de.mirkosertic.docmirror.render.RenderResponse;
import de.mirkosertic.docmirror.render.Renderer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Renderer that returns the title and content as bytes, or scripted failures first.
 * Records every request it receives.
 */
public class ScriptedRenderer implements Renderer {

    /** Marker in the script for a transport failure. */
    public static final int IO_FAILURE = -1;

    private final Deque<Integer> script = new ArrayDeque<>();
    private final List<RenderRequest> requests = new ArrayList<>();
    private Integer permanentStatus;

    /** Queue statuses to return before falling back to success. */
    public synchronized ScriptedRenderer thenRespond(final int... statuses) {
        for (final int status : statuses) {
            script.add(status);
        }
        return this;
    }

    /** Every call from now on fails with {@code status}. */
    public synchronized void alwaysRespond(final int status) {
        script.clear();
        permanentStatus = status;
    }

    public synchronized void recover() {
        script.clear();
        permanentStatus = null;
    }

    @Override
    public synchronized RenderResponse render(final RenderRequest request) throws IOException {
        requests.add(request);
        final Integer scripted = permanentStatus != null ? permanentStatus : script.poll();
        if (scripted != null && scripted == IO_FAILURE) {
            throw new IOException("connection reset");
        }
        if (scripted != null && scripted != RenderResponse.OK) {
            return RenderResponse.status(scripted);
        }
        return RenderResponse.ok((request.title() + "\n" + request.content()).getBytes(StandardCharsets.UTF_8));
    }

    public synchronized List<RenderRequest> getRequests() {
        return List.copyOf(requests);
    }

    public synchronized List<String> renderedNodeIds() {
        return requests.stream().map(RenderRequest::nodeId).toList();
    }

    public synchronized void clearRequests() {
        requests.clear();
    }
}
