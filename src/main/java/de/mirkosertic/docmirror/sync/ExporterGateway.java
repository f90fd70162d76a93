package de.mirkosertic.docmirror.sync;

import de.mirkosertic.docmirror.destination.BackendResult;
import de.mirkosertic.docmirror.destination.DestinationBackend;
import de.mirkosertic.docmirror.destination.ItemRef;
import de.mirkosertic.docmirror.destination.ItemType;
import de.mirkosertic.docmirror.render.RenderRequest;
import de.mirkosertic.docmirror.render.RenderResponse;
import de.mirkosertic.docmirror.render.Renderer;
import de.mirkosertic.docmirror.source.SourceNode;
import de.mirkosertic.docmirror.util.ContentNormalizer;
import de.mirkosertic.docmirror.util.RetryPolicy;
import de.mirkosertic.docmirror.util.Sleeper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Renders one node and stores the result as {@code <title><extension>} in a destination folder.
 * <p>
 * Rendering is retried with backoff on rate limiting, server errors and transport failures.
 * Any existing artifact of the same name in the folder is trashed before the new one is created,
 * so the folder never holds two artifacts for one node. The gateway does not throw: every
 * failure ends in {@code null} and is logged.
 */
public class ExporterGateway {

    private static final Logger logger = LoggerFactory.getLogger(ExporterGateway.class);

    private final Renderer renderer;
    private final DestinationBackend backend;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final String artifactExtension;

    public ExporterGateway(final Renderer renderer, final DestinationBackend backend, final RetryPolicy retryPolicy,
                           final Sleeper sleeper, final String artifactExtension) {
        this.renderer = renderer;
        this.backend = backend;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.artifactExtension = artifactExtension;
    }

    /**
     * @return the created artifact, or {@code null} when rendering or storing failed
     */
    public @Nullable ItemRef export(final String documentId, final SourceNode node, final String folderId) {
        final byte[] rendered = renderWithRetry(new RenderRequest(documentId, node.id(), node.title(), node.content()));
        if (rendered == null) {
            return null;
        }
        return replaceArtifact(folderId, artifactName(node.title()), rendered);
    }

    public String artifactName(final String title) {
        return ContentNormalizer.safeName(title) + artifactExtension;
    }

    private byte @Nullable [] renderWithRetry(final RenderRequest request) {
        for (int attempt = 0; attempt < retryPolicy.maxAttempts(); attempt++) {
            final RenderResponse response;
            try {
                response = renderer.render(request);
            } catch (final IOException | RuntimeException e) {
                logger.warn("Export of '{}' failed (attempt {}/{}): {}",
                        request.title(), attempt + 1, retryPolicy.maxAttempts(), e.getMessage());
                if (!backoff(attempt)) {
                    return null;
                }
                continue;
            }

            if (response.isSuccess()) {
                return response.body();
            }
            if (!retryPolicy.isRetryable(response.status())) {
                logger.error("Export of '{}' failed with status {}, not retrying", request.title(), response.status());
                return null;
            }
            logger.warn("Export of '{}' returned status {} (attempt {}/{})",
                    request.title(), response.status(), attempt + 1, retryPolicy.maxAttempts());
            if (!backoff(attempt)) {
                return null;
            }
        }
        logger.error("Giving up on export of '{}' after {} attempts", request.title(), retryPolicy.maxAttempts());
        return null;
    }

    /**
     * Sleeps before the next attempt, if there is one.
     *
     * @return {@code false} if the thread was interrupted while waiting
     */
    private boolean backoff(final int attempt) {
        if (!retryPolicy.hasAttemptsLeft(attempt)) {
            return true;
        }
        final long delay = retryPolicy.delayForAttempt(attempt);
        logger.info("Backing off for {} ms", delay);
        try {
            sleeper.sleep(delay);
            return true;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while backing off, abandoning export");
            return false;
        }
    }

    private @Nullable ItemRef replaceArtifact(final String folderId, final String name, final byte[] content) {
        final BackendResult<List<ItemRef>> existing = backend.listByName(folderId, name, ItemType.FILE);
        if (!existing.isOk()) {
            logger.warn("Could not look up existing '{}' in {}: {}", name, folderId, existing.message());
            return null;
        }
        for (final ItemRef stale : existing.value()) {
            final BackendResult<Void> trashed = backend.trash(stale.id());
            if (trashed.isTransientError()) {
                logger.warn("Could not trash previous '{}' ({}): {}", name, stale.id(), trashed.message());
                return null;
            }
            logger.debug("Trashed previous artifact '{}' ({})", name, stale.id());
        }

        final BackendResult<ItemRef> created = backend.createFile(folderId, name, content);
        if (!created.isOk()) {
            logger.warn("Could not store '{}' in {}: {}", name, folderId, created.message());
            return null;
        }
        return created.value();
    }
}
