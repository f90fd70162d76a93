package de.mirkosertic.docmirror.sync;

import de.mirkosertic.docmirror.audit.AuditSink;
import de.mirkosertic.docmirror.destination.BackendResult;
import de.mirkosertic.docmirror.destination.DestinationBackend;
import de.mirkosertic.docmirror.destination.ItemRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Removes destination items of nodes that were tracked but not seen in the current walk.
 * <p>
 * Artifacts are trashed first. Folders are trashed only once they are empty; since a removed
 * subtree leaves nested orphan folders, folders are swept repeatedly until a pass makes no
 * progress. A folder that still holds foreign content is left in place: its entry stays tracked
 * (with the artifact cleared) and the condition is logged and audited on every run until someone
 * empties or removes the folder. Entries whose cleanup hit a transient error also stay tracked
 * and are retried next run.
 */
public class OrphanReaper {

    private static final Logger logger = LoggerFactory.getLogger(OrphanReaper.class);

    private final DestinationBackend backend;
    private final ChangeDetector changeDetector;
    private final StateStore stateStore;
    private final AuditSink auditSink;

    public OrphanReaper(final DestinationBackend backend, final ChangeDetector changeDetector,
                        final StateStore stateStore, final AuditSink auditSink) {
        this.backend = backend;
        this.changeDetector = changeDetector;
        this.stateStore = stateStore;
        this.auditSink = auditSink;
    }

    public void reap(final SyncState state, final Set<String> activeIds, final SyncStatistics statistics) {
        final List<String> orphans = state.nodeIds().stream()
                .filter(id -> !activeIds.contains(id))
                .toList();
        if (orphans.isEmpty()) {
            return;
        }

        final Set<String> retained = new HashSet<>();

        for (final String nodeId : orphans) {
            final TrackedEntry entry = state.get(nodeId);
            logger.info("Node removed (ID: {}). Cleaning up...", nodeId);
            if (entry.getFileId() != null && !trashArtifact(nodeId, entry)) {
                retained.add(nodeId);
            }
        }
        stateStore.save(state);

        final List<String> pendingFolders = new ArrayList<>(orphans.stream()
                .filter(id -> !retained.contains(id) && state.get(id).getFolderId() != null)
                .toList());
        sweepFolders(state, pendingFolders, retained);

        for (final String nodeId : pendingFolders) {
            final TrackedEntry entry = state.get(nodeId);
            logger.warn("Folder for removed node \"{}\" ({}) is not empty, leaving it in place",
                    entry.getTitle(), entry.getFolderId());
            auditSink.record("Cleanup", "Folder for removed node '" + entry.getTitle()
                    + "' is not empty and was kept", "Warning");
            statistics.incrementOrphanFoldersRetained();
            retained.add(nodeId);
        }

        for (final String nodeId : orphans) {
            changeDetector.forget(nodeId);
            if (!retained.contains(nodeId)) {
                state.remove(nodeId);
                statistics.incrementOrphansRemoved();
            }
        }
        stateStore.save(state);
    }

    /**
     * @return {@code false} if the artifact could not be removed now and should be retried
     */
    private boolean trashArtifact(final String nodeId, final TrackedEntry entry) {
        final BackendResult<Void> trashed = backend.trash(entry.getFileId());
        if (trashed.isTransientError()) {
            logger.warn("Could not trash artifact of removed node {}: {}", nodeId, trashed.message());
            return false;
        }
        if (trashed.isOk()) {
            logger.info("Trashed artifact of removed node \"{}\"", entry.getTitle());
            auditSink.record("Cleanup", "Deleted artifact for removed node '" + entry.getTitle() + "'", "Success");
        } else {
            logger.debug("Artifact of removed node {} was already gone", nodeId);
        }
        entry.setFileId(null);
        return true;
    }

    /**
     * Trashes empty folders until a pass removes nothing. Entries whose folder is gone are
     * removed from {@code pending}; what remains are folders with content.
     */
    private void sweepFolders(final SyncState state, final List<String> pending, final Set<String> retained) {
        boolean progress = true;
        while (progress && !pending.isEmpty()) {
            progress = false;
            final Iterator<String> iterator = pending.iterator();
            while (iterator.hasNext()) {
                final String nodeId = iterator.next();
                final TrackedEntry entry = state.get(nodeId);
                final String folderId = entry.getFolderId();

                final BackendResult<List<ItemRef>> children = backend.listChildren(folderId);
                if (children.isNotFound()) {
                    logger.debug("Folder of removed node {} was already gone", nodeId);
                    entry.setFolderId(null);
                    iterator.remove();
                    progress = true;
                    continue;
                }
                if (children.isTransientError()) {
                    logger.warn("Could not inspect folder of removed node {}: {}", nodeId, children.message());
                    retained.add(nodeId);
                    iterator.remove();
                    continue;
                }
                if (!children.value().isEmpty()) {
                    continue;
                }

                final BackendResult<Void> trashed = backend.trash(folderId);
                if (trashed.isTransientError()) {
                    logger.warn("Could not trash folder of removed node {}: {}", nodeId, trashed.message());
                    retained.add(nodeId);
                } else {
                    if (trashed.isOk()) {
                        logger.info("Trashed empty folder of removed node \"{}\"", entry.getTitle());
                        auditSink.record("Cleanup", "Deleted folder for removed node '" + entry.getTitle() + "'", "Success");
                    }
                    entry.setFolderId(null);
                    progress = true;
                }
                iterator.remove();
            }
            stateStore.save(state);
        }
    }
}
