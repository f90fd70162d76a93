package de.mirkosertic.docmirror.sync;

import de.mirkosertic.docmirror.destination.BackendResult;
import de.mirkosertic.docmirror.destination.DestinationBackend;
import de.mirkosertic.docmirror.destination.ItemRef;
import de.mirkosertic.docmirror.source.SourceNode;
import de.mirkosertic.docmirror.util.ContentNormalizer;
import de.mirkosertic.docmirror.util.Sleeper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Depth-first, pre-order walk over the source tree that brings every node's artifact and
 * child folder in line with the source.
 * <p>
 * For each node the walker, in this order:
 * <ol>
 *   <li>marks the node id as active,</li>
 *   <li>propagates a title change to the tracked artifact and folder by renaming them,</li>
 *   <li>forgets a tracked artifact that has vanished from the destination,</li>
 *   <li>re-exports when the content fingerprint changed or no artifact is tracked,
 *       otherwise moves the artifact when the node's parent changed,</li>
 *   <li>and, for nodes with children, resolves the child folder and recurses into it.</li>
 * </ol>
 * Every mutation of a tracked entry is persisted immediately, so an interrupted run resumes
 * where it stopped.
 */
public class HierarchyWalker {

    private static final Logger logger = LoggerFactory.getLogger(HierarchyWalker.class);

    private static final String PATH_SEPARATOR = " > ";

    private final ChangeDetector changeDetector;
    private final ExporterGateway exporterGateway;
    private final PlacementManager placementManager;
    private final DestinationBackend backend;
    private final StateStore stateStore;
    private final Sleeper sleeper;
    private final long delayBetweenExportsMs;
    private final int maxDepth;

    public HierarchyWalker(final ChangeDetector changeDetector,
                           final ExporterGateway exporterGateway,
                           final PlacementManager placementManager,
                           final DestinationBackend backend,
                           final StateStore stateStore,
                           final Sleeper sleeper,
                           final long delayBetweenExportsMs,
                           final int maxDepth) {
        this.changeDetector = changeDetector;
        this.exporterGateway = exporterGateway;
        this.placementManager = placementManager;
        this.backend = backend;
        this.stateStore = stateStore;
        this.sleeper = sleeper;
        this.delayBetweenExportsMs = delayBetweenExportsMs;
        this.maxDepth = maxDepth;
    }

    /**
     * Walks all top-level nodes into the destination root.
     *
     * @param activeIds receives the id of every node seen in the source, including those
     *                  below the depth limit or below a folder that could not be resolved
     * @return number of artifacts exported
     */
    public int walk(final String documentId, final List<SourceNode> topLevelNodes, final SyncState state,
                    final Set<String> activeIds, final SyncStatistics statistics) {
        final WalkContext context = new WalkContext(documentId, state, activeIds, statistics);
        final String rootFolderId = backend.rootFolderId();
        int exports = 0;
        for (final SourceNode node : topLevelNodes) {
            exports += processNode(context, node, rootFolderId, List.of(), TrackedEntry.ROOT_PARENT, 0);
        }
        return exports;
    }

    private int processNode(final WalkContext context, final SourceNode node, final String parentFolderId,
                            final List<String> path, final String parentKey, final int depth) {
        final String id = node.id();
        final String title = node.title();
        final SyncState state = context.state();
        final SyncStatistics statistics = context.statistics();

        context.activeIds().add(id);
        statistics.incrementNodesVisited();

        final TrackedEntry entry = state.getOrCreate(id, title);
        final String savedParentKey = entry.getParentKey();
        final boolean parentChanged = !parentKey.equals(savedParentKey);

        syncTitle(entry, title, state, statistics);
        verifyArtifactExists(entry, title, state, statistics);

        final List<String> nodePath = append(path, title);
        int exports = 0;

        final String fingerprint = changeDetector.fingerprint(node);
        if (changeDetector.hasChanged(id, fingerprint) || entry.getFileId() == null) {
            if (export(context, node, entry, parentFolderId, parentKey, fingerprint, nodePath)) {
                exports++;
            }
        } else if (parentChanged) {
            logger.info("Structure change for \"{}\". Verifying location...", title);
            relocateArtifact(entry, title, parentFolderId, parentKey, state, statistics);
        }

        if (node.hasChildren()) {
            if (depth + 1 >= maxDepth) {
                logger.warn("\"{}\" is nested deeper than {} levels, skipping its children",
                        String.join(PATH_SEPARATOR, nodePath), maxDepth);
                markSubtreeActive(node.children(), context);
                statistics.incrementSkippedBeyondDepth();
                return exports;
            }
            final String folderId = resolveChildFolder(entry, title, parentFolderId, parentChanged, state, statistics);
            if (folderId == null) {
                logger.warn("No folder for the children of \"{}\", retrying next run", title);
                markSubtreeActive(node.children(), context);
                return exports;
            }
            for (final SourceNode child : node.children()) {
                exports += processNode(context, child, folderId, nodePath, id, depth + 1);
            }
        }
        return exports;
    }

    private void syncTitle(final TrackedEntry entry, final String title, final SyncState state,
                           final SyncStatistics statistics) {
        final String oldTitle = entry.getTitle();
        if (oldTitle == null || oldTitle.equals(title)) {
            if (oldTitle == null) {
                entry.setTitle(title);
            }
            return;
        }

        logger.info("Rename detected: \"{}\" -> \"{}\"", oldTitle, title);
        boolean retryLater = false;
        if (entry.getFileId() != null) {
            retryLater = placementManager.rename(entry.getFileId(), exporterGateway.artifactName(title)).isTransientError();
        }
        if (entry.getFolderId() != null) {
            retryLater |= placementManager.rename(entry.getFolderId(), ContentNormalizer.safeName(title)).isTransientError();
        }
        if (retryLater) {
            // keep the old title so the rename is attempted again next run
            return;
        }
        entry.setTitle(title);
        statistics.incrementRenamed();
        stateStore.save(state);
    }

    private void verifyArtifactExists(final TrackedEntry entry, final String title, final SyncState state,
                                      final SyncStatistics statistics) {
        if (entry.getFileId() == null) {
            return;
        }
        final BackendResult<ItemRef> file = backend.getFile(entry.getFileId());
        if (file.isNotFound()) {
            logger.warn("Artifact for \"{}\" is missing from the destination, exporting again", title);
            entry.setFileId(null);
            statistics.incrementSelfHealed();
            stateStore.save(state);
        } else if (file.isTransientError()) {
            logger.warn("Could not verify artifact for \"{}\": {}", title, file.message());
        }
    }

    private boolean export(final WalkContext context, final SourceNode node, final TrackedEntry entry,
                           final String parentFolderId, final String parentKey, final String fingerprint,
                           final List<String> nodePath) {
        final String displayPath = String.join(PATH_SEPARATOR, nodePath);
        final ItemRef artifact = exporterGateway.export(context.documentId(), node, parentFolderId);
        if (artifact == null) {
            context.statistics().incrementExportFailures();
            logger.warn("Export of {} did not complete, retrying next run", displayPath);
            return false;
        }

        final String previousFileId = entry.getFileId();
        changeDetector.remember(node.id(), fingerprint);
        entry.setFileId(artifact.id());
        entry.setParentKey(parentKey);
        context.statistics().incrementExported();
        stateStore.save(context.state());
        logger.info("Exported: {}", displayPath);

        if (previousFileId != null && !previousFileId.equals(artifact.id())) {
            // the previous artifact lives elsewhere when the node moved and changed in the same run
            final BackendResult<Void> trashed = backend.trash(previousFileId);
            if (trashed.isTransientError()) {
                logger.warn("Could not trash superseded artifact {}: {}", previousFileId, trashed.message());
            }
        }

        throttle();
        return true;
    }

    private void relocateArtifact(final TrackedEntry entry, final String title, final String parentFolderId,
                                  final String parentKey, final SyncState state, final SyncStatistics statistics) {
        final PlacementOutcome outcome = placementManager.moveTo(Objects.requireNonNull(entry.getFileId()), parentFolderId);
        switch (outcome) {
            case MOVED, UNCHANGED -> {
                if (outcome == PlacementOutcome.MOVED) {
                    statistics.incrementMoved();
                }
                entry.setParentKey(parentKey);
                stateStore.save(state);
            }
            // the next run sees the missing artifact and exports it again
            case NOT_FOUND -> logger.warn("Artifact for \"{}\" vanished during move", title);
            case FAILED -> logger.warn("Move of \"{}\" failed, retrying next run", title);
        }
    }

    private @Nullable String resolveChildFolder(final TrackedEntry entry, final String title, final String parentFolderId,
                                                final boolean parentChanged, final SyncState state,
                                                final SyncStatistics statistics) {
        final String trackedFolderId = entry.getFolderId();
        if (trackedFolderId != null) {
            final BackendResult<ItemRef> folder = backend.getFolder(trackedFolderId);
            if (folder.isOk()) {
                if (parentChanged) {
                    final PlacementOutcome outcome = placementManager.moveTo(trackedFolderId, parentFolderId);
                    if (outcome == PlacementOutcome.MOVED) {
                        statistics.incrementMoved();
                    }
                }
                return trackedFolderId;
            }
            if (folder.isTransientError()) {
                logger.warn("Could not verify folder for \"{}\": {}", title, folder.message());
                return null;
            }
            logger.warn("Folder for \"{}\" is missing from the destination, recreating it", title);
        }

        final BackendResult<ItemRef> ensured = placementManager.ensureFolder(parentFolderId, ContentNormalizer.safeName(title));
        if (!ensured.isOk()) {
            return null;
        }
        final String folderId = ensured.value().id();
        if (!folderId.equals(trackedFolderId)) {
            entry.setFolderId(folderId);
            statistics.incrementFoldersCreated();
            stateStore.save(state);
        }
        return folderId;
    }

    private void markSubtreeActive(final List<SourceNode> nodes, final WalkContext context) {
        for (final SourceNode node : nodes) {
            context.activeIds().add(node.id());
            markSubtreeActive(node.children(), context);
        }
    }

    private void throttle() {
        if (delayBetweenExportsMs <= 0) {
            return;
        }
        try {
            sleeper.sleep(delayBetweenExportsMs);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Reconciliation interrupted");
        }
    }

    private static List<String> append(final List<String> path, final String title) {
        final List<String> result = new ArrayList<>(path.size() + 1);
        result.addAll(path);
        result.add(title);
        return result;
    }

    private record WalkContext(String documentId, SyncState state, Set<String> activeIds, SyncStatistics statistics) {
    }
}
