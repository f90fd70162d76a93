package de.mirkosertic.docmirror.sync;

import de.mirkosertic.docmirror.destination.BackendResult;
import de.mirkosertic.docmirror.destination.DestinationBackend;
import de.mirkosertic.docmirror.destination.ItemRef;
import de.mirkosertic.docmirror.destination.ItemType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Folder lookup/creation and re-parenting of destination items.
 * <p>
 * Moves remove every parent except the target before adding the target, so that an item
 * never stays visible in two places ("ghosting") once a move has completed.
 */
public class PlacementManager {

    private static final Logger logger = LoggerFactory.getLogger(PlacementManager.class);

    private final DestinationBackend backend;

    public PlacementManager(final DestinationBackend backend) {
        this.backend = backend;
    }

    /**
     * Returns the first folder named {@code name} directly under {@code parentId},
     * creating it when there is none.
     */
    public BackendResult<ItemRef> ensureFolder(final String parentId, final String name) {
        final BackendResult<List<ItemRef>> existing = backend.listByName(parentId, name, ItemType.FOLDER);
        if (!existing.isOk()) {
            logger.warn("Could not look up folder '{}' in {}: {}", name, parentId, existing.message());
            return existing.propagate();
        }
        if (!existing.value().isEmpty()) {
            final ItemRef folder = existing.value().get(0);
            logger.debug("Reusing folder '{}' ({})", name, folder.id());
            return BackendResult.ok(folder);
        }
        final BackendResult<ItemRef> created = backend.createFolder(parentId, name);
        if (created.isOk()) {
            logger.info("Created folder '{}' ({})", name, created.value().id());
        } else {
            logger.warn("Could not create folder '{}' in {}: {}", name, parentId, created.message());
        }
        return created;
    }

    /**
     * Makes {@code targetParentId} the only parent of {@code itemId}.
     */
    public PlacementOutcome moveTo(final String itemId, final String targetParentId) {
        final BackendResult<List<String>> parents = backend.listParents(itemId);
        if (parents.isNotFound()) {
            logger.warn("Item {} no longer exists, cannot move it", itemId);
            return PlacementOutcome.NOT_FOUND;
        }
        if (!parents.isOk()) {
            logger.warn("Could not read parents of {}: {}", itemId, parents.message());
            return PlacementOutcome.FAILED;
        }

        boolean changed = false;
        boolean alreadyThere = false;
        for (final String parent : parents.value()) {
            if (parent.equals(targetParentId)) {
                alreadyThere = true;
                continue;
            }
            final BackendResult<Void> removed = backend.removeFromParent(itemId, parent);
            if (removed.isNotFound()) {
                logger.warn("Item {} vanished while moving it", itemId);
                return PlacementOutcome.NOT_FOUND;
            }
            if (!removed.isOk()) {
                logger.warn("Could not remove {} from {}: {}", itemId, parent, removed.message());
                return PlacementOutcome.FAILED;
            }
            changed = true;
        }

        if (!alreadyThere) {
            final BackendResult<Void> added = backend.addToParent(itemId, targetParentId);
            if (added.isNotFound()) {
                logger.warn("Item {} vanished while moving it", itemId);
                return PlacementOutcome.NOT_FOUND;
            }
            if (!added.isOk()) {
                logger.warn("Could not add {} to {}: {}", itemId, targetParentId, added.message());
                return PlacementOutcome.FAILED;
            }
            changed = true;
        }

        if (changed) {
            logger.info("Moved {} to {}", itemId, targetParentId);
            return PlacementOutcome.MOVED;
        }
        return PlacementOutcome.UNCHANGED;
    }

    public BackendResult<Void> rename(final String itemId, final String newName) {
        final BackendResult<Void> result = backend.rename(itemId, newName);
        if (result.isNotFound()) {
            logger.warn("Item {} no longer exists, cannot rename it to '{}'", itemId, newName);
        } else if (result.isTransientError()) {
            logger.warn("Could not rename {} to '{}': {}", itemId, newName, result.message());
        }
        return result;
    }
}
