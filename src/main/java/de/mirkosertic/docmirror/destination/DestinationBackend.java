package de.mirkosertic.docmirror.destination;

import java.util.List;

/**
 * Folder/file store the document tree is mirrored into.
 * <p>
 * Membership is modelled as multi-parent: an item lists its parents and may be added to or
 * removed from each of them independently. Backends whose items have exactly one location
 * implement {@link #addToParent} as a move and {@link #removeFromParent} as a detach.
 * No method throws for backend failures; see {@link BackendResult}.
 */
public interface DestinationBackend {

    String rootFolderId();

    BackendResult<ItemRef> getFile(String fileId);

    BackendResult<ItemRef> getFolder(String folderId);

    BackendResult<ItemRef> createFolder(String parentId, String name);

    BackendResult<ItemRef> createFile(String parentId, String name, byte[] content);

    BackendResult<Void> rename(String itemId, String newName);

    BackendResult<Void> trash(String itemId);

    /** Direct children (files and folders) of a folder, excluding trashed items. */
    BackendResult<List<ItemRef>> listChildren(String folderId);

    BackendResult<List<String>> listParents(String itemId);

    BackendResult<Void> addToParent(String itemId, String parentId);

    BackendResult<Void> removeFromParent(String itemId, String parentId);

    /** Direct children of {@code parentId} with exactly the given name and type. */
    default BackendResult<List<ItemRef>> listByName(final String parentId, final String name, final ItemType type) {
        final BackendResult<List<ItemRef>> children = listChildren(parentId);
        if (!children.isOk()) {
            return children;
        }
        return BackendResult.ok(children.value().stream()
                .filter(item -> item.type() == type && item.name().equals(name))
                .toList());
    }
}
