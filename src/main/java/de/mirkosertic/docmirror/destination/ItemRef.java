package de.mirkosertic.docmirror.destination;

/**
 * Reference to a file or folder in the destination store.
 */
public record ItemRef(
        /** Backend-assigned identifier; stable across renames and moves. */
        String id,
        /** Current name within its parent. */
        String name,
        ItemType type
) {

    public boolean isFolder() {
        return type == ItemType.FOLDER;
    }
}
