package de.mirkosertic.docmirror.sync;

/**
 * Result of {@link PlacementManager#moveTo(String, String)}.
 */
public enum PlacementOutcome {
    /** The item already had exactly the target as its only parent. */
    UNCHANGED,
    /** At least one parent was removed or the target was added. */
    MOVED,
    /** The item no longer exists. */
    NOT_FOUND,
    /** A backend call failed transiently; the item may be partially re-parented. */
    FAILED
}
