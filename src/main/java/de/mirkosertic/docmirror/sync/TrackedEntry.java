package de.mirkosertic.docmirror.sync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * What the reconciler last did for one source node: the artifact and folder it created,
 * the title it last synced and the logical parent it last placed the node under.
 * <p>
 * Mutable; owned by the run that holds the run lock and persisted as part of {@link SyncState}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrackedEntry {

    /** Parent key of top-level nodes. */
    public static final String ROOT_PARENT = "ROOT";

    private @Nullable String fileId;
    private @Nullable String folderId;
    private @Nullable String title;
    private @Nullable String parentKey;

    public TrackedEntry() {
    }

    public TrackedEntry(final @Nullable String fileId, final @Nullable String folderId,
                        final @Nullable String title, final @Nullable String parentKey) {
        this.fileId = fileId;
        this.folderId = folderId;
        this.title = title;
        this.parentKey = parentKey;
    }

    public @Nullable String getFileId() {
        return fileId;
    }

    public void setFileId(final @Nullable String fileId) {
        this.fileId = fileId;
    }

    public @Nullable String getFolderId() {
        return folderId;
    }

    public void setFolderId(final @Nullable String folderId) {
        this.folderId = folderId;
    }

    public @Nullable String getTitle() {
        return title;
    }

    public void setTitle(final @Nullable String title) {
        this.title = title;
    }

    public @Nullable String getParentKey() {
        return parentKey;
    }

    public void setParentKey(final @Nullable String parentKey) {
        this.parentKey = parentKey;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof final TrackedEntry that)) {
            return false;
        }
        return Objects.equals(fileId, that.fileId)
                && Objects.equals(folderId, that.folderId)
                && Objects.equals(title, that.title)
                && Objects.equals(parentKey, that.parentKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fileId, folderId, title, parentKey);
    }

    @Override
    public String toString() {
        return "TrackedEntry{fileId=" + fileId + ", folderId=" + folderId
                + ", title=" + title + ", parentKey=" + parentKey + "}";
    }
}
