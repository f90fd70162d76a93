package de.mirkosertic.docmirror.sync;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Node id to {@link TrackedEntry} mapping. Holds an entry for every node id ever observed
 * until the orphan reaper removes it.
 * <p>
 * Passed by reference through one reconciliation run; not thread-safe.
 */
public class SyncState {

    private final Map<String, TrackedEntry> entries;

    public SyncState() {
        this(new LinkedHashMap<>());
    }

    public SyncState(final Map<String, TrackedEntry> entries) {
        this.entries = new LinkedHashMap<>(entries);
    }

    public @Nullable TrackedEntry get(final String nodeId) {
        return entries.get(nodeId);
    }

    /**
     * Returns the entry for {@code nodeId}, creating an empty one that remembers
     * {@code title} on first sight.
     */
    public TrackedEntry getOrCreate(final String nodeId, final String title) {
        return entries.computeIfAbsent(nodeId, id -> new TrackedEntry(null, null, title, null));
    }

    public void put(final String nodeId, final TrackedEntry entry) {
        entries.put(nodeId, entry);
    }

    public @Nullable TrackedEntry remove(final String nodeId) {
        return entries.remove(nodeId);
    }

    public boolean contains(final String nodeId) {
        return entries.containsKey(nodeId);
    }

    /** Snapshot of the tracked ids, in insertion order. */
    public List<String> nodeIds() {
        return new ArrayList<>(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Read-only view for serialization. */
    public Map<String, TrackedEntry> asMap() {
        return Collections.unmodifiableMap(entries);
    }
}
