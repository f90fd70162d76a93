package de.mirkosertic.docmirror.sync;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for one reconciliation run.
 * Safe to read from another thread while the run is in progress.
 */
public class SyncStatistics {

    private final AtomicLong nodesVisited = new AtomicLong(0);
    private final AtomicLong exported = new AtomicLong(0);
    private final AtomicLong exportFailures = new AtomicLong(0);
    private final AtomicLong renamed = new AtomicLong(0);
    private final AtomicLong moved = new AtomicLong(0);
    private final AtomicLong foldersCreated = new AtomicLong(0);
    private final AtomicLong selfHealed = new AtomicLong(0);
    private final AtomicLong skippedBeyondDepth = new AtomicLong(0);

    // Orphan reaping
    private final AtomicLong orphansRemoved = new AtomicLong(0);
    private final AtomicLong orphanFoldersRetained = new AtomicLong(0);

    public void incrementNodesVisited() {
        nodesVisited.incrementAndGet();
    }

    public void incrementExported() {
        exported.incrementAndGet();
    }

    public void incrementExportFailures() {
        exportFailures.incrementAndGet();
    }

    public void incrementRenamed() {
        renamed.incrementAndGet();
    }

    public void incrementMoved() {
        moved.incrementAndGet();
    }

    public void incrementFoldersCreated() {
        foldersCreated.incrementAndGet();
    }

    public void incrementSelfHealed() {
        selfHealed.incrementAndGet();
    }

    public void incrementSkippedBeyondDepth() {
        skippedBeyondDepth.incrementAndGet();
    }

    public void incrementOrphansRemoved() {
        orphansRemoved.incrementAndGet();
    }

    public void incrementOrphanFoldersRetained() {
        orphanFoldersRetained.incrementAndGet();
    }

    public long getNodesVisited() {
        return nodesVisited.get();
    }

    public long getExported() {
        return exported.get();
    }

    public long getExportFailures() {
        return exportFailures.get();
    }

    public long getRenamed() {
        return renamed.get();
    }

    public long getMoved() {
        return moved.get();
    }

    public long getFoldersCreated() {
        return foldersCreated.get();
    }

    public long getSelfHealed() {
        return selfHealed.get();
    }

    public long getSkippedBeyondDepth() {
        return skippedBeyondDepth.get();
    }

    public long getOrphansRemoved() {
        return orphansRemoved.get();
    }

    public long getOrphanFoldersRetained() {
        return orphanFoldersRetained.get();
    }
}
