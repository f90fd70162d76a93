package de.mirkosertic.docmirror.sync;

import org.jspecify.annotations.Nullable;

/**
 * Immutable summary of one call to {@link ReconciliationService#reconcile()}.
 */
public record ReconciliationResult(
        Status status,
        /** Number of nodes visited in the source tree. */
        long nodesVisited,
        /** Artifacts (re-)created during this run. */
        long exported,
        /** Nodes whose export failed after all retries; retried next run. */
        long exportFailures,
        long renamed,
        long moved,
        long foldersCreated,
        /** Orphans whose tracking entry was dropped. */
        long orphansRemoved,
        /** Orphan folders left in place because they still hold foreign content. */
        long orphanFoldersRetained,
        /** Wall-clock time in milliseconds. */
        long durationMs,
        /** Error message for {@link Status#FAILED}, otherwise null. */
        @Nullable String errorMessage
) {

    public enum Status {
        COMPLETED,
        /** Another run held a live lock; nothing was done. */
        SKIPPED_LOCKED,
        /** The run aborted; state persisted up to the failure is kept. */
        FAILED
    }

    static ReconciliationResult completed(final SyncStatistics statistics, final long durationMs) {
        return of(Status.COMPLETED, statistics, durationMs, null);
    }

    static ReconciliationResult failed(final SyncStatistics statistics, final long durationMs, final String errorMessage) {
        return of(Status.FAILED, statistics, durationMs, errorMessage);
    }

    static ReconciliationResult skippedLocked() {
        return new ReconciliationResult(Status.SKIPPED_LOCKED, 0, 0, 0, 0, 0, 0, 0, 0, 0, null);
    }

    private static ReconciliationResult of(final Status status, final SyncStatistics statistics, final long durationMs,
                                           final @Nullable String errorMessage) {
        return new ReconciliationResult(status,
                statistics.getNodesVisited(),
                statistics.getExported(),
                statistics.getExportFailures(),
                statistics.getRenamed(),
                statistics.getMoved(),
                statistics.getFoldersCreated(),
                statistics.getOrphansRemoved(),
                statistics.getOrphanFoldersRetained(),
                durationMs,
                errorMessage);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
