package de.mirkosertic.docmirror.sync;

import de.mirkosertic.docmirror.audit.AuditSink;
import de.mirkosertic.docmirror.source.SourceNode;
import de.mirkosertic.docmirror.source.SourceTreeReader;
import de.mirkosertic.docmirror.store.PropertyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point of a reconciliation run.
 * <p>
 * A run acquires the {@link RunLock}, walks the source tree, reaps orphans and releases the
 * lock again, also when the run fails. Failures never escape: they are logged, audited and
 * reported through {@link ReconciliationResult}. Everything persisted before the failure
 * is kept, so the next run continues from there.
 */
public class ReconciliationService {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationService.class);

    private final SourceTreeReader sourceReader;
    private final RunLock runLock;
    private final StateStore stateStore;
    private final HierarchyWalker walker;
    private final OrphanReaper orphanReaper;
    private final PropertyStore propertyStore;
    private final AuditSink auditSink;
    private final Clock clock;

    public ReconciliationService(final SourceTreeReader sourceReader,
                                 final RunLock runLock,
                                 final StateStore stateStore,
                                 final HierarchyWalker walker,
                                 final OrphanReaper orphanReaper,
                                 final PropertyStore propertyStore,
                                 final AuditSink auditSink,
                                 final Clock clock) {
        this.sourceReader = sourceReader;
        this.runLock = runLock;
        this.stateStore = stateStore;
        this.walker = walker;
        this.orphanReaper = orphanReaper;
        this.propertyStore = propertyStore;
        this.auditSink = auditSink;
        this.clock = clock;
    }

    public ReconciliationResult reconcile() {
        final long start = clock.millis();
        if (!runLock.acquire()) {
            logger.warn("Reconciliation is already running (locked). Exiting.");
            return ReconciliationResult.skippedLocked();
        }

        final SyncStatistics statistics = new SyncStatistics();
        try {
            logger.info("Lock acquired. Starting reconciliation...");

            final String documentId = sourceReader.documentId();
            final SyncState state = stateStore.load();
            final List<SourceNode> topLevelNodes = sourceReader.listTopLevelNodes();
            logger.debug("Source {} has {} top-level nodes, {} nodes tracked",
                    documentId, topLevelNodes.size(), state.size());

            final Set<String> activeIds = new HashSet<>();
            final int exportCount = walker.walk(documentId, topLevelNodes, state, activeIds, statistics);

            orphanReaper.reap(state, activeIds, statistics);
            stateStore.save(state);
            stateStore.recordRun(clock.instant());

            final long duration = clock.millis() - start;
            logger.info("Run completed in {} ms. Exported: {}, renamed: {}, moved: {}, orphans removed: {}, failures: {}",
                    duration, exportCount, statistics.getRenamed(), statistics.getMoved(),
                    statistics.getOrphansRemoved(), statistics.getExportFailures());
            if (exportCount > 0) {
                auditSink.record("Info", "Run completed. " + exportCount + " files exported.", "Success");
            }
            return ReconciliationResult.completed(statistics, duration);
        } catch (final IOException | RuntimeException e) {
            final String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            logger.error("Reconciliation failed: {}", message, e);
            auditSink.record("Error", message, "Failed");
            return ReconciliationResult.failed(statistics, clock.millis() - start, message);
        } finally {
            runLock.release();
            logger.info("Lock released.");
        }
    }

    /**
     * Discards every persisted property (state, fingerprints, lock) and runs a reconciliation
     * from scratch. Existing artifacts are replaced in place, so no duplicates are left behind.
     */
    public ReconciliationResult forceFullResync() {
        logger.warn("Forcing full resync: discarding all persisted state");
        propertyStore.deleteAllProperties();
        return reconcile();
    }
}
