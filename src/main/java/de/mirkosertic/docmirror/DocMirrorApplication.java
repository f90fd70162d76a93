package de.mirkosertic.docmirror;

import de.mirkosertic.docmirror.audit.AuditSink;
import de.mirkosertic.docmirror.audit.CsvAuditLog;
import de.mirkosertic.docmirror.config.ApplicationConfig;
import de.mirkosertic.docmirror.destination.DestinationBackend;
import de.mirkosertic.docmirror.destination.LocalFolderBackend;
import de.mirkosertic.docmirror.render.HttpExportRenderer;
import de.mirkosertic.docmirror.render.PdfBoxRenderer;
import de.mirkosertic.docmirror.render.Renderer;
import de.mirkosertic.docmirror.schedule.ReconcileScheduler;
import de.mirkosertic.docmirror.source.SourceTreeReader;
import de.mirkosertic.docmirror.source.YamlSourceTreeReader;
import de.mirkosertic.docmirror.store.FilePropertyStore;
import de.mirkosertic.docmirror.store.PropertyStore;
import de.mirkosertic.docmirror.sync.ChangeDetector;
import de.mirkosertic.docmirror.sync.ExporterGateway;
import de.mirkosertic.docmirror.sync.HierarchyWalker;
import de.mirkosertic.docmirror.sync.OrphanReaper;
import de.mirkosertic.docmirror.sync.PlacementManager;
import de.mirkosertic.docmirror.sync.ReconciliationResult;
import de.mirkosertic.docmirror.sync.ReconciliationService;
import de.mirkosertic.docmirror.sync.RunLock;
import de.mirkosertic.docmirror.sync.StateStore;
import de.mirkosertic.docmirror.util.RetryPolicy;
import de.mirkosertic.docmirror.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Wires the reconciliation services from an {@link ApplicationConfig} and exposes the
 * operations the command line offers.
 */
public class DocMirrorApplication {

    private static final Logger logger = LoggerFactory.getLogger(DocMirrorApplication.class);

    public static final String SCHEDULE_NAME = "reconcile";

    private final ApplicationConfig config;
    private final ReconciliationService reconciliationService;
    private final StateStore stateStore;
    private final RunLock runLock;
    private final ReconcileScheduler scheduler;

    public DocMirrorApplication(final ApplicationConfig config) throws IOException {
        this(validated(config),
                createRenderer(config),
                new LocalFolderBackend(Path.of(Objects.requireNonNull(config.getDestinationRoot(),
                        "destination root"))),
                new FilePropertyStore(config.getStateFile()),
                config.isAuditEnabled() ? new CsvAuditLog(config.getAuditFile()) : AuditSink.NONE,
                Sleeper.SYSTEM,
                Clock.systemUTC());
    }

    DocMirrorApplication(final ApplicationConfig config,
                         final Renderer renderer,
                         final DestinationBackend backend,
                         final PropertyStore propertyStore,
                         final AuditSink auditSink,
                         final Sleeper sleeper,
                         final Clock clock) {
        config.validate();
        this.config = config;

        // Initialize services in dependency order
        final SourceTreeReader sourceReader = new YamlSourceTreeReader(Path.of(config.getSourceFile()));

        this.stateStore = new StateStore(propertyStore);
        this.runLock = new RunLock(propertyStore, Duration.ofMillis(config.getLockTimeoutMs()), clock, auditSink);

        final ChangeDetector changeDetector = new ChangeDetector(propertyStore);
        final RetryPolicy retryPolicy = new RetryPolicy(config.getMaxRetries(), config.getInitialBackoffMs(),
                config.getBackoffMultiplier(), RetryPolicy.RATE_LIMIT_OR_SERVER_ERROR);
        final ExporterGateway exporterGateway = new ExporterGateway(renderer, backend, retryPolicy, sleeper,
                config.getArtifactExtension());
        final PlacementManager placementManager = new PlacementManager(backend);

        final HierarchyWalker walker = new HierarchyWalker(changeDetector, exporterGateway, placementManager,
                backend, stateStore, sleeper, config.getDelayBetweenExportsMs(), config.getMaxDepth());
        final OrphanReaper orphanReaper = new OrphanReaper(backend, changeDetector, stateStore, auditSink);

        this.reconciliationService = new ReconciliationService(sourceReader, runLock, stateStore, walker,
                orphanReaper, propertyStore, auditSink, clock);
        this.scheduler = new ReconcileScheduler();
    }

    private static ApplicationConfig validated(final ApplicationConfig config) {
        config.validate();
        return config;
    }

    private static Renderer createRenderer(final ApplicationConfig config) {
        return switch (config.getRendererType()) {
            case PDFBOX -> new PdfBoxRenderer();
            case HTTP -> new HttpExportRenderer(config.getExportUrl(), config.getAuthToken(),
                    Duration.ofMillis(config.getRequestTimeoutMs()));
        };
    }

    public ReconciliationResult reconcile() {
        return reconciliationService.reconcile();
    }

    public ReconciliationResult forceFullResync() {
        return reconciliationService.forceFullResync();
    }

    /**
     * Registers the periodic reconciliation. Calling it again replaces the existing registration.
     */
    public void startScheduler() {
        scheduler.register(SCHEDULE_NAME, this::reconcile, Duration.ZERO,
                Duration.ofMillis(config.getScheduleIntervalMs()));
    }

    /**
     * Starts the scheduler and blocks until the JVM shuts down.
     */
    public void runScheduled() {
        startScheduler();
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        logger.info("Reconciling every {} ms, press Ctrl+C to stop", config.getScheduleIntervalMs());
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    public void shutdown() {
        logger.info("Shutting down DocMirror...");
        try {
            scheduler.shutdown();
        } catch (final RuntimeException e) {
            logger.error("Error shutting down scheduler", e);
        }
        logger.info("DocMirror shutdown complete");
    }

    public StateStore getStateStore() {
        return stateStore;
    }

    public RunLock getRunLock() {
        return runLock;
    }

    ReconcileScheduler getScheduler() {
        return scheduler;
    }
}
