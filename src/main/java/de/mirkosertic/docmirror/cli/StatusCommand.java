package de.mirkosertic.docmirror.cli;

import de.mirkosertic.docmirror.audit.AuditSink;
import de.mirkosertic.docmirror.config.ApplicationConfig;
import de.mirkosertic.docmirror.store.FilePropertyStore;
import de.mirkosertic.docmirror.sync.RunLock;
import de.mirkosertic.docmirror.sync.StateStore;
import de.mirkosertic.docmirror.sync.SyncState;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Prints what the state store knows without touching source or destination.
 */
@Command(
        name = "status",
        description = "Show the last completed run, the number of tracked nodes and the lock",
        mixinStandardHelpOptions = true
)
public class StatusCommand implements Callable<Integer> {

    @ParentCommand
    private DocMirrorCli parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final ApplicationConfig config = parent.loadConfig();
        final FilePropertyStore propertyStore = new FilePropertyStore(config.getStateFile());
        final StateStore stateStore = new StateStore(propertyStore);
        final SyncState state = stateStore.load();
        final Optional<Instant> lastRun = stateStore.lastRunAt();
        final String lockValue = propertyStore.getProperty(RunLock.LOCK_KEY);
        final RunLock runLock = new RunLock(propertyStore, Duration.ofMillis(config.getLockTimeoutMs()),
                Clock.systemUTC(), AuditSink.NONE);

        final PrintWriter out = spec.commandLine().getOut();
        out.println("State file:    " + propertyStore.getFile());
        out.println("Last run:      " + lastRun.map(Instant::toString).orElse("never"));
        out.println("Tracked nodes: " + state.size());
        if (lockValue == null) {
            out.println("Run lock:      free");
        } else {
            out.println("Run lock:      " + (runLock.isHeld() ? "held" : "stale") + " since " + formatLock(lockValue));
        }
        out.flush();
        return ResultPrinter.EXIT_OK;
    }

    private static String formatLock(final String lockValue) {
        try {
            return Instant.ofEpochMilli(Long.parseLong(lockValue.trim())).toString();
        } catch (final NumberFormatException e) {
            return "'" + lockValue + "' (unreadable)";
        }
    }
}
