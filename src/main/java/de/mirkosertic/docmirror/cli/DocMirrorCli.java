package de.mirkosertic.docmirror.cli;

import ch.qos.logback.classic.Level;
import de.mirkosertic.docmirror.DocMirrorApplication;
import de.mirkosertic.docmirror.config.ApplicationConfig;
import de.mirkosertic.docmirror.config.BuildInfo;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Command line entry point.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code reconcile} - run one reconciliation</li>
 *   <li>{@code resync} - discard all stored state and reconcile from scratch</li>
 *   <li>{@code schedule} - reconcile periodically until stopped</li>
 *   <li>{@code status} - show the last run and the lock</li>
 * </ul>
 */
@Command(
        name = "docmirror",
        mixinStandardHelpOptions = true,
        versionProvider = DocMirrorCli.VersionProvider.class,
        description = "Mirrors a hierarchical document into a folder tree of rendered artifacts",
        subcommands = {
                ReconcileCommand.class,
                ResyncCommand.class,
                ScheduleCommand.class,
                StatusCommand.class
        }
)
public class DocMirrorCli implements Runnable {

    @Option(names = {"-c", "--config"}, description = "Config file (default: ~/.docmirror/config.yaml)")
    private @Nullable Path configFile;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    ApplicationConfig loadConfig() {
        applyVerbosity();
        return ApplicationConfig.load(configFile);
    }

    DocMirrorApplication createApplication() throws IOException {
        return new DocMirrorApplication(loadConfig());
    }

    private void applyVerbosity() {
        if (verbose) {
            final ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.DEBUG);
        }
    }

    public static void main(final String[] args) {
        final int exitCode = new CommandLine(new DocMirrorCli()).execute(args);
        System.exit(exitCode);
    }

    static class VersionProvider implements CommandLine.IVersionProvider {

        @Override
        public String[] getVersion() {
            return new String[]{"DocMirror " + BuildInfo.getVersion() + " (built " + BuildInfo.getBuildTimestamp() + ")"};
        }
    }
}
