package de.mirkosertic.docmirror.cli;

import de.mirkosertic.docmirror.DocMirrorApplication;
import de.mirkosertic.docmirror.config.LoggingConfigurator;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

/**
 * Reconciles at the configured interval until the process is stopped.
 * Logs go to a rolling file instead of the console.
 */
@Command(
        name = "schedule",
        description = "Reconcile periodically until stopped",
        mixinStandardHelpOptions = true
)
public class ScheduleCommand implements Callable<Integer> {

    @ParentCommand
    private DocMirrorCli parent;

    @Override
    public Integer call() throws Exception {
        LoggingConfigurator.configure(true);
        final DocMirrorApplication application = parent.createApplication();
        application.runScheduled();
        return ResultPrinter.EXIT_OK;
    }
}
