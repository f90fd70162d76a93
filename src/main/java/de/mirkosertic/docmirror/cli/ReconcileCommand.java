package de.mirkosertic.docmirror.cli;

import de.mirkosertic.docmirror.DocMirrorApplication;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

/**
 * Runs a single reconciliation.
 */
@Command(
        name = "reconcile",
        description = "Bring the destination in line with the source once",
        mixinStandardHelpOptions = true
)
public class ReconcileCommand implements Callable<Integer> {

    @ParentCommand
    private DocMirrorCli parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        final DocMirrorApplication application = parent.createApplication();
        return ResultPrinter.print(application.reconcile(), spec.commandLine().getOut());
    }
}
