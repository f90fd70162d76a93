package de.mirkosertic.docmirror.cli;

import de.mirkosertic.docmirror.DocMirrorApplication;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

/**
 * Discards all stored state, including a held run lock, and reconciles from scratch.
 */
@Command(
        name = "resync",
        description = "Forget all stored state and export everything again",
        mixinStandardHelpOptions = true
)
public class ResyncCommand implements Callable<Integer> {

    @ParentCommand
    private DocMirrorCli parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        final DocMirrorApplication application = parent.createApplication();
        return ResultPrinter.print(application.forceFullResync(), spec.commandLine().getOut());
    }
}
