package de.mirkosertic.docmirror.cli;

import de.mirkosertic.docmirror.sync.ReconciliationResult;

import java.io.PrintWriter;

/**
 * Prints a {@link ReconciliationResult} and maps it to a process exit code.
 */
final class ResultPrinter {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_LOCKED = 2;

    private ResultPrinter() {
    }

    static int print(final ReconciliationResult result, final PrintWriter out) {
        switch (result.status()) {
            case SKIPPED_LOCKED -> {
                out.println("Another reconciliation is running, nothing done.");
                return EXIT_LOCKED;
            }
            case FAILED -> {
                out.println("Reconciliation failed: " + result.errorMessage());
                printCounters(result, out);
                return EXIT_FAILED;
            }
            default -> {
                out.println("Reconciliation completed in " + result.durationMs() + " ms.");
                printCounters(result, out);
                return EXIT_OK;
            }
        }
    }

    private static void printCounters(final ReconciliationResult result, final PrintWriter out) {
        out.printf("  nodes visited:           %d%n", result.nodesVisited());
        out.printf("  exported:                %d%n", result.exported());
        out.printf("  export failures:         %d%n", result.exportFailures());
        out.printf("  renamed:                 %d%n", result.renamed());
        out.printf("  moved:                   %d%n", result.moved());
        out.printf("  folders created:         %d%n", result.foldersCreated());
        out.printf("  orphans removed:         %d%n", result.orphansRemoved());
        out.printf("  orphan folders retained: %d%n", result.orphanFoldersRetained());
        out.flush();
    }
}
