package com.cardioclaw.app.cli;

import com.cardioclaw.engine.dedupe.DedupeReport;
import com.cardioclaw.engine.dedupe.DedupeReport.DuplicateGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "dedupe", description = "Remove scheduler jobs sharing a name, keeping the newest")
class DedupeCommand implements Callable<Integer> {

    @ParentCommand
    CardioclawCommand parent;

    @Option(names = "--dry-run", description = "Show duplicates without removing them")
    boolean dryRun;

    @Override
    public Integer call() {
        DedupeReport report = parent.engine().deduper().dedupe(dryRun);
        PrintWriter out = parent.out();
        if (report.groups().isEmpty()) {
            out.println("✓ No duplicate jobs found");
            return 0;
        }

        for (DuplicateGroup group : report.groups()) {
            out.printf("  %s: %d copies, keeping %s%n", group.name(), group.copies(), group.keptId());
            for (String id : group.removedIds()) {
                String mark = group.failedIds().contains(id) ? "✗ failed to remove" : dryRun ? "would remove" : "✓ removed";
                out.printf("      %s %s%n", mark, id);
            }
        }
        out.println();
        out.printf("%s %d duplicate(s), kept %d unique job(s)%s%n",
                dryRun ? "Would remove" : "Removed", report.removed(), report.kept(),
                report.failed() ? ", " + report.failures() + " failed" : "");
        return report.failed() ? CliErrorHandler.EXIT_FAILURE : 0;
    }
}
