package com.cardioclaw.app.cli;

import com.cardioclaw.engine.remove.RemoveReport;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "remove", description = "Remove a heartbeat from the scheduler and from cardioclaw.yaml")
class RemoveCommand implements Callable<Integer> {

    @ParentCommand
    CardioclawCommand parent;

    @Parameters(index = "0", paramLabel = "NAME", description = "Heartbeat name")
    String name;

    @Option(names = "--dry-run", description = "Show what would be removed")
    boolean dryRun;

    @Override
    public Integer call() {
        RemoveReport report = parent.engine().remover().remove(name, parent.locateConfig().orElse(null), dryRun);
        PrintWriter out = parent.out();
        String prefix = dryRun ? "  [DRY RUN] Would remove" : "  ✓ Removed";

        out.printf("%n🗑️  Removing: \"%s\"%n%n", name);
        if (report.removedJobIds().isEmpty() && report.failedJobIds().isEmpty()) {
            out.println("  ⊘ Not found in OpenClaw cron jobs");
        }
        for (String id : report.removedJobIds()) {
            out.println(prefix + " from OpenClaw: " + id);
        }
        for (String id : report.failedJobIds()) {
            out.println("  ✗ Failed to remove from OpenClaw: " + id);
        }

        if (report.configPath() == null) {
            out.println("  ⊘ No cardioclaw.yaml found");
        } else if (report.fileError() != null) {
            out.println("  ✗ Failed to update YAML: " + report.fileError());
        } else if (report.removedFromFile()) {
            out.println(prefix + " from " + report.configPath());
        } else {
            out.println("  ⊘ Not found in YAML");
        }
        out.println();
        return report.failed() ? CliErrorHandler.EXIT_FAILURE : 0;
    }
}
