package com.cardioclaw.app.cli;

import com.cardioclaw.engine.heartbeat.CompletedHeartbeat;
import com.cardioclaw.engine.lifecycle.PruneOutcome;
import com.cardioclaw.engine.lifecycle.PruneRequest;
import com.cardioclaw.engine.lifecycle.Pruner;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "prune", description = "Remove old entries from heartbeats_completed")
class PruneCommand implements Callable<Integer> {

    @ParentCommand
    CardioclawCommand parent;

    @Option(names = "--days", description = "Remove entries executed more than N days ago")
    Integer days;

    @Option(names = "--before", description = "Remove entries executed before a date (YYYY-MM-DD or ISO instant)")
    String before;

    @Option(names = "--dry-run", description = "Show what would be removed without writing")
    boolean dryRun;

    @Override
    public Integer call() {
        PruneRequest request = new PruneRequest(days, before, dryRun);
        Pruner.validate(request);
        Path path = parent.requireConfig();

        PrintWriter out = parent.out();
        PruneOutcome outcome = parent.engine().pruner().prune(path, request, planned -> {
            out.printf("Found %d completed heartbeat(s) executed before %s:%n",
                    planned.removed().size(), planned.cutoff());
            for (CompletedHeartbeat entry : planned.removed()) {
                out.printf("  - %s (%s%s)%n", entry.getName(), entry.getExecutedAt(),
                        entry.isError() ? ", error" : "");
            }
            out.flush();
        });
        if (outcome.removed().isEmpty()) {
            out.println("Nothing to prune: no completed heartbeats executed before " + outcome.cutoff());
            return 0;
        }
        if (!outcome.written()) {
            out.println("[DRY RUN] No changes made");
            return 0;
        }

        out.printf("🧹 Removed %d completed heartbeat(s) from %s%n", outcome.removed().size(), outcome.path());
        out.printf("%d entr%s kept%n", outcome.kept(), outcome.kept() == 1 ? "y" : "ies");
        return 0;
    }
}
