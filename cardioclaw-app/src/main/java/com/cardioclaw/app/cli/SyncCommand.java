package com.cardioclaw.app.cli;

import com.cardioclaw.engine.CardioclawEngine;
import com.cardioclaw.engine.command.CronCommand;
import com.cardioclaw.engine.sync.SyncItem;
import com.cardioclaw.engine.sync.SyncOptions;
import com.cardioclaw.engine.sync.SyncReport;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "sync", description = "Create scheduler jobs for the heartbeats in cardioclaw.yaml")
class SyncCommand implements Callable<Integer> {

    @ParentCommand
    CardioclawCommand parent;

    @Option(names = "--dry-run", description = "Show what would be created without executing")
    boolean dryRun;

    @Option(names = "--force", description = "Replace jobs that already exist")
    boolean force;

    @Override
    public Integer call() {
        CardioclawEngine engine = parent.engine();
        Path path = parent.requireConfig();
        PrintWriter out = parent.out();

        out.println();
        out.println("🫀 Syncing " + path + (dryRun ? " (dry run)" : ""));
        out.println();

        SyncReport report = engine.syncEngine().sync(path,
                SyncOptions.defaults().withDryRun(dryRun).withForce(force));
        String binary = engine.settings().openclawBinary();
        for (SyncItem item : report.getItems()) {
            out.println(describe(item, binary));
        }

        List<String> warnings = new ArrayList<>(report.getWarnings());
        if (report.getDiscovery() != null)
            warnings.addAll(report.getDiscovery().warnings());
        if (report.getHousekeeping() != null) {
            if (report.getHousekeeping().archived() > 0) {
                out.println();
                out.println("📦 Archived " + report.getHousekeeping().archived() + " completed one-shot heartbeat(s)");
            }
            warnings.addAll(report.getHousekeeping().warnings());
        }
        parent.printWarnings(warnings);

        out.println();
        out.println(report.summaryLine());
        return report.failed() ? CliErrorHandler.EXIT_FAILURE : 0;
    }

    private static String describe(SyncItem item, String binary) {
        String name = item.displayName();
        switch (item.action()) {
            case CREATED:
                return "  ✓ Created: " + name;
            case REPLACED:
                return "  ↻ Replaced: " + name;
            case SKIPPED:
                return "  ⊘ Skipped: " + name + " (already exists; use --force to replace)";
            case WOULD_CREATE:
                return "  [DRY RUN] Would create: " + name + "\n      " + render(item, binary);
            case WOULD_REPLACE:
                return "  [DRY RUN] Would replace: " + name + "\n      " + render(item, binary);
            case FAILED:
            default:
                return "  ✗ Failed: " + name + ": " + item.error();
        }
    }

    private static String render(SyncItem item, String binary) {
        return new CronCommand(item.args(), null).render(binary);
    }
}
