package com.cardioclaw.app.cli;

import com.cardioclaw.engine.heartbeat.Heartbeat;
import com.cardioclaw.engine.importer.ImportReport;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "import", description = "Append existing scheduler jobs to cardioclaw.yaml")
class ImportCommand implements Callable<Integer> {

    @ParentCommand
    CardioclawCommand parent;

    @Option(names = "--dry-run", description = "Show what would be imported without writing")
    boolean dryRun;

    @Override
    public Integer call() {
        Path target = parent.engine().configLocator().resolveForWrite(parent.configOption());
        ImportReport report = parent.engine().importer().importJobs(target, dryRun);
        PrintWriter out = parent.out();

        out.printf("📥 Found %d scheduler job(s)%n", report.found());
        for (Heartbeat hb : report.added()) {
            out.printf("  + %s (%s)%n", hb.getName(), hb.getSchedule());
        }
        if (!report.alreadyListed().isEmpty()) {
            out.printf("  ⊘ %d already in %s%n", report.alreadyListed().size(), target.getFileName());
        }
        for (String name : report.unconvertible()) {
            out.printf("  ✗ Cannot convert: %s%n", name);
        }

        if (report.added().isEmpty()) {
            out.println("Nothing to import");
        } else if (report.written()) {
            out.printf("✓ Imported %d heartbeat(s) into %s%n", report.added().size(), target);
        } else {
            out.printf("[DRY RUN] Would import %d heartbeat(s) into %s%n", report.added().size(), target);
        }
        return 0;
    }
}
