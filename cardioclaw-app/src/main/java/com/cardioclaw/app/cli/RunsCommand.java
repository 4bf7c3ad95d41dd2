package com.cardioclaw.app.cli;

import com.cardioclaw.common.errors.UsageException;
import com.cardioclaw.common.infra.FormatAge;
import com.cardioclaw.engine.store.CacheStore;
import com.cardioclaw.engine.store.RunRow;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(name = "runs", description = "Show execution history for a heartbeat, or for all jobs")
class RunsCommand implements Callable<Integer> {

    private static final DateTimeFormatter STARTED = DateTimeFormatter.ofPattern("MMM d, h:mm a", Locale.US);

    @ParentCommand
    CardioclawCommand parent;

    @Parameters(arity = "0..1", paramLabel = "NAME", description = "Heartbeat name")
    String name;

    @Option(names = "--all", description = "Show runs of every job")
    boolean all;

    @Option(names = "--limit", defaultValue = "20", description = "Maximum runs to show (default: ${DEFAULT-VALUE})")
    int limit;

    @Option(names = "--no-refresh", description = "Use the cached history without querying the scheduler")
    boolean noRefresh;

    @Override
    public Integer call() {
        if (name == null && !all) {
            throw new UsageException("Must provide job name or use --all flag\n"
                    + "Examples:\n"
                    + "  cardioclaw runs \"Morning Briefing\"\n"
                    + "  cardioclaw runs --all --limit 10");
        }
        if (limit <= 0) {
            throw new UsageException("Invalid value for --limit. Must be a positive number");
        }
        PrintWriter out = parent.out();
        if (!noRefresh) {
            out.println("🔍 Refreshing run history...");
            CacheRefresh.refresh(parent);
        }

        CacheStore cache = parent.engine().cache();
        List<RunRow> runs = name != null ? cache.listRunsByName(name, limit) : cache.listRuns(limit);
        out.println();
        if (runs.isEmpty()) {
            out.println(name != null
                    ? "No execution history found for \"" + name + "\""
                    : "No execution history found.");
            out.println();
            return 0;
        }

        out.println(name != null ? "🫀 Execution History: " + name : "🫀 Recent Executions (All Jobs)");
        out.println();
        out.printf("Last %d run%s:%n%n", runs.size(), runs.size() == 1 ? "" : "s");

        ZoneId zone = ZoneId.systemDefault();
        for (RunRow run : runs) {
            String started = STARTED.format(Instant.ofEpochMilli(run.getStartedAt()).atZone(zone));
            String line = String.format("%-20s %s %-7s %s", started, icon(run.getStatus()), run.getStatus(),
                    FormatAge.formatRunDuration(run.getDurationMs()));
            if (name == null) {
                String jobName = run.getJobName() != null ? run.getJobName() : run.getJobId();
                line = String.format("%-27s %s", FormatAge.truncate(jobName, 25), line);
            }
            out.println("  " + line);
            if (parent.verbose() && run.getError() != null) {
                out.println("      Error: " + FormatAge.truncate(run.getError(), 70));
            }
        }

        if (name != null) {
            long ok = runs.stream().filter(RunRow::isOk).count();
            double avg = runs.stream()
                    .filter(r -> r.getDurationMs() != null && r.getDurationMs() > 0)
                    .mapToLong(RunRow::getDurationMs)
                    .average()
                    .orElse(0);
            out.println();
            out.println("─".repeat(60));
            out.printf("  Success rate: %d%% (%d/%d)%n", Math.round(100.0 * ok / runs.size()), ok, runs.size());
            out.printf("  Avg duration: %s%n", FormatAge.formatRunDuration(Math.round(avg)));
        }
        out.println();
        return 0;
    }

    private static String icon(String status) {
        if (RunRow.STATUS_OK.equals(status))
            return "✓";
        return RunRow.STATUS_ERROR.equals(status) ? "✗" : "⚠";
    }
}
