package com.cardioclaw.app.cli;

import com.cardioclaw.common.infra.FormatAge;
import com.cardioclaw.engine.store.CacheStore;
import com.cardioclaw.engine.store.JobFilter;
import com.cardioclaw.engine.store.JobRow;
import com.cardioclaw.engine.store.StatusCounts;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "status", description = "Show active, failing and upcoming heartbeats")
class StatusCommand implements Callable<Integer> {

    static final int ACTIVE_SHOWN = 10;
    static final int ERROR_WIDTH = 80;

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("h:mm a", Locale.US);
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("MMM d, h:mm a", Locale.US);

    @ParentCommand
    CardioclawCommand parent;

    @Option(names = "--no-refresh", description = "Use the cached state without querying the scheduler")
    boolean noRefresh;

    @Override
    public Integer call() {
        if (!noRefresh)
            CacheRefresh.refresh(parent);

        CacheStore cache = parent.engine().cache();
        Instant now = parent.engine().clock().instant();
        ZoneId zone = ZoneId.systemDefault();
        PrintWriter out = parent.out();

        out.println();
        out.println("🫀 CardioClaw Status");
        out.println();

        StatusCounts counts = cache.statusCounts();
        if (counts.total() == 0) {
            out.println("  No heartbeats found. Run `cardioclaw sync` to create some!");
            out.println();
            return 0;
        }

        List<JobRow> active = cache.listJobs(JobFilter.ACTIVE);
        out.printf("📊 Active (%s):%n%n", jobs(active.size()));
        for (JobRow job : active.subList(0, Math.min(ACTIVE_SHOWN, active.size()))) {
            String agent = job.getAgent() != null ? " (" + job.getAgent() + ")" : "";
            out.printf("  %s ✓ %s%s%n", job.isManaged() ? "📋" : "  ", job.getName(), agent);
            out.printf("      Next: %s%n", formatNextRun(job.getNextRunAt(), now, zone));
        }
        if (active.size() > ACTIVE_SHOWN) {
            out.printf("  ... and %d more%n", active.size() - ACTIVE_SHOWN);
        }

        List<JobRow> failing = cache.listJobs(JobFilter.FAILING);
        if (!failing.isEmpty()) {
            out.printf("%n⚠️  Failing (%s):%n%n", jobs(failing.size()));
            for (JobRow job : failing) {
                out.println("  ✗ " + job.getName());
                if (job.getLastError() != null) {
                    out.println("    Error: " + FormatAge.truncate(job.getLastError(), ERROR_WIDTH));
                }
                if (job.getLastRunAt() != null) {
                    out.println("    Last run: " + FormatAge.formatAge(now.toEpochMilli() - job.getLastRunAt()));
                }
            }
        }

        out.println();
        out.println("─".repeat(60));
        out.printf("  Managed: %d | Unmanaged: %d | Failing: %d%n",
                counts.managed(), counts.unmanaged(), counts.failing());
        Optional<JobRow> next = cache.nextActiveJob();
        next.ifPresent(job -> out.printf("  Next run: %s in %s%n", job.getName(),
                FormatAge.formatTimeUntil(job.getNextRunAt(), now.toEpochMilli())));
        out.println();
        return 0;
    }

    private static String jobs(int n) {
        return n + (n == 1 ? " job" : " jobs");
    }

    /**
     * "Not scheduled", "Overdue", "Today 9:00 AM", "Tomorrow 9:00 AM" or
     * "Jun 3, 9:00 AM".
     */
    static String formatNextRun(Long nextRunAt, Instant now, ZoneId zone) {
        if (nextRunAt == null)
            return "Not scheduled";
        if (nextRunAt < now.toEpochMilli())
            return "Overdue";
        ZonedDateTime at = Instant.ofEpochMilli(nextRunAt).atZone(zone);
        LocalDate today = now.atZone(zone).toLocalDate();
        if (at.toLocalDate().equals(today))
            return "Today " + TIME.format(at);
        if (at.toLocalDate().equals(today.plusDays(1)))
            return "Tomorrow " + TIME.format(at);
        return DATE_TIME.format(at);
    }
}
