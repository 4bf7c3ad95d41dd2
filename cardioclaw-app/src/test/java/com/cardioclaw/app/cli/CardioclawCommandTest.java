package com.cardioclaw.app.cli;

import com.cardioclaw.engine.CardioclawEngine;
import com.cardioclaw.engine.EngineSettings;
import com.cardioclaw.engine.command.TimezoneResolver;
import com.cardioclaw.engine.scheduler.FakeSchedulerClient;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.ScheduledJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CardioclawCommandTest {

    @TempDir
    Path tmp;

    private FakeSchedulerClient scheduler;
    private CardioclawEngine engine;
    private Path config;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        scheduler = new FakeSchedulerClient();
        EngineSettings settings = EngineSettings.fromEnvironment(
                Map.of("CARDIOCLAW_HOME", tmp.resolve("home").toString()), tmp.toString());
        engine = new CardioclawEngine(settings, scheduler,
                new TimezoneResolver(Optional::empty, ZoneId.of("UTC")),
                Clock.fixed(Instant.parse("2026-05-01T12:00:00Z"), ZoneOffset.UTC));
        config = Files.writeString(tmp.resolve("cardioclaw.yaml"), """
                defaults:
                  timezone: UTC
                heartbeats:
                  - name: Standup
                    schedule: "0 9 * * 1-5"
                    prompt: Post the standup summary
                """);
    }

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine cmd = CardioclawCommand.commandLine(new CardioclawCommand(settings -> engine));
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    @Test
    void syncCreatesThenSkips() {
        assertEquals(0, run("sync", "--config", config.toString()));
        assertTrue(out.toString().contains("✓ Created: Standup"), out.toString());
        assertTrue(out.toString().contains("1 created, 0 skipped, 0 errors"));

        assertEquals(0, run("sync", "--config", config.toString()));
        assertTrue(out.toString().contains("0 created, 1 skipped, 0 errors"));
        assertEquals(1, scheduler.countNamed("Standup"));
    }

    @Test
    void dryRunPrintsTheCommand() {
        assertEquals(0, run("--config", config.toString(), "sync", "--dry-run"));

        assertTrue(out.toString().contains("Would create: Standup"));
        assertTrue(out.toString().contains("openclaw cron add --name Standup"));
        assertTrue(scheduler.createCalls().isEmpty());
    }

    @Test
    void failedItemGivesNonzeroExit() {
        scheduler.failCreate(true);

        assertEquals(CliErrorHandler.EXIT_FAILURE, run("sync", "--config", config.toString()));
        assertTrue(out.toString().contains("0 created, 0 skipped, 1 errors"));
    }

    @Test
    void missingConfigListsCheckedPaths() {
        assertEquals(CliErrorHandler.EXIT_FAILURE, run("sync", "--config", tmp.resolve("nope.yaml").toString()));
        assertTrue(err.toString().contains("No cardioclaw.yaml found"));
        assertTrue(err.toString().contains("nope.yaml"));
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(CliErrorHandler.EXIT_USAGE, run("runs"));
        assertTrue(err.toString().contains("Must provide job name or use --all flag"));

        assertEquals(CliErrorHandler.EXIT_USAGE,
                run("prune", "--days", "3", "--before", "2026-01-01", "--config", config.toString()));
        assertEquals(CliErrorHandler.EXIT_USAGE, run("runs", "--all", "--limit", "0"));
    }

    @Test
    void statusAfterSync() {
        run("sync", "--config", config.toString());

        assertEquals(0, run("status", "--config", config.toString()));
        assertTrue(out.toString().contains("Active (1 job)"));
        assertTrue(out.toString().contains("Managed: 1 | Unmanaged: 0 | Failing: 0"));
    }

    @Test
    void statusOnEmptyCache() {
        assertEquals(0, run("status", "--no-refresh"));
        assertTrue(out.toString().contains("No heartbeats found"));
    }

    @Test
    void dedupeKeepsNewest() {
        ScheduledJob older = FakeSchedulerClient.cronJob("a", "Digest", "0 8 * * *");
        older.setCreatedAtMs(1L);
        ScheduledJob newer = FakeSchedulerClient.cronJob("b", "Digest", "0 8 * * *");
        newer.setCreatedAtMs(2L);
        scheduler.add(older).add(newer);

        assertEquals(0, run("dedupe"));
        assertTrue(out.toString().contains("Digest: 2 copies, keeping b"));
        assertEquals(1, scheduler.countNamed("Digest"));
    }

    @Test
    void removeDropsJobAndEntry() throws Exception {
        run("sync", "--config", config.toString());

        assertEquals(0, run("remove", "Standup", "--config", config.toString()));
        assertEquals(0, scheduler.countNamed("Standup"));
        assertFalse(Files.readString(config).contains("Standup"));
    }

    @Test
    void initWritesScaffoldOnce() throws Exception {
        Path target = tmp.resolve("fresh/cardioclaw.yaml");

        assertEquals(0, run("init", "--timezone", "Europe/Berlin", "--config", target.toString()));
        assertTrue(Files.readString(target).contains("timezone: Europe/Berlin"));

        assertEquals(0, run("init", "--config", target.toString()));
        assertTrue(out.toString().contains("Config already exists"));

        assertEquals(CliErrorHandler.EXIT_USAGE,
                run("init", "--timezone", "Mars/Olympus", "--config", tmp.resolve("x.yaml").toString()));
    }

    @Test
    void runsWithoutHistory() {
        assertEquals(0, run("runs", "Standup", "--no-refresh"));
        assertTrue(out.toString().contains("No execution history found for \"Standup\""));
    }

    @Test
    void verboseIsAcceptedAfterTheSubcommand() {
        assertEquals(0, run("sync", "-v", "--config", config.toString()));
        assertEquals(0, run("runs", "Standup", "--verbose", "--no-refresh"));
        assertEquals(0, run("--verbose", "status", "--no-refresh"));
    }

    @Test
    void pruneListsEntriesBeforeRemoving() throws Exception {
        Files.writeString(config, """
                heartbeats: []
                heartbeats_completed:
                  - name: Dentist
                    schedule: at 2026-01-10 09:00
                    message: dentist
                    executed_at: "2026-01-10T09:00:00Z"
                    status: ok
                  - name: Recent
                    schedule: at 2026-04-30 09:00
                    message: recent
                    executed_at: "2026-04-30T09:00:00Z"
                    status: ok
                """);

        assertEquals(0, run("prune", "--days", "30", "--config", config.toString()));

        String text = out.toString();
        int found = text.indexOf("Found 1 completed heartbeat(s)");
        int listed = text.indexOf("- Dentist");
        int removed = text.indexOf("🧹 Removed 1 completed heartbeat(s)");
        assertTrue(found >= 0 && found < listed && listed < removed, text);
        assertTrue(text.contains("1 entry kept"));
        assertFalse(Files.readString(config).contains("Dentist"));
    }

    @Test
    void pruneDryRunListsWithoutWriting() throws Exception {
        Files.writeString(config, """
                heartbeats: []
                heartbeats_completed:
                  - name: Dentist
                    schedule: at 2026-01-10 09:00
                    message: dentist
                    executed_at: "2026-01-10T09:00:00Z"
                """);

        assertEquals(0, run("prune", "--days", "30", "--dry-run", "--config", config.toString()));

        assertTrue(out.toString().contains("- Dentist"));
        assertTrue(out.toString().contains("[DRY RUN] No changes made"));
        assertTrue(Files.readString(config).contains("Dentist"));
    }

    @Test
    void negativeDaysIsAUsageError() {
        assertEquals(CliErrorHandler.EXIT_USAGE, run("prune", "--days", "-1", "--config", config.toString()));
        assertTrue(err.toString().contains("Must be a non-negative number"), err.toString());
    }

    @Test
    void formatsNextRunRelativeToToday() {
        Instant now = Instant.parse("2026-05-01T12:00:00Z");
        ZoneId utc = ZoneId.of("UTC");

        assertEquals("Not scheduled", StatusCommand.formatNextRun(null, now, utc));
        assertEquals("Overdue", StatusCommand.formatNextRun(now.toEpochMilli() - 1, now, utc));
        assertEquals("Today 3:30 PM",
                StatusCommand.formatNextRun(Instant.parse("2026-05-01T15:30:00Z").toEpochMilli(), now, utc));
        assertEquals("Tomorrow 9:00 AM",
                StatusCommand.formatNextRun(Instant.parse("2026-05-02T09:00:00Z").toEpochMilli(), now, utc));
        assertEquals("May 7, 9:00 AM",
                StatusCommand.formatNextRun(Instant.parse("2026-05-07T09:00:00Z").toEpochMilli(), now, utc));
    }
}
