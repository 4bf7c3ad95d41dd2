package com.cardioclaw.engine.discovery;

import com.cardioclaw.common.errors.ExternalQueryException;
import com.cardioclaw.engine.heartbeat.HeartbeatFileStore;
import com.cardioclaw.engine.scheduler.FakeSchedulerClient;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.JobState;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.ScheduledJob;
import com.cardioclaw.engine.store.CacheDatabase;
import com.cardioclaw.engine.store.CacheStore;
import com.cardioclaw.engine.store.JobFilter;
import com.cardioclaw.engine.store.JobRow;
import com.cardioclaw.engine.store.RunRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiscoveryTest {

    private static final long T1 = 1_760_000_000_000L;
    private static final long T2 = T1 + 3_600_000L;

    @TempDir
    Path tmp;

    private FakeSchedulerClient scheduler;
    private CacheStore cache;
    private Discovery discovery;
    private Path config;

    @BeforeEach
    void setUp() throws Exception {
        scheduler = new FakeSchedulerClient();
        cache = new CacheStore(CacheDatabase.open(tmp.resolve("state.db")));
        discovery = new Discovery(scheduler, cache, new HeartbeatFileStore());
        config = Files.writeString(tmp.resolve("cardioclaw.yaml"), """
                heartbeats:
                  - name: Standup
                    schedule: "0 9 * * *"
                    prompt: standup
                """);
    }

    private static ScheduledJob withLastRun(ScheduledJob job, Long lastRunAt, String status) {
        job.setState(JobState.builder().lastRunAtMs(lastRunAt).lastStatus(status)
                .lastDurationMs(1500L).lastSessionId("sess-1").nextRunAtMs(T2 + 86_400_000L).build());
        return job;
    }

    @Test
    void firstSightingRecordsNoRun() {
        scheduler.add(withLastRun(FakeSchedulerClient.cronJob("a", "Standup", "0 9 * * *"), T1, "ok"));

        DiscoveryResult result = discovery.discover(config);

        assertEquals(1, result.found());
        assertEquals(1, result.managed());
        assertEquals(0, result.runsRecorded());
        assertEquals(T1, cache.findJob("a").orElseThrow().getLastRunAt());
    }

    @Test
    void advancedLastRunRecordsExactlyOneRun() {
        ScheduledJob job = withLastRun(FakeSchedulerClient.cronJob("a", "Standup", "0 9 * * *"), T1, "ok");
        scheduler.add(job);
        discovery.discover(config);

        withLastRun(job, T2, "error").getState().setLastError("timeout talking to model");
        DiscoveryResult second = discovery.discover(config);

        assertEquals(1, second.runsRecorded());
        List<RunRow> runs = cache.listRuns("a", 10);
        assertEquals(1, runs.size());
        RunRow run = runs.get(0);
        assertEquals(T2, run.getStartedAt());
        assertEquals(T2 + 1500L, run.getEndedAt());
        assertEquals(1500L, run.getDurationMs());
        assertEquals("error", run.getStatus());
        assertEquals("timeout talking to model", run.getError());
        assertEquals("sess-1", run.getSessionId());
        assertEquals(JobRow.STATUS_FAILING, cache.findJob("a").orElseThrow().getStatus());

        DiscoveryResult third = discovery.discover(config);
        assertEquals(0, third.runsRecorded());
        assertEquals(1, cache.listRuns("a", 10).size());
    }

    @Test
    void cachedJobThatNeverRanCountsFromZero() {
        ScheduledJob job = FakeSchedulerClient.cronJob("a", "Standup", "0 9 * * *");
        scheduler.add(job);
        discovery.discover(config);

        withLastRun(job, T1, null);
        discovery.discover(config);

        List<RunRow> runs = cache.listRuns("a", 10);
        assertEquals(1, runs.size());
        assertEquals(RunRow.STATUS_OK, runs.get(0).getStatus());
    }

    @Test
    void statusAndManagedFlags() {
        scheduler.add(FakeSchedulerClient.cronJob("a", "Standup", "0 9 * * *"));
        scheduler.add(FakeSchedulerClient.oneShot("b", "Fired", "2026-01-01T09:00:00Z", false));
        scheduler.add(withLastRun(FakeSchedulerClient.cronJob("c", "Broken", "0 * * * *"), T1, "error"));

        discovery.discover(config);

        assertEquals(JobRow.STATUS_ACTIVE, cache.findJob("a").orElseThrow().getStatus());
        assertEquals(JobRow.STATUS_DISABLED, cache.findJob("b").orElseThrow().getStatus());
        assertEquals(JobRow.STATUS_FAILING, cache.findJob("c").orElseThrow().getStatus());
        assertEquals(List.of("a"), cache.listJobs(JobFilter.MANAGED).stream().map(JobRow::getId).toList());
        assertTrue(cache.findJob("a").orElseThrow().getSchedule().contains("\"kind\":\"cron\""));
    }

    @Test
    void evictsJobsNoLongerListed() {
        scheduler.add(FakeSchedulerClient.cronJob("a", "Standup", "0 9 * * *"));
        scheduler.add(FakeSchedulerClient.cronJob("b", "Other", "0 10 * * *"));
        discovery.discover(config);

        scheduler.jobs().removeIf(j -> j.getId().equals("b"));
        DiscoveryResult result = discovery.discover(config);

        assertEquals(1, result.evicted());
        assertTrue(cache.findJob("b").isEmpty());
    }

    @Test
    void unreadableConfigDegradesToUnmanaged() throws Exception {
        Files.writeString(config, "heartbeats: [\n  - name: \"broken\n");
        scheduler.add(FakeSchedulerClient.cronJob("a", "Standup", "0 9 * * *"));

        DiscoveryResult result = discovery.discover(config);

        assertEquals(0, result.managed());
        assertEquals(1, result.warnings().size());
        assertFalse(cache.findJob("a").orElseThrow().isManaged());
        assertEquals(0, discovery.discover(tmp.resolve("missing.yaml")).managed());
    }

    @Test
    void queryFailureLeavesCacheByteIdentical() throws Exception {
        scheduler.add(withLastRun(FakeSchedulerClient.cronJob("a", "Standup", "0 9 * * *"), T1, "ok"));
        scheduler.add(FakeSchedulerClient.cronJob("b", "Other", "0 10 * * *"));
        discovery.discover(config);
        byte[] before = Files.readAllBytes(cache.getDatabase().getFile());

        scheduler.failList(true);
        assertThrows(ExternalQueryException.class, () -> discovery.discover(config));

        assertArrayEquals(before, Files.readAllBytes(cache.getDatabase().getFile()));
        assertEquals(2, cache.listJobs(JobFilter.ALL).size());
    }
}
