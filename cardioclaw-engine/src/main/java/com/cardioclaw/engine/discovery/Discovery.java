package com.cardioclaw.engine.discovery;

import com.cardioclaw.common.errors.CardioclawException;
import com.cardioclaw.common.errors.ExternalQueryException;
import com.cardioclaw.engine.heartbeat.Heartbeat;
import com.cardioclaw.engine.heartbeat.HeartbeatFile;
import com.cardioclaw.engine.heartbeat.HeartbeatFileStore;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.JobState;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.ScheduledJob;
import com.cardioclaw.engine.scheduler.SchedulerClient;
import com.cardioclaw.engine.store.CacheStore;
import com.cardioclaw.engine.store.JobRow;
import com.cardioclaw.engine.store.RunRow;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Refreshes the job cache from the scheduler's current listing.
 * <p>
 * Run history is derived, not observed: the scheduler only exposes each job's
 * <em>last</em> run, so a pass records at most one run per job, and only when
 * that timestamp moved forward since the previous pass. Two executions between
 * passes show up as one. Poll more often for finer history.
 */
@Slf4j
public class Discovery {

    private static final ObjectMapper JSON = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private final SchedulerClient scheduler;
    private final CacheStore cache;
    private final HeartbeatFileStore fileStore;

    public Discovery(SchedulerClient scheduler, CacheStore cache, HeartbeatFileStore fileStore) {
        this.scheduler = scheduler;
        this.cache = cache;
        this.fileStore = fileStore;
    }

    /**
     * Query the scheduler, then apply upserts, derived runs and evictions in
     * one transaction.
     *
     * @param configPath declarative file used to mark jobs as managed; may be
     *                   null or missing
     * @throws ExternalQueryException if the scheduler cannot be queried, in
     *                                which case the cache is not touched
     */
    public DiscoveryResult discover(Path configPath) {
        List<ScheduledJob> jobs = scheduler.list();
        log.debug("Scheduler reported {} job(s)", jobs.size());

        List<String> warnings = new ArrayList<>();
        Set<String> managedNames = managedNames(configPath, warnings);

        DiscoveryResult result = cache.inTransaction(session -> {
            List<String> currentIds = new ArrayList<>();
            int managed = 0;
            int runs = 0;
            for (ScheduledJob job : jobs) {
                currentIds.add(job.getId());
                boolean isManaged = job.getName() != null && managedNames.contains(job.getName());
                if (isManaged)
                    managed++;

                JobState state = job.getState() != null ? job.getState() : new JobState();
                Long lastRunAt = state.getLastRunAtMs();
                Optional<JobRow> cached = session.findJob(job.getId());
                if (cached.isPresent() && lastRunAt != null && lastRunAt > valueOrZero(cached.get().getLastRunAt())) {
                    session.recordRun(toRun(job, state));
                    runs++;
                }
                session.upsertJob(toRow(job, state, isManaged));
            }
            int evicted = session.evictStale(currentIds);
            return new DiscoveryResult(jobs.size(), managed, jobs.size(), runs, evicted, warnings);
        });

        if (result.evicted() > 0) {
            log.info("Removed {} stale job(s) from cache", result.evicted());
        }
        log.debug("Discovery: {} found, {} managed, {} new run(s)", result.found(), result.managed(),
                result.runsRecorded());
        return result;
    }

    private Set<String> managedNames(Path configPath, List<String> warnings) {
        Set<String> names = new HashSet<>();
        if (configPath == null || !Files.isRegularFile(configPath))
            return names;
        try {
            HeartbeatFile file = fileStore.load(configPath);
            for (Heartbeat hb : file.heartbeats()) {
                if (hb.getName() != null)
                    names.add(hb.getName());
            }
        } catch (CardioclawException | UncheckedIOException e) {
            String warning = "Could not parse " + configPath + "; treating all jobs as unmanaged";
            log.warn("{}: {}", warning, e.getMessage());
            warnings.add(warning);
        }
        return names;
    }

    static String status(ScheduledJob job) {
        if (!job.isEnabled())
            return JobRow.STATUS_DISABLED;
        if (job.lastRunErrored())
            return JobRow.STATUS_FAILING;
        return JobRow.STATUS_ACTIVE;
    }

    private static JobRow toRow(ScheduledJob job, JobState state, boolean managed) {
        return JobRow.builder()
                .id(job.getId())
                .name(job.getName())
                .schedule(scheduleJson(job))
                .agent(job.resolveAgent())
                .status(status(job))
                .nextRunAt(state.getNextRunAtMs())
                .lastRunAt(state.getLastRunAtMs())
                .lastStatus(state.getLastStatus())
                .lastError(state.getLastError())
                .managed(managed)
                .build();
    }

    private static RunRow toRun(ScheduledJob job, JobState state) {
        long startedAt = state.getLastRunAtMs();
        Long duration = state.getLastDurationMs();
        return RunRow.builder()
                .jobId(job.getId())
                .jobName(job.getName())
                .startedAt(startedAt)
                .endedAt(startedAt + valueOrZero(duration))
                .durationMs(duration)
                .status(state.getLastStatus() != null ? state.getLastStatus() : RunRow.STATUS_OK)
                .error(state.getLastError())
                .sessionId(state.getLastSessionId())
                .build();
    }

    private static String scheduleJson(ScheduledJob job) {
        if (job.getSchedule() == null)
            return "{}";
        try {
            return JSON.writeValueAsString(job.getSchedule());
        } catch (JsonProcessingException e) {
            log.debug("Could not serialize schedule of {}: {}", job.getId(), e.getOriginalMessage());
            return "{}";
        }
    }

    private static long valueOrZero(Long value) {
        return value == null ? 0L : value;
    }
}
