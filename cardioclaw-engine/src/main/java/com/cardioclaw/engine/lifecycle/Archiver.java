package com.cardioclaw.engine.lifecycle;

import com.cardioclaw.common.errors.CardioclawException;
import com.cardioclaw.engine.command.AtTimeParser;
import com.cardioclaw.engine.command.TimezoneResolver;
import com.cardioclaw.engine.heartbeat.CompletedHeartbeat;
import com.cardioclaw.engine.heartbeat.Heartbeat;
import com.cardioclaw.engine.heartbeat.HeartbeatFile;
import com.cardioclaw.engine.heartbeat.HeartbeatFileStore;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.JobState;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.ScheduledJob;
import com.cardioclaw.engine.scheduler.SchedulerClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves fired one-shot heartbeats from the active list to the completed
 * ledger.
 * <p>
 * A one-shot moves only when its scheduled instant is past <em>and</em> the
 * scheduler has disabled its job. A past-due job that is still enabled never
 * ran and stays visible as missed; a heartbeat with no job at all stays too.
 */
@Slf4j
public class Archiver {

    private final SchedulerClient scheduler;
    private final HeartbeatFileStore fileStore;
    private final TimezoneResolver timezoneResolver;
    private final Clock clock;

    public Archiver(SchedulerClient scheduler, HeartbeatFileStore fileStore,
                    TimezoneResolver timezoneResolver, Clock clock) {
        this.scheduler = scheduler;
        this.fileStore = fileStore;
        this.timezoneResolver = timezoneResolver;
        this.clock = clock;
    }

    public ArchiveResult archiveCompletedOneShots(Path path) {
        if (path == null || !Files.isRegularFile(path))
            return ArchiveResult.empty();

        HeartbeatFile file;
        try {
            file = fileStore.load(path);
        } catch (CardioclawException e) {
            return ArchiveResult.failed(e.getMessage());
        }
        if (!file.hasHeartbeatList())
            return ArchiveResult.empty();

        Map<String, ScheduledJob> jobsByName = new HashMap<>();
        try {
            for (ScheduledJob job : scheduler.list()) {
                jobsByName.put(job.getName(), job);
            }
        } catch (CardioclawException e) {
            return ArchiveResult.failed("Failed to query OpenClaw: " + e.getMessage());
        }

        Instant now = clock.instant();
        List<JsonNode> active = new ArrayList<>();
        List<JsonNode> completed = new ArrayList<>(file.completedNodes());
        List<String> errors = new ArrayList<>();
        int archived = 0;

        for (JsonNode node : file.heartbeatNodes()) {
            Heartbeat hb = Heartbeat.fromNode(node);
            ScheduledJob job = hb.isOneShot() ? jobsByName.get(hb.getName()) : null;
            if (job == null) {
                active.add(node);
                continue;
            }

            Instant scheduled;
            try {
                scheduled = AtTimeParser.parse(hb.getSchedule().trim())
                        .toInstant(timezoneResolver.resolve(hb.getTz(), file.defaults()).zone());
            } catch (CardioclawException e) {
                errors.add("Skipping '" + hb.getName() + "': " + e.getMessage());
                active.add(node);
                continue;
            }

            boolean isPast = scheduled.isBefore(now);
            if (isPast && !job.isEnabled()) {
                completed.add(completedEntry(node, job, scheduled));
                archived++;
                log.info("Archived completed one-shot '{}'", hb.getName());
            } else {
                active.add(node);
            }
        }

        if (archived == 0)
            return new ArchiveResult(0, errors);

        file.replaceHeartbeats(active);
        file.replaceCompleted(completed);
        try {
            fileStore.save(file);
        } catch (UncheckedIOException e) {
            errors.add("Failed to write YAML: " + e.getMessage());
            return new ArchiveResult(0, errors);
        }
        return new ArchiveResult(archived, errors);
    }

    private static ObjectNode completedEntry(JsonNode node, ScheduledJob job, Instant scheduled) {
        ObjectNode entry = ((ObjectNode) node).deepCopy();
        JobState state = job.getState() != null ? job.getState() : new JobState();
        Instant executedAt = state.getLastRunAtMs() != null
                ? Instant.ofEpochMilli(state.getLastRunAtMs())
                : scheduled;
        entry.put(CompletedHeartbeat.EXECUTED_AT, AtTimeParser.toIso(executedAt));
        entry.put(CompletedHeartbeat.STATUS, job.lastRunErrored() ? "error" : "ok");
        if (state.getLastError() != null) {
            entry.put(CompletedHeartbeat.ERROR, state.getLastError());
        }
        return entry;
    }
}
