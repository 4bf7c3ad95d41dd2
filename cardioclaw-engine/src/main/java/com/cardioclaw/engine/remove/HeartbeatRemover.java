package com.cardioclaw.engine.remove;

import com.cardioclaw.common.errors.CardioclawException;
import com.cardioclaw.common.errors.RemoveFailedException;
import com.cardioclaw.common.errors.UsageException;
import com.cardioclaw.engine.heartbeat.Heartbeat;
import com.cardioclaw.engine.heartbeat.HeartbeatFile;
import com.cardioclaw.engine.heartbeat.HeartbeatFileStore;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.ScheduledJob;
import com.cardioclaw.engine.scheduler.SchedulerClient;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Removes a heartbeat everywhere: every scheduler job carrying its name and
 * its entry in the active list.
 */
@Slf4j
public class HeartbeatRemover {

    private final SchedulerClient scheduler;
    private final HeartbeatFileStore fileStore;

    public HeartbeatRemover(SchedulerClient scheduler, HeartbeatFileStore fileStore) {
        this.scheduler = scheduler;
        this.fileStore = fileStore;
    }

    /**
     * @param configPath the declarative file, or null when none exists
     */
    public RemoveReport remove(String name, Path configPath, boolean dryRun) {
        if (name == null || name.isBlank()) {
            throw new UsageException("Please provide a heartbeat name to remove");
        }

        List<String> removed = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (ScheduledJob job : scheduler.list()) {
            if (!name.equals(job.getName()))
                continue;
            if (dryRun) {
                removed.add(job.getId());
                continue;
            }
            try {
                scheduler.remove(job.getId());
                removed.add(job.getId());
                log.info("Removed job {} ('{}')", job.getId(), name);
            } catch (RemoveFailedException e) {
                failed.add(job.getId());
                log.warn("Failed to remove job {}: {}", job.getId(), e.getMessage());
            }
        }

        if (configPath == null) {
            return new RemoveReport(name, dryRun, removed, failed, null, false, null);
        }

        boolean inFile = false;
        String fileError = null;
        try {
            HeartbeatFile file = fileStore.load(configPath);
            List<JsonNode> remaining = new ArrayList<>();
            for (JsonNode node : file.heartbeatNodes()) {
                if (name.equals(Heartbeat.fromNode(node).getName())) {
                    inFile = true;
                } else {
                    remaining.add(node);
                }
            }
            if (inFile && !dryRun) {
                file.replaceHeartbeats(remaining);
                fileStore.save(file);
                log.info("Removed '{}' from {}", name, configPath);
            }
        } catch (CardioclawException | UncheckedIOException e) {
            fileError = e.getMessage();
            log.warn("Failed to update {}: {}", configPath, e.getMessage());
        }
        return new RemoveReport(name, dryRun, removed, failed, configPath, inFile, fileError);
    }
}
