package com.cardioclaw.engine.importer;

import com.cardioclaw.common.errors.ExternalQueryException;
import com.cardioclaw.engine.command.TimezoneResolver;
import com.cardioclaw.engine.heartbeat.Heartbeat;
import com.cardioclaw.engine.heartbeat.HeartbeatFile;
import com.cardioclaw.engine.heartbeat.HeartbeatFileStore;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.ScheduledJob;
import com.cardioclaw.engine.scheduler.SchedulerClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Brings jobs created outside the declarative file under management by
 * appending them as heartbeats.
 */
@Slf4j
public class HeartbeatImporter {

    private final SchedulerClient scheduler;
    private final HeartbeatFileStore fileStore;
    private final TimezoneResolver timezoneResolver;
    private final Clock clock;

    public HeartbeatImporter(SchedulerClient scheduler, HeartbeatFileStore fileStore,
                             TimezoneResolver timezoneResolver, Clock clock) {
        this.scheduler = scheduler;
        this.fileStore = fileStore;
        this.timezoneResolver = timezoneResolver;
        this.clock = clock;
    }

    /**
     * @param target file to extend, created when missing
     * @throws ExternalQueryException if the scheduler cannot be listed
     */
    public ImportReport importJobs(Path target, boolean dryRun) {
        List<ScheduledJob> jobs = scheduler.list();

        HeartbeatFile file = Files.isRegularFile(target)
                ? fileStore.load(target)
                : new HeartbeatFile(target, JsonNodeFactory.instance.objectNode());
        ZoneId zone = timezoneResolver.resolve(null, file.defaults()).zone();

        Set<String> declared = new HashSet<>();
        for (Heartbeat hb : file.heartbeats()) {
            if (hb.getName() != null)
                declared.add(hb.getName());
        }

        List<Heartbeat> added = new ArrayList<>();
        List<String> alreadyListed = new ArrayList<>();
        List<String> unconvertible = new ArrayList<>();
        for (ScheduledJob job : jobs) {
            if (job.getName() == null) {
                unconvertible.add(job.getId());
                continue;
            }
            if (declared.contains(job.getName())) {
                alreadyListed.add(job.getName());
                continue;
            }
            Optional<Heartbeat> hb = JobConverter.toHeartbeat(job, zone);
            if (hb.isEmpty()) {
                log.debug("Cannot convert job {} ('{}')", job.getId(), job.getName());
                unconvertible.add(job.getName());
                continue;
            }
            added.add(hb.get());
            declared.add(job.getName());
        }

        if (added.isEmpty() || dryRun) {
            return new ImportReport(target, jobs.size(), added, alreadyListed, unconvertible, false);
        }

        List<JsonNode> entries = new ArrayList<>(file.heartbeatNodes());
        added.forEach(hb -> entries.add(hb.toNode()));
        file.replaceHeartbeats(entries);
        fileStore.save(file, header());
        log.info("Imported {} heartbeat(s) into {}", added.size(), target);
        return new ImportReport(target, jobs.size(), added, alreadyListed, unconvertible, true);
    }

    private String header() {
        return "# CardioClaw Configuration\n"
                + "# Imported: " + DateTimeFormatter.ISO_INSTANT.format(clock.instant()) + "\n";
    }
}
