package com.cardioclaw.engine.sync;

import com.cardioclaw.common.errors.CardioclawException;
import com.cardioclaw.common.errors.ConfigNotFoundException;
import com.cardioclaw.common.errors.ConfigParseException;
import com.cardioclaw.common.errors.ExternalQueryException;
import com.cardioclaw.engine.command.CommandBuilder;
import com.cardioclaw.engine.command.CronCommand;
import com.cardioclaw.engine.discovery.Discovery;
import com.cardioclaw.engine.discovery.DiscoveryResult;
import com.cardioclaw.engine.heartbeat.Heartbeat;
import com.cardioclaw.engine.heartbeat.HeartbeatDefaults;
import com.cardioclaw.engine.heartbeat.HeartbeatFile;
import com.cardioclaw.engine.heartbeat.HeartbeatFileStore;
import com.cardioclaw.engine.heartbeat.HeartbeatValidator;
import com.cardioclaw.engine.lifecycle.ArchiveResult;
import com.cardioclaw.engine.lifecycle.Archiver;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.ScheduledJob;
import com.cardioclaw.engine.scheduler.SchedulerClient;
import com.cardioclaw.engine.store.CacheStore;
import com.cardioclaw.engine.store.RunPruneResult;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Creates the scheduler jobs declared in a heartbeat file.
 * <p>
 * Each heartbeat is handled independently: a bad entry or a failed create is
 * recorded on the report and the batch moves on. Only an unreadable file or,
 * unless tolerated, an unreachable scheduler aborts the whole sync. The cache
 * is only touched after the jobs are created, so a cache that cannot be opened
 * turns into housekeeping warnings.
 */
@Slf4j
public class SyncEngine {

    private final SchedulerClient scheduler;
    private final CommandBuilder commandBuilder;
    private final HeartbeatFileStore fileStore;
    private final Supplier<Discovery> discovery;
    private final Archiver archiver;
    private final Supplier<CacheStore> cache;

    public SyncEngine(SchedulerClient scheduler, CommandBuilder commandBuilder, HeartbeatFileStore fileStore,
                      Supplier<Discovery> discovery, Archiver archiver, Supplier<CacheStore> cache) {
        this.scheduler = scheduler;
        this.commandBuilder = commandBuilder;
        this.fileStore = fileStore;
        this.discovery = discovery;
        this.archiver = archiver;
        this.cache = cache;
    }

    /**
     * @throws ConfigNotFoundException if {@code configPath} does not exist
     * @throws ConfigParseException    if the file is invalid or has no
     *                                 {@code heartbeats} list
     * @throws ExternalQueryException  if existing jobs cannot be listed and
     *                                 the options do not tolerate it
     */
    public SyncReport sync(Path configPath, SyncOptions options) {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigNotFoundException(List.of(configPath));
        }
        HeartbeatFile file = fileStore.load(configPath);
        if (!file.hasHeartbeatList()) {
            throw new ConfigParseException(configPath, "No heartbeats found in " + configPath);
        }
        HeartbeatDefaults defaults = file.defaults();
        List<Heartbeat> heartbeats = file.heartbeats();
        log.debug("Found {} heartbeat(s) in {}", heartbeats.size(), configPath);

        SyncReport.SyncReportBuilder report = SyncReport.builder()
                .configPath(configPath)
                .dryRun(options.dryRun());
        Set<String> warnings = new LinkedHashSet<>();

        Map<String, ScheduledJob> existingByName = existingJobs(options, warnings);

        Set<String> seenNames = new HashSet<>();
        int mutated = 0;
        for (Heartbeat hb : heartbeats) {
            SyncItem item = syncOne(hb, defaults, existingByName, seenNames, options, warnings);
            report.item(item);
            if (item.action() == SyncItem.Action.CREATED || item.action() == SyncItem.Action.REPLACED)
                mutated++;
        }

        if (!options.dryRun()) {
            List<String> housekeepingWarnings = new ArrayList<>();
            if (mutated > 0) {
                report.discovery(refreshCache(configPath, housekeepingWarnings));
            }
            report.housekeeping(housekeeping(configPath, housekeepingWarnings));
        }
        warnings.forEach(report::warning);
        return report.build();
    }

    private SyncItem syncOne(Heartbeat hb, HeartbeatDefaults defaults, Map<String, ScheduledJob> existingByName,
                             Set<String> seenNames, SyncOptions options, Set<String> warnings) {
        try {
            HeartbeatValidator.validate(hb);
            HeartbeatValidator.requireUniqueName(hb, seenNames);

            ScheduledJob existing = existingByName.get(hb.getName());
            if (existing != null && !options.force()) {
                log.debug("Skipping existing job '{}'", hb.getName());
                return SyncItem.of(hb.getName(), SyncItem.Action.SKIPPED, null);
            }

            // Build first: an entry that cannot be built must not remove the existing job.
            CronCommand command = commandBuilder.build(hb, defaults);
            if (command.warning() != null)
                warnings.add(command.warning());

            if (options.dryRun()) {
                return SyncItem.of(hb.getName(),
                        existing != null ? SyncItem.Action.WOULD_REPLACE : SyncItem.Action.WOULD_CREATE,
                        command.args());
            }

            if (existing != null) {
                scheduler.remove(existing.getId());
                log.info("Removed job {} ('{}') for replacement", existing.getId(), hb.getName());
            }
            scheduler.create(command.args());
            log.info("{} job '{}'", existing != null ? "Replaced" : "Created", hb.getName());
            return SyncItem.of(hb.getName(),
                    existing != null ? SyncItem.Action.REPLACED : SyncItem.Action.CREATED,
                    command.args());
        } catch (CardioclawException e) {
            log.debug("Heartbeat '{}' failed: {}", hb.getName(), e.getMessage());
            return SyncItem.failed(hb.getName(), e.getMessage(), e.getKind());
        }
    }

    /**
     * Existing jobs indexed by name. When a name appears more than once the
     * first listed job is the one indexed.
     */
    private Map<String, ScheduledJob> existingJobs(SyncOptions options, Set<String> warnings) {
        List<ScheduledJob> jobs;
        try {
            jobs = scheduler.list();
        } catch (ExternalQueryException e) {
            if (!options.tolerateQueryFailure())
                throw e;
            log.warn("Could not list existing jobs, assuming none: {}", e.getMessage());
            warnings.add("Could not list existing jobs; duplicates may be created: " + e.getMessage());
            jobs = List.of();
        }
        Map<String, ScheduledJob> byName = new LinkedHashMap<>();
        for (ScheduledJob job : jobs) {
            if (job.getName() != null)
                byName.putIfAbsent(job.getName(), job);
        }
        return byName;
    }

    private DiscoveryResult refreshCache(Path configPath, List<String> warnings) {
        try {
            return discovery.get().discover(configPath);
        } catch (CardioclawException e) {
            log.warn("Post-sync discovery failed: {}", e.getMessage());
            warnings.add("Discovery failed: " + e.getMessage());
            return null;
        }
    }

    private Housekeeping housekeeping(Path configPath, List<String> warnings) {
        ArchiveResult archive = archiver.archiveCompletedOneShots(configPath);
        warnings.addAll(archive.errors());

        RunPruneResult runPrune = null;
        try {
            runPrune = cache.get().pruneRuns(CacheStore.DEFAULT_PRUNE_DAYS, CacheStore.DEFAULT_KEEP_PER_JOB);
        } catch (CardioclawException e) {
            log.warn("Run pruning failed: {}", e.getMessage());
            warnings.add("Run pruning failed: " + e.getMessage());
        }
        return new Housekeeping(archive, runPrune, warnings);
    }
}
