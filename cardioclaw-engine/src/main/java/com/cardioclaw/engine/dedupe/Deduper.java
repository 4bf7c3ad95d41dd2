package com.cardioclaw.engine.dedupe;

import com.cardioclaw.common.errors.ExternalQueryException;
import com.cardioclaw.common.errors.RemoveFailedException;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.ScheduledJob;
import com.cardioclaw.engine.scheduler.SchedulerClient;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Removes scheduler jobs that share a name, keeping the newest of each.
 * <p>
 * "Newest" is decided by {@code createdAtMs}, falling back to
 * {@code updatedAtMs} and then to 0. Jobs with equal keys keep the scheduler's
 * listing order, so among undated duplicates the first listed job survives.
 */
@Slf4j
public class Deduper {

    static final String UNNAMED = "unnamed";

    static final Comparator<ScheduledJob> NEWEST_FIRST =
            Comparator.comparingLong(Deduper::ageKey).reversed();

    private final SchedulerClient scheduler;

    public Deduper(SchedulerClient scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * @throws ExternalQueryException if the scheduler cannot be listed
     */
    public DedupeReport dedupe(boolean dryRun) {
        Map<String, List<ScheduledJob>> byName = new LinkedHashMap<>();
        for (ScheduledJob job : scheduler.list()) {
            String name = job.getName() != null ? job.getName() : UNNAMED;
            byName.computeIfAbsent(name, k -> new ArrayList<>()).add(job);
        }

        List<DedupeReport.DuplicateGroup> groups = new ArrayList<>();
        int removed = 0;
        int failures = 0;
        for (Map.Entry<String, List<ScheduledJob>> entry : byName.entrySet()) {
            List<ScheduledJob> jobs = entry.getValue();
            if (jobs.size() < 2)
                continue;

            // List.sort is stable
            List<ScheduledJob> sorted = new ArrayList<>(jobs);
            sorted.sort(NEWEST_FIRST);
            ScheduledJob keep = sorted.get(0);

            List<String> removedIds = new ArrayList<>();
            List<String> failedIds = new ArrayList<>();
            for (ScheduledJob job : sorted.subList(1, sorted.size())) {
                removedIds.add(job.getId());
                if (dryRun) {
                    removed++;
                    continue;
                }
                try {
                    scheduler.remove(job.getId());
                    removed++;
                    log.info("Removed duplicate '{}' ({})", entry.getKey(), job.getId());
                } catch (RemoveFailedException e) {
                    failures++;
                    failedIds.add(job.getId());
                    log.warn("Failed to remove duplicate {}: {}", job.getId(), e.getMessage());
                }
            }
            groups.add(new DedupeReport.DuplicateGroup(entry.getKey(), keep.getId(), removedIds, failedIds));
        }
        return new DedupeReport(dryRun, groups, removed, failures);
    }

    static long ageKey(ScheduledJob job) {
        if (job.getCreatedAtMs() != null && job.getCreatedAtMs() != 0)
            return job.getCreatedAtMs();
        if (job.getUpdatedAtMs() != null && job.getUpdatedAtMs() != 0)
            return job.getUpdatedAtMs();
        return 0L;
    }
}
