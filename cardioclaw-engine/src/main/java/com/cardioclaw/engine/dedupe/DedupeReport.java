package com.cardioclaw.engine.dedupe;

import java.util.List;

/**
 * Outcome of a dedupe pass.
 *
 * @param groups   one entry per name that had more than one job
 * @param removed  duplicates removed, or that would be on a dry run
 * @param failures duplicates whose removal failed
 */
public record DedupeReport(boolean dryRun, List<DuplicateGroup> groups, int removed, int failures) {

    public DedupeReport {
        groups = List.copyOf(groups);
    }

    /**
     * Unique names kept.
     */
    public int kept() {
        return groups.size();
    }

    public boolean failed() {
        return failures > 0;
    }

    /**
     * @param keptId     the newest job, left in place
     * @param removedIds the others, in newest-first order
     * @param failedIds  subset of removedIds whose removal failed
     */
    public record DuplicateGroup(String name, String keptId, List<String> removedIds, List<String> failedIds) {

        public DuplicateGroup {
            removedIds = List.copyOf(removedIds);
            failedIds = List.copyOf(failedIds);
        }

        public int copies() {
            return removedIds.size() + 1;
        }
    }
}
