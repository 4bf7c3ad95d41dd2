package com.cardioclaw.engine.lifecycle;

/**
 * Exactly one of {@code days} or {@code before} must be given.
 *
 * @param days   age threshold in days
 * @param before {@code YYYY-MM-DD} or an ISO-8601 instant
 */
public record PruneRequest(Integer days, String before, boolean dryRun) {

    public static PruneRequest olderThanDays(int days) {
        return new PruneRequest(days, null, false);
    }

    public static PruneRequest before(String date) {
        return new PruneRequest(null, date, false);
    }

    public PruneRequest asDryRun() {
        return new PruneRequest(days, before, true);
    }
}
