package com.cardioclaw.engine.discovery;

import java.util.List;

/**
 * Outcome of one discovery pass.
 *
 * @param found        jobs reported by the scheduler
 * @param managed      of those, jobs whose name is declared in the file
 * @param upserted     cache rows written
 * @param runsRecorded new run rows synthesized from last-run snapshots
 * @param evicted      cache rows dropped because the scheduler no longer lists them
 * @param warnings     non-fatal problems, e.g. an unreadable declarative file
 */
public record DiscoveryResult(int found, int managed, int upserted, int runsRecorded, int evicted,
                              List<String> warnings) {

    public DiscoveryResult {
        warnings = List.copyOf(warnings);
    }
}
