package com.cardioclaw.engine.lifecycle;

import com.cardioclaw.engine.heartbeat.CompletedHeartbeat;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * @param removed entries older than the cutoff (removed, or would be on a dry run)
 * @param kept    entries remaining in the ledger
 * @param written whether the file was rewritten
 */
public record PruneOutcome(Path path, Instant cutoff, List<CompletedHeartbeat> removed, int kept, boolean written) {

    public PruneOutcome {
        removed = List.copyOf(removed);
    }
}
