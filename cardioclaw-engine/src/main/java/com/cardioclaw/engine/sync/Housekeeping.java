package com.cardioclaw.engine.sync;

import com.cardioclaw.engine.lifecycle.ArchiveResult;
import com.cardioclaw.engine.store.RunPruneResult;

import java.util.List;

/**
 * Best-effort work done after a sync. Problems are collected as warnings and
 * never fail the sync.
 *
 * @param archive  null when archiving did not run
 * @param runPrune null when run pruning did not run or failed
 */
public record Housekeeping(ArchiveResult archive, RunPruneResult runPrune, List<String> warnings) {

    public Housekeeping {
        warnings = List.copyOf(warnings);
    }

    public int archived() {
        return archive == null ? 0 : archive.archived();
    }
}
