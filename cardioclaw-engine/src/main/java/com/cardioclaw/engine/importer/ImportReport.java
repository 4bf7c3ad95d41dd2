package com.cardioclaw.engine.importer;

import com.cardioclaw.engine.heartbeat.Heartbeat;

import java.nio.file.Path;
import java.util.List;

/**
 * @param added         heartbeats appended (or that would be on a dry run)
 * @param alreadyListed job names skipped because the file already declares them
 * @param unconvertible jobs (by name, or id when unnamed) that could not be expressed as heartbeats
 * @param written       whether the file was written
 */
public record ImportReport(Path target, int found, List<Heartbeat> added, List<String> alreadyListed,
                           List<String> unconvertible, boolean written) {

    public ImportReport {
        added = List.copyOf(added);
        alreadyListed = List.copyOf(alreadyListed);
        unconvertible = List.copyOf(unconvertible);
    }
}
