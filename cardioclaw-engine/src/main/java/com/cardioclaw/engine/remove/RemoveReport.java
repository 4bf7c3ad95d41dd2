package com.cardioclaw.engine.remove;

import java.nio.file.Path;
import java.util.List;

/**
 * @param removedJobIds   scheduler jobs removed (or that would be on a dry run)
 * @param failedJobIds    scheduler jobs whose removal failed
 * @param configPath      the declarative file consulted, or null if none was found
 * @param removedFromFile whether a matching heartbeat was found in the file
 * @param fileError       why the file could not be updated, if it could not
 */
public record RemoveReport(String name, boolean dryRun, List<String> removedJobIds, List<String> failedJobIds,
                           Path configPath, boolean removedFromFile, String fileError) {

    public RemoveReport {
        removedJobIds = List.copyOf(removedJobIds);
        failedJobIds = List.copyOf(failedJobIds);
    }

    public boolean failed() {
        return !failedJobIds.isEmpty() || fileError != null;
    }

    public boolean foundAnything() {
        return !removedJobIds.isEmpty() || !failedJobIds.isEmpty() || removedFromFile;
    }
}
