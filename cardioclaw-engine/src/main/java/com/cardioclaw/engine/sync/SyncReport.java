package com.cardioclaw.engine.sync;

import com.cardioclaw.engine.discovery.DiscoveryResult;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of a sync: one item per declared heartbeat plus the follow-up passes.
 */
@Value
@Builder
public class SyncReport {

    Path configPath;
    boolean dryRun;
    @Singular
    List<SyncItem> items;
    /** Distinct warnings, e.g. the system-timezone fallback. */
    @Singular
    List<String> warnings;
    /** Null unless a post-sync discovery ran. */
    DiscoveryResult discovery;
    /** Null on dry runs. */
    Housekeeping housekeeping;

    public int created() {
        return count(SyncItem.Action.CREATED) + count(SyncItem.Action.WOULD_CREATE);
    }

    public int replaced() {
        return count(SyncItem.Action.REPLACED) + count(SyncItem.Action.WOULD_REPLACE);
    }

    public int skipped() {
        return count(SyncItem.Action.SKIPPED);
    }

    public int errors() {
        return count(SyncItem.Action.FAILED);
    }

    /**
     * Any failed item fails the whole sync, regardless of what else succeeded.
     */
    public boolean failed() {
        return errors() > 0;
    }

    public String summaryLine() {
        StringBuilder sb = new StringBuilder();
        sb.append(created()).append(" created, ");
        if (replaced() > 0)
            sb.append(replaced()).append(" replaced, ");
        sb.append(skipped()).append(" skipped, ");
        sb.append(errors()).append(" errors");
        return sb.toString();
    }

    private int count(SyncItem.Action action) {
        return (int) items.stream().filter(i -> i.action() == action).count();
    }
}
