package com.cardioclaw.engine.sync;

/**
 * @param dryRun               report would-be commands without mutating anything
 * @param force                replace jobs that already exist under the same name
 * @param tolerateQueryFailure treat a failed existing-jobs query as an empty
 *                             listing instead of aborting
 */
public record SyncOptions(boolean dryRun, boolean force, boolean tolerateQueryFailure) {

    public static SyncOptions defaults() {
        return new SyncOptions(false, false, false);
    }

    public SyncOptions withDryRun(boolean dryRun) {
        return new SyncOptions(dryRun, force, tolerateQueryFailure);
    }

    public SyncOptions withForce(boolean force) {
        return new SyncOptions(dryRun, force, tolerateQueryFailure);
    }

    public SyncOptions withTolerateQueryFailure(boolean tolerate) {
        return new SyncOptions(dryRun, force, tolerate);
    }
}
