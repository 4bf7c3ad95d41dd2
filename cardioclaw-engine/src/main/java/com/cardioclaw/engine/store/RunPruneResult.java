package com.cardioclaw.engine.store;

/**
 * @param deletedOld    rows removed for being older than the window
 * @param deletedExcess rows removed beyond the per-job cap
 */
public record RunPruneResult(int deletedOld, int deletedExcess) {

    public int total() {
        return deletedOld + deletedExcess;
    }
}
