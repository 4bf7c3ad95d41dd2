package com.cardioclaw.engine.store;

/**
 * Per-job aggregate over a trailing window of runs.
 */
public record RunSummary(String jobName, long totalRuns, long successfulRuns, Double avgDurationMs) {

    /**
     * Percentage of successful runs, 0 when there are none.
     */
    public double successRatePercent() {
        return totalRuns == 0 ? 0.0 : successfulRuns * 100.0 / totalRuns;
    }
}
