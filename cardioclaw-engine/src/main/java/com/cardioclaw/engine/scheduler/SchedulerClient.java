package com.cardioclaw.engine.scheduler;

import com.cardioclaw.common.errors.CreateFailedException;
import com.cardioclaw.common.errors.ExternalQueryException;
import com.cardioclaw.common.errors.RemoveFailedException;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.ScheduledJob;

import java.util.List;

/**
 * The external scheduler as an injected capability. The scheduler is the
 * single source of truth for job definitions and their latest run.
 */
public interface SchedulerClient {

    /**
     * Full current job listing.
     *
     * @throws ExternalQueryException if the scheduler cannot be reached or
     *                                answers with something other than a listing
     */
    List<ScheduledJob> list();

    /**
     * Create a job from a {@code cron add ...} argument vector.
     *
     * @throws CreateFailedException carrying the scheduler's diagnostics
     */
    void create(List<String> args);

    /**
     * Remove one job by id.
     *
     * @throws RemoveFailedException carrying the scheduler's diagnostics
     */
    void remove(String jobId);
}
