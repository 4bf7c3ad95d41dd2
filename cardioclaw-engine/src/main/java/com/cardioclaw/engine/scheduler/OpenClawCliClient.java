package com.cardioclaw.engine.scheduler;

import com.cardioclaw.common.errors.CreateFailedException;
import com.cardioclaw.common.errors.ExternalQueryException;
import com.cardioclaw.common.errors.RemoveFailedException;
import com.cardioclaw.common.infra.ProcessRunner;
import com.cardioclaw.common.infra.ProcessRunner.ExecResult;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.ScheduledJob;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link SchedulerClient} backed by the {@code openclaw} command-line tool.
 */
@Slf4j
public class OpenClawCliClient implements SchedulerClient {

    public static final String DEFAULT_BINARY = "openclaw";

    private final ProcessRunner runner;
    private final String binary;

    public OpenClawCliClient(ProcessRunner runner, String binary) {
        this.runner = runner;
        this.binary = binary;
    }

    public String getBinary() {
        return binary;
    }

    @Override
    public List<ScheduledJob> list() {
        ExecResult result;
        try {
            result = runner.run(List.of(binary, "cron", "list", "--json"));
        } catch (IOException e) {
            throw new ExternalQueryException("Failed to run " + binary + " cron list: " + e.getMessage(), e);
        }
        if (!result.ok()) {
            throw new ExternalQueryException(binary + " cron list failed: " + result.diagnostics());
        }
        List<ScheduledJob> jobs = JobListParser.parse(result.stdout());
        log.debug("Listed {} scheduler job(s)", jobs.size());
        return jobs;
    }

    @Override
    public void create(List<String> args) {
        List<String> command = new ArrayList<>(args.size() + 1);
        command.add(binary);
        command.addAll(args);
        ExecResult result;
        try {
            result = runner.run(command);
        } catch (IOException e) {
            throw new CreateFailedException("Failed to run " + binary + ": " + e.getMessage(), e);
        }
        if (!result.ok()) {
            throw new CreateFailedException(result.diagnostics());
        }
    }

    @Override
    public void remove(String jobId) {
        ExecResult result;
        try {
            result = runner.run(List.of(binary, "cron", "remove", jobId));
        } catch (IOException e) {
            throw new RemoveFailedException(jobId, "Failed to run " + binary + ": " + e.getMessage(), e);
        }
        if (!result.ok()) {
            throw new RemoveFailedException(jobId, "Failed to remove job " + jobId + ": " + result.diagnostics());
        }
        log.debug("Removed scheduler job {}", jobId);
    }
}
