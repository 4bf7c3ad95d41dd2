package com.cardioclaw.engine.scheduler;

import com.cardioclaw.common.errors.CreateFailedException;
import com.cardioclaw.common.errors.ExternalQueryException;
import com.cardioclaw.common.errors.RemoveFailedException;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.JobPayload;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.JobSchedule;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.JobState;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.PayloadKind;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.ScheduleKind;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.ScheduledJob;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * In-memory scheduler for tests. {@link #create(List)} reads {@code --name},
 * {@code --cron} and {@code --at} from the argument vector and stores a job.
 */
public class FakeSchedulerClient implements SchedulerClient {

    private final List<ScheduledJob> jobs = new ArrayList<>();
    private final List<List<String>> createCalls = new ArrayList<>();
    private final List<String> removeCalls = new ArrayList<>();
    private final Set<String> failingRemovals = new HashSet<>();
    private boolean listFails;
    private boolean createFails;
    private int nextId = 1;
    private long nextCreatedAt = 1_700_000_000_000L;

    public FakeSchedulerClient add(ScheduledJob job) {
        jobs.add(job);
        return this;
    }

    public List<ScheduledJob> jobs() {
        return jobs;
    }

    public long countNamed(String name) {
        return jobs.stream().filter(j -> name.equals(j.getName())).count();
    }

    public List<List<String>> createCalls() {
        return createCalls;
    }

    public List<String> removeCalls() {
        return removeCalls;
    }

    public void failList(boolean fail) {
        this.listFails = fail;
    }

    public void failCreate(boolean fail) {
        this.createFails = fail;
    }

    public void failRemovalOf(String id) {
        failingRemovals.add(id);
    }

    @Override
    public List<ScheduledJob> list() {
        if (listFails)
            throw new ExternalQueryException("openclaw cron list exited 1: gateway unreachable");
        return new ArrayList<>(jobs);
    }

    @Override
    public void create(List<String> args) {
        createCalls.add(List.copyOf(args));
        if (createFails)
            throw new CreateFailedException("gateway rejected job");
        JobSchedule.JobScheduleBuilder schedule = JobSchedule.builder();
        String at = argAfter(args, "--at");
        if (at != null) {
            schedule.kind(ScheduleKind.AT).at(at);
        } else {
            schedule.kind(ScheduleKind.CRON).expr(argAfter(args, "--cron")).tz(argAfter(args, "--tz"));
        }
        String prompt = argAfter(args, "--message");
        JobPayload payload = prompt != null
                ? JobPayload.builder().kind(PayloadKind.AGENT_TURN).message(prompt).build()
                : JobPayload.builder().kind(PayloadKind.SYSTEM_EVENT).text(argAfter(args, "--system-event")).build();
        jobs.add(ScheduledJob.builder()
                .id("job-" + nextId++)
                .name(argAfter(args, "--name"))
                .enabled(true)
                .createdAtMs(nextCreatedAt++)
                .schedule(schedule.build())
                .sessionTarget(argAfter(args, "--session"))
                .payload(payload)
                .state(new JobState())
                .build());
    }

    @Override
    public void remove(String jobId) {
        removeCalls.add(jobId);
        if (failingRemovals.contains(jobId))
            throw new RemoveFailedException(jobId, "permission denied");
        jobs.removeIf(j -> jobId.equals(j.getId()));
    }

    private static String argAfter(List<String> args, String flag) {
        int i = args.indexOf(flag);
        return i >= 0 && i + 1 < args.size() ? args.get(i + 1) : null;
    }

    // ---- fixtures ----

    public static ScheduledJob cronJob(String id, String name, String expr) {
        return ScheduledJob.builder()
                .id(id)
                .name(name)
                .enabled(true)
                .schedule(JobSchedule.builder().kind(ScheduleKind.CRON).expr(expr).tz("UTC").build())
                .payload(JobPayload.builder().kind(PayloadKind.AGENT_TURN).message("do " + name).build())
                .state(new JobState())
                .build();
    }

    public static ScheduledJob oneShot(String id, String name, String isoAt, boolean enabled) {
        return ScheduledJob.builder()
                .id(id)
                .name(name)
                .enabled(enabled)
                .deleteAfterRun(true)
                .schedule(JobSchedule.builder().kind(ScheduleKind.AT).at(isoAt).build())
                .payload(JobPayload.builder().kind(PayloadKind.SYSTEM_EVENT).text("remind " + name).build())
                .state(new JobState())
                .build();
    }
}
