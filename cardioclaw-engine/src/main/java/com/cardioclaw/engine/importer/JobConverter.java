package com.cardioclaw.engine.importer;

import com.cardioclaw.engine.heartbeat.Heartbeat;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.JobDelivery;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.JobPayload;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.JobSchedule;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.PayloadKind;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.ScheduledJob;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Maps an external job back to the declarative form.
 */
public final class JobConverter {

    private JobConverter() {
    }

    static final String DEFAULT_CHANNEL = "telegram";

    private static final DateTimeFormatter AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final long HOUR_MS = 60 * 60 * 1000L;
    private static final long MINUTE_MS = 60 * 1000L;

    /**
     * @param zone zone used to render one-shot instants as wall-clock time
     * @return empty when the job has no usable schedule or payload
     */
    public static Optional<Heartbeat> toHeartbeat(ScheduledJob job, ZoneId zone) {
        Heartbeat.HeartbeatBuilder hb = Heartbeat.builder().name(job.getName());

        String schedule = schedule(job.getSchedule(), zone);
        if (schedule == null)
            return Optional.empty();
        hb.schedule(schedule);

        JobPayload payload = job.getPayload();
        if (payload == null || payload.getKind() == null)
            return Optional.empty();
        if (payload.getKind() == PayloadKind.AGENT_TURN) {
            if (!hasText(payload.getMessage()))
                return Optional.empty();
            hb.prompt(payload.getMessage());
            if (hasText(payload.getModel()))
                hb.model(payload.getModel());
        } else {
            if (!hasText(payload.getText()))
                return Optional.empty();
            hb.message(payload.getText());
            hb.sessionTarget(Heartbeat.SESSION_MAIN);
        }

        JobDelivery delivery = job.getDelivery();
        if (delivery != null && "announce".equals(delivery.getMode())) {
            hb.delivery(hasText(delivery.getChannel()) ? delivery.getChannel() : DEFAULT_CHANNEL);
        }
        if (Heartbeat.SESSION_MAIN.equals(job.getSessionTarget())) {
            hb.sessionTarget(Heartbeat.SESSION_MAIN);
        }
        return Optional.of(hb.build());
    }

    static String schedule(JobSchedule schedule, ZoneId zone) {
        if (schedule == null || schedule.getKind() == null)
            return null;
        switch (schedule.getKind()) {
            case CRON:
                return hasText(schedule.getExpr()) ? schedule.getExpr() : null;
            case AT:
                Instant at = parseAt(schedule.getAt());
                return at == null ? null : Heartbeat.ONE_SHOT_PREFIX + AT_FORMAT.format(at.atZone(zone));
            case EVERY:
                return every(schedule.getEveryMs());
            default:
                return null;
        }
    }

    /**
     * Approximates an interval as a cron expression: whole hours when at least
     * an hour, otherwise minutes.
     */
    static String every(Long everyMs) {
        if (everyMs == null || everyMs <= 0)
            return null;
        if (everyMs >= HOUR_MS) {
            return "0 */" + Math.round((double) everyMs / HOUR_MS) + " * * *";
        }
        long minutes = Math.max(1, Math.round((double) everyMs / MINUTE_MS));
        return "*/" + minutes + " * * * *";
    }

    private static Instant parseAt(String raw) {
        if (raw == null || raw.isBlank())
            return null;
        String value = raw.trim();
        try {
            if (value.chars().allMatch(Character::isDigit))
                return Instant.ofEpochMilli(Long.parseLong(value));
            return Instant.parse(value);
        } catch (DateTimeException | NumberFormatException e) {
            return null;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
