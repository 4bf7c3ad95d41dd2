package com.cardioclaw.engine.command;

import com.cardioclaw.common.errors.InvalidScheduleException;
import com.cardioclaw.common.errors.MissingPayloadException;
import com.cardioclaw.engine.heartbeat.Heartbeat;
import com.cardioclaw.engine.heartbeat.HeartbeatDefaults;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Translates a declared heartbeat into the argument vector of
 * {@code openclaw cron add}.
 */
public class CommandBuilder {

    private final TimezoneResolver timezoneResolver;

    public CommandBuilder(TimezoneResolver timezoneResolver) {
        this.timezoneResolver = timezoneResolver;
    }

    /**
     * @throws InvalidScheduleException if a one-shot time or a zone cannot be
     *                                  parsed
     * @throws MissingPayloadException  if neither prompt nor message is set
     */
    public CronCommand build(Heartbeat hb, HeartbeatDefaults defaults) {
        List<String> args = new ArrayList<>();
        args.add("cron");
        args.add("add");
        args.add("--name");
        args.add(hb.getName());

        TimezoneResolution resolution = null;
        String schedule = hb.getSchedule() == null ? "" : hb.getSchedule().trim();
        if (hb.isOneShot()) {
            AtTimeParser.AtTime at = AtTimeParser.parse(schedule);
            if (!at.hasExplicitZone()) {
                resolution = timezoneResolver.resolve(hb.getTz(), defaults);
            }
            Instant instant = at.toInstant(resolution != null ? resolution.zone() : null);
            args.add("--at");
            args.add(AtTimeParser.toIso(instant));
        } else {
            if (schedule.isEmpty()) {
                throw new InvalidScheduleException("Empty schedule for '" + hb.getName() + "'");
            }
            resolution = timezoneResolver.resolve(hb.getTz(), defaults);
            args.add("--cron");
            args.add(schedule);
            args.add("--tz");
            args.add(resolution.zoneId());
        }

        if (Heartbeat.hasText(hb.getPrompt())) {
            args.add("--message");
            args.add(hb.getPrompt());
        } else if (Heartbeat.hasText(hb.getMessage())) {
            args.add("--system-event");
            args.add(hb.getMessage());
        } else {
            throw new MissingPayloadException("Heartbeat '" + hb.getName() + "' has neither prompt nor message");
        }

        String session = hb.effectiveSessionTarget();
        args.add("--session");
        args.add(session);

        if (Heartbeat.SESSION_ISOLATED.equals(session)) {
            String delivery = hb.getDelivery() == null ? "" : hb.getDelivery().trim();
            if (delivery.isEmpty() || Heartbeat.DELIVERY_NONE.equals(delivery)) {
                args.add("--no-deliver");
            } else {
                args.add("--announce");
                args.add("--channel");
                args.add(delivery);
            }
        }

        if (Heartbeat.hasText(hb.getModel())) {
            args.add("--model");
            args.add(hb.getModel());
        }

        if (hb.shouldDeleteAfterRun()) {
            args.add("--delete-after-run");
        }
        return new CronCommand(args, resolution);
    }
}
