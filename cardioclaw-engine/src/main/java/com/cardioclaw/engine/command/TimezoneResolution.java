package com.cardioclaw.engine.command;

import java.time.ZoneId;

/**
 * Outcome of timezone resolution: the zone, where it came from, and a warning
 * when nothing was configured and the system zone had to be used.
 */
public record TimezoneResolution(ZoneId zone, Source source, String warning) {

    public enum Source {
        HEARTBEAT,
        FILE_DEFAULT,
        OPENCLAW_CONFIG,
        SYSTEM
    }

    public String zoneId() {
        return zone.getId();
    }

    public boolean hasWarning() {
        return warning != null;
    }
}
