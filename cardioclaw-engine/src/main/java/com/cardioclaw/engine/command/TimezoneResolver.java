package com.cardioclaw.engine.command;

import com.cardioclaw.common.config.OpenClawSettings;
import com.cardioclaw.common.errors.InvalidScheduleException;
import com.cardioclaw.engine.heartbeat.HeartbeatDefaults;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Picks the zone for a heartbeat: its own {@code tz}, then the file default,
 * then the OpenClaw system config, then the JVM's zone. Falling through to the
 * JVM zone produces a warning on the returned resolution; nothing is printed
 * here, so callers decide how often to surface it.
 */
@Slf4j
public class TimezoneResolver {

    private final Supplier<Optional<String>> openclawTimezone;
    private final ZoneId systemZone;

    public TimezoneResolver(OpenClawSettings settings) {
        this(settings::timezone, ZoneId.systemDefault());
    }

    public TimezoneResolver(Supplier<Optional<String>> openclawTimezone, ZoneId systemZone) {
        this.openclawTimezone = openclawTimezone;
        this.systemZone = systemZone;
    }

    /**
     * @throws InvalidScheduleException if the heartbeat or file default names
     *                                  an unknown zone
     */
    public TimezoneResolution resolve(String heartbeatTz, HeartbeatDefaults defaults) {
        if (heartbeatTz != null && !heartbeatTz.isBlank()) {
            return new TimezoneResolution(parseZone(heartbeatTz, "tz"),
                    TimezoneResolution.Source.HEARTBEAT, null);
        }
        String fileDefault = defaults != null ? defaults.timezone() : null;
        if (fileDefault != null && !fileDefault.isBlank()) {
            return new TimezoneResolution(parseZone(fileDefault, "defaults.timezone"),
                    TimezoneResolution.Source.FILE_DEFAULT, null);
        }
        Optional<String> configured = openclawTimezone.get();
        if (configured.isPresent()) {
            try {
                return new TimezoneResolution(ZoneId.of(configured.get().trim()),
                        TimezoneResolution.Source.OPENCLAW_CONFIG, null);
            } catch (DateTimeException e) {
                log.warn("Ignoring unknown timezone '{}' in OpenClaw config", configured.get());
            }
        }
        String warning = "No timezone configured; using system timezone " + systemZone.getId()
                + ". Set defaults.timezone in cardioclaw.yaml to silence this warning.";
        return new TimezoneResolution(systemZone, TimezoneResolution.Source.SYSTEM, warning);
    }

    public ZoneId systemZone() {
        return systemZone;
    }

    private static ZoneId parseZone(String raw, String field) {
        try {
            return ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            throw new InvalidScheduleException("Unknown timezone '" + raw + "' in " + field, e);
        }
    }
}
