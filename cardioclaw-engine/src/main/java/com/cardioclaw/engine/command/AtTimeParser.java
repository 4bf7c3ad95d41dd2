package com.cardioclaw.engine.command;

import com.cardioclaw.common.errors.InvalidScheduleException;
import com.cardioclaw.engine.heartbeat.Heartbeat;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing of one-shot schedules.
 * Accepts:
 * <ul>
 * <li>{@code at 2026-03-01 09:30} (localized in the caller's zone)</li>
 * <li>{@code at 2026-03-01T09:30:15} with {@code T} as separator</li>
 * <li>{@code at 2026-03-01 09:30 UTC}, {@code ... Europe/Berlin}, {@code ... PST}</li>
 * <li>{@code at 2026-03-01T09:30:00Z} or with a numeric offset</li>
 * </ul>
 */
public final class AtTimeParser {

    private AtTimeParser() {
    }

    private static final Pattern AT_RE = Pattern.compile(
            "^(\\d{4}-\\d{2}-\\d{2})[ T](\\d{1,2}:\\d{2}(?::\\d{2})?)(?:\\s+(\\S+))?$");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("H:mm[:ss]");

    /**
     * A parsed one-shot: the wall-clock time and the zone fixed by the
     * schedule itself, if any.
     */
    public record AtTime(LocalDateTime local, ZoneId explicitZone, Instant absolute) {

        public boolean hasExplicitZone() {
            return absolute != null || explicitZone != null;
        }

        public Instant toInstant(ZoneId fallback) {
            if (absolute != null)
                return absolute;
            ZoneId zone = explicitZone != null ? explicitZone : fallback;
            return local.atZone(zone).toInstant();
        }
    }

    public static boolean isOneShot(String schedule) {
        return schedule != null && schedule.startsWith(Heartbeat.ONE_SHOT_PREFIX);
    }

    /**
     * @throws InvalidScheduleException if the text is not a supported one-shot
     *                                  format
     */
    public static AtTime parse(String schedule) {
        if (!isOneShot(schedule)) {
            throw new InvalidScheduleException("Not a one-shot schedule: " + schedule);
        }
        String raw = schedule.substring(Heartbeat.ONE_SHOT_PREFIX.length()).trim();

        Matcher m = AT_RE.matcher(raw);
        if (m.matches()) {
            LocalDateTime local;
            try {
                local = LocalDateTime.of(LocalDate.parse(m.group(1)), LocalTime.parse(m.group(2), TIME));
            } catch (DateTimeParseException e) {
                throw new InvalidScheduleException("Invalid date/time in schedule '" + schedule + "'", e);
            }
            String suffix = m.group(3);
            return new AtTime(local, suffix == null ? null : parseSuffix(suffix, schedule), null);
        }

        try {
            return new AtTime(null, null, Instant.parse(normalizeIso(raw)));
        } catch (DateTimeParseException e) {
            throw new InvalidScheduleException("Cannot parse one-shot schedule '" + schedule
                    + "' (expected: at YYYY-MM-DD HH:MM [TZ])", e);
        }
    }

    public static Instant resolve(String schedule, ZoneId zone) {
        return parse(schedule).toInstant(zone);
    }

    public static String toIso(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }

    private static ZoneId parseSuffix(String suffix, String schedule) {
        String upper = suffix.toUpperCase(Locale.ROOT);
        if (upper.equals("UTC") || upper.equals("Z") || upper.equals("GMT"))
            return ZoneOffset.UTC;
        try {
            return ZoneId.of(suffix, ZoneId.SHORT_IDS);
        } catch (DateTimeException e) {
            throw new InvalidScheduleException("Unknown timezone '" + suffix + "' in schedule '" + schedule + "'", e);
        }
    }

    private static String normalizeIso(String raw) {
        // 2026-03-01T09:30:00+0100 -> +01:00
        return raw.replaceFirst("([+-]\\d{2})(\\d{2})$", "$1:$2");
    }
}
