package com.cardioclaw.app.dashboard;

import com.cardioclaw.engine.store.JobRow;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Expands cached job schedules into concrete fire times within a window.
 * Cron schedules use the five-field UNIX syntax evaluated in the schedule's
 * zone (UTC when it has none); one-shots contribute their instant when it
 * falls inside the window. Jobs whose schedule cannot be read are skipped.
 */
@Slf4j
public class OccurrenceCalculator {

    static final String ONE_SHOT = "one-shot";
    /** Per-job ceiling so a minutely schedule over a wide window stays bounded. */
    static final int MAX_PER_JOB = 5_000;

    private final CronParser parser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private final ObjectMapper mapper = new ObjectMapper();

    public record Occurrence(String jobId, String jobName, String agent, long timestamp, String schedule) {
    }

    /**
     * @param start exclusive for cron schedules, inclusive for one-shots
     * @param end   inclusive
     */
    public List<Occurrence> occurrences(List<JobRow> jobs, Instant start, Instant end) {
        List<Occurrence> result = new ArrayList<>();
        for (JobRow job : jobs) {
            try {
                JsonNode schedule = mapper.readTree(job.getSchedule() == null ? "{}" : job.getSchedule());
                String kind = schedule.path("kind").asText("");
                if ("cron".equals(kind)) {
                    expandCron(job, schedule, start, end, result);
                } else if ("at".equals(kind)) {
                    Instant at = parseAt(schedule.path("at").asText(null));
                    if (at != null && !at.isBefore(start) && !at.isAfter(end)) {
                        result.add(new Occurrence(job.getId(), job.getName(), job.getAgent(), at.toEpochMilli(), ONE_SHOT));
                    }
                }
            } catch (JsonProcessingException | IllegalArgumentException | DateTimeException e) {
                log.debug("Skipping job {} with unreadable schedule: {}", job.getId(), e.getMessage());
            }
        }
        result.sort(Comparator.comparingLong(Occurrence::timestamp));
        return result;
    }

    private void expandCron(JobRow job, JsonNode schedule, Instant start, Instant end, List<Occurrence> out) {
        String expr = schedule.path("expr").asText("");
        String tz = schedule.path("tz").asText("");
        ZoneId zone = tz.isBlank() ? ZoneOffset.UTC : ZoneId.of(tz);
        ExecutionTime executionTime = ExecutionTime.forCron(parser.parse(expr));

        ZonedDateTime cursor = start.atZone(zone);
        for (int i = 0; i < MAX_PER_JOB; i++) {
            Optional<ZonedDateTime> next = executionTime.nextExecution(cursor);
            if (next.isEmpty() || next.get().toInstant().isAfter(end))
                return;
            cursor = next.get();
            out.add(new Occurrence(job.getId(), job.getName(), job.getAgent(), cursor.toInstant().toEpochMilli(), expr));
        }
        log.debug("Job {} reached {} occurrences; window truncated", job.getId(), MAX_PER_JOB);
    }

    private static Instant parseAt(String raw) {
        if (raw == null || raw.isBlank())
            return null;
        if (raw.chars().allMatch(Character::isDigit))
            return Instant.ofEpochMilli(Long.parseLong(raw));
        return Instant.parse(raw);
    }
}
