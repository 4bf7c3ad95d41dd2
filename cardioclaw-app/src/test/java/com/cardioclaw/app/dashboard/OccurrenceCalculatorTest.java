package com.cardioclaw.app.dashboard;

import com.cardioclaw.app.dashboard.OccurrenceCalculator.Occurrence;
import com.cardioclaw.engine.store.JobRow;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OccurrenceCalculatorTest {

    private final OccurrenceCalculator calculator = new OccurrenceCalculator();

    private static JobRow job(String id, String schedule) {
        return JobRow.builder().id(id).name(id).schedule(schedule).status(JobRow.STATUS_ACTIVE).build();
    }

    @Test
    void cronUsesScheduleZone() {
        List<Occurrence> result = calculator.occurrences(
                List.of(job("berlin", "{\"kind\":\"cron\",\"expr\":\"0 9 * * *\",\"tz\":\"Europe/Berlin\"}")),
                Instant.parse("2026-06-01T00:00:00Z"), Instant.parse("2026-06-02T23:59:59Z"));

        assertEquals(2, result.size());
        // 09:00 CEST
        assertEquals(Instant.parse("2026-06-01T07:00:00Z").toEpochMilli(), result.get(0).timestamp());
    }

    @Test
    void cronWithoutZoneIsUtc() {
        List<Occurrence> result = calculator.occurrences(
                List.of(job("utc", "{\"kind\":\"cron\",\"expr\":\"30 6 * * 1\"}")),
                Instant.parse("2026-06-01T00:00:00Z"), Instant.parse("2026-06-15T00:00:00Z"));

        assertEquals(List.of(Instant.parse("2026-06-01T06:30:00Z").toEpochMilli(),
                        Instant.parse("2026-06-08T06:30:00Z").toEpochMilli()),
                result.stream().map(Occurrence::timestamp).toList());
    }

    @Test
    void oneShotsOnlyInsideWindowAndSorted() {
        List<Occurrence> result = calculator.occurrences(List.of(
                        job("late", "{\"kind\":\"at\",\"at\":\"2026-06-01T20:00:00Z\"}"),
                        job("early", "{\"kind\":\"at\",\"at\":\"1780286400000\"}"),
                        job("outside", "{\"kind\":\"at\",\"at\":\"2026-07-01T00:00:00Z\"}")),
                Instant.parse("2026-06-01T00:00:00Z"), Instant.parse("2026-06-02T00:00:00Z"));

        assertEquals(List.of("early", "late"), result.stream().map(Occurrence::jobId).toList());
        assertEquals(OccurrenceCalculator.ONE_SHOT, result.get(0).schedule());
    }

    @Test
    void unreadableSchedulesAreSkipped() {
        List<Occurrence> result = calculator.occurrences(List.of(
                        job("bad-json", "{not json"),
                        job("bad-cron", "{\"kind\":\"cron\",\"expr\":\"every day\"}"),
                        job("bad-zone", "{\"kind\":\"cron\",\"expr\":\"0 9 * * *\",\"tz\":\"Mars/Base\"}"),
                        job("every", "{\"kind\":\"every\",\"everyMs\":60000}")),
                Instant.parse("2026-06-01T00:00:00Z"), Instant.parse("2026-06-02T00:00:00Z"));

        assertTrue(result.isEmpty());
    }

    @Test
    void denseScheduleIsCapped() {
        List<Occurrence> result = calculator.occurrences(
                List.of(job("minutely", "{\"kind\":\"cron\",\"expr\":\"* * * * *\"}")),
                Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2026-12-31T00:00:00Z"));

        assertEquals(OccurrenceCalculator.MAX_PER_JOB, result.size());
    }
}
