package com.cardioclaw.engine.scheduler;

import com.cardioclaw.common.errors.ExternalQueryException;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.PayloadKind;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.ScheduleKind;
import com.cardioclaw.engine.scheduler.ScheduledJobTypes.ScheduledJob;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobListParserTest {

    private static final String LISTING = """
            [warn] plugin registry is stale
            {
              "jobs": [
                {
                  "id": "a1",
                  "name": "Standup",
                  "enabled": true,
                  "createdAtMs": 1700000000000,
                  "schedule": {"kind": "cron", "expr": "0 9 * * *", "tz": "Europe/Berlin"},
                  "sessionTarget": "isolated",
                  "payload": {"kind": "agentTurn", "message": "standup", "agentId": "ops"},
                  "delivery": {"mode": "announce", "channel": "slack"},
                  "state": {"nextRunAtMs": 1700003600000, "lastRunAtMs": 1700000100000,
                            "lastRunStatus": "error", "lastRunError": "boom", "lastDurationMs": 900},
                  "somethingNew": {"nested": true}
                },
                {"name": "no id"},
                {"id": "b2", "name": "Ping", "enabled": false,
                 "schedule": {"kind": "at", "at": "2026-01-01T09:00:00Z"},
                 "payload": {"kind": "systemEvent", "text": "ping"}}
              ]
            }
            """;

    @Test
    void parse_skipsWarningPrefixAndUnknownFields() {
        List<ScheduledJob> jobs = JobListParser.parse(LISTING);

        assertEquals(2, jobs.size());
        ScheduledJob standup = jobs.get(0);
        assertEquals("a1", standup.getId());
        assertTrue(standup.isEnabled());
        assertEquals(ScheduleKind.CRON, standup.getSchedule().getKind());
        assertEquals("0 9 * * *", standup.getSchedule().getExpr());
        assertEquals(PayloadKind.AGENT_TURN, standup.getPayload().getKind());
        assertEquals("ops", standup.resolveAgent());
        assertEquals("slack", standup.getDelivery().getChannel());
    }

    @Test
    void parse_acceptsLegacyStateFieldNames() {
        ScheduledJob standup = JobListParser.parse(LISTING).get(0);

        assertEquals("error", standup.getState().getLastStatus());
        assertEquals("boom", standup.getState().getLastError());
        assertEquals(900L, standup.getState().getLastDurationMs());
        assertTrue(standup.lastRunErrored());
    }

    @Test
    void parse_oneShotWithoutState() {
        ScheduledJob ping = JobListParser.parse(LISTING).get(1);

        assertFalse(ping.isEnabled());
        assertEquals(ScheduleKind.AT, ping.getSchedule().getKind());
        assertNull(ping.getState());
        assertFalse(ping.lastRunErrored());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "   ", "error: gateway not running", "{ not json", "{\"items\": []}" })
    void parse_rejectsUnusableOutput(String output) {
        assertThrows(ExternalQueryException.class, () -> JobListParser.parse(output));
    }

    @Test
    void parse_emptyJobList() {
        assertTrue(JobListParser.parse("{\"jobs\": []}").isEmpty());
    }
}
