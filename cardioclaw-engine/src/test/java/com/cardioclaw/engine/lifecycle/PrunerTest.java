package com.cardioclaw.engine.lifecycle;

import com.cardioclaw.common.errors.UsageException;
import com.cardioclaw.engine.heartbeat.HeartbeatFileStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PrunerTest {

    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");

    @TempDir
    Path tmp;

    private final HeartbeatFileStore fileStore = new HeartbeatFileStore();
    private final Pruner pruner = new Pruner(fileStore, Clock.fixed(NOW, ZoneOffset.UTC));

    private Path ledger(String defaults, Instant... executedAt) throws Exception {
        StringBuilder yaml = new StringBuilder(defaults).append("heartbeats: []\nheartbeats_completed:\n");
        for (int i = 0; i < executedAt.length; i++) {
            yaml.append("  - name: job").append(i).append('\n')
                    .append("    schedule: at 2026-01-01 09:00\n")
                    .append("    message: m\n")
                    .append("    executed_at: \"").append(executedAt[i]).append("\"\n")
                    .append("    status: ok\n");
        }
        yaml.append("  - name: undated\n    schedule: at 2020-01-01 09:00\n    message: m\n");
        return Files.writeString(tmp.resolve("cardioclaw.yaml"), yaml.toString());
    }

    @Test
    void daysCutoffIsStrict() throws Exception {
        Instant cutoff = NOW.minus(Duration.ofDays(30));
        Path path = ledger("", cutoff.minusSeconds(1), cutoff.plusSeconds(1));

        PruneOutcome outcome = pruner.prune(path, PruneRequest.olderThanDays(30));

        assertEquals(cutoff, outcome.cutoff());
        assertEquals(1, outcome.removed().size());
        assertEquals("job0", outcome.removed().get(0).getName());
        assertEquals(2, outcome.kept());
        assertTrue(outcome.written());
        assertEquals(2, fileStore.load(path).completed().size());
    }

    @Test
    void dryRunWritesNothing() throws Exception {
        Path path = ledger("", NOW.minus(Duration.ofDays(400)));
        String before = Files.readString(path);

        PruneOutcome outcome = pruner.prune(path, PruneRequest.olderThanDays(30).asDryRun());

        assertEquals(1, outcome.removed().size());
        assertFalse(outcome.written());
        assertEquals(before, Files.readString(path));
    }

    @Test
    void beforeDateUsesFileTimezone() throws Exception {
        // 2026-03-01 00:00 in New York is 05:00Z
        Path path = ledger("defaults:\n  timezone: America/New_York\n",
                Instant.parse("2026-03-01T04:59:59Z"), Instant.parse("2026-03-01T05:00:00Z"));

        PruneOutcome outcome = pruner.prune(path, PruneRequest.before("2026-03-01"));

        assertEquals(Instant.parse("2026-03-01T05:00:00Z"), outcome.cutoff());
        assertEquals(1, outcome.removed().size());
    }

    @Test
    void beforeAcceptsInstant() throws Exception {
        Path path = ledger("", Instant.parse("2026-03-01T04:59:59Z"));

        PruneOutcome outcome = pruner.prune(path, PruneRequest.before("2026-03-01T05:00:00Z"));

        assertEquals(1, outcome.removed().size());
    }

    @Test
    void undatedEntriesAreAlwaysKept() throws Exception {
        Path path = ledger("");

        PruneOutcome outcome = pruner.prune(path, PruneRequest.olderThanDays(0));

        assertTrue(outcome.removed().isEmpty());
        assertEquals(1, outcome.kept());
    }

    @Test
    void requestValidation() throws Exception {
        Path path = ledger("");

        assertThrows(UsageException.class, () -> pruner.prune(path, new PruneRequest(null, null, false)));
        assertThrows(UsageException.class, () -> pruner.prune(path, new PruneRequest(5, "2026-01-01", false)));
        assertThrows(UsageException.class, () -> pruner.prune(path, PruneRequest.olderThanDays(-1)));
        assertThrows(UsageException.class, () -> pruner.prune(path, PruneRequest.before("last tuesday")));
    }

    @Test
    void previewSeesSelectionBeforeFileIsRewritten() throws Exception {
        Path path = ledger("", NOW.minus(Duration.ofDays(400)));
        String original = Files.readString(path);
        List<String> fileAtPreview = new ArrayList<>();

        PruneOutcome outcome = pruner.prune(path, PruneRequest.olderThanDays(30), planned -> {
            assertEquals(1, planned.removed().size());
            assertFalse(planned.written());
            try {
                fileAtPreview.add(Files.readString(path));
            } catch (IOException e) {
                throw new AssertionError(e);
            }
        });

        assertTrue(outcome.written());
        assertEquals(List.of(original), fileAtPreview);
        assertNotEquals(original, Files.readString(path));
    }

    @Test
    void previewSkippedWhenNothingMatches() throws Exception {
        Path path = ledger("", NOW.minus(Duration.ofDays(1)));
        List<PruneOutcome> previews = new ArrayList<>();

        PruneOutcome outcome = pruner.prune(path, PruneRequest.olderThanDays(30), previews::add);

        assertTrue(outcome.removed().isEmpty());
        assertTrue(previews.isEmpty());
    }

    @Test
    void negativeDaysMessage() {
        UsageException e = assertThrows(UsageException.class,
                () -> Pruner.validate(PruneRequest.olderThanDays(-1)));
        assertEquals("Invalid value for --days. Must be a non-negative number", e.getMessage());
    }
}
