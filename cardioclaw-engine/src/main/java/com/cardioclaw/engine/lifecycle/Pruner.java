package com.cardioclaw.engine.lifecycle;

import com.cardioclaw.common.errors.UsageException;
import com.cardioclaw.engine.heartbeat.CompletedHeartbeat;
import com.cardioclaw.engine.heartbeat.HeartbeatFile;
import com.cardioclaw.engine.heartbeat.HeartbeatFileStore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Removes old entries from the completed ledger.
 */
@Slf4j
public class Pruner {

    private static final Pattern DATE_RE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private final HeartbeatFileStore fileStore;
    private final Clock clock;

    public Pruner(HeartbeatFileStore fileStore, Clock clock) {
        this.fileStore = fileStore;
        this.clock = clock;
    }

    /**
     * Drop ledger entries whose {@code executed_at} is strictly before the
     * cutoff. Entries without a parseable {@code executed_at} are kept.
     *
     * @throws UsageException if the request does not name exactly one valid
     *                        threshold
     */
    public PruneOutcome prune(Path path, PruneRequest request) {
        return prune(path, request, preview -> { });
    }

    /**
     * Same as {@link #prune(Path, PruneRequest)}, handing the entries selected
     * for removal to {@code preview} before the file is rewritten. The preview
     * is not called when nothing matches the cutoff.
     */
    public PruneOutcome prune(Path path, PruneRequest request, Consumer<PruneOutcome> preview) {
        validate(request);
        HeartbeatFile file = fileStore.load(path);
        Instant cutoff = cutoff(request, file.defaults().timezone());

        List<JsonNode> kept = new ArrayList<>();
        List<CompletedHeartbeat> removed = new ArrayList<>();
        for (JsonNode node : file.completedNodes()) {
            CompletedHeartbeat entry = CompletedHeartbeat.fromNode(node);
            Instant executedAt = parseExecutedAt(entry.getExecutedAt());
            if (executedAt != null && executedAt.isBefore(cutoff)) {
                removed.add(entry);
            } else {
                kept.add(node);
            }
        }

        PruneOutcome planned = new PruneOutcome(path, cutoff, removed, kept.size(), false);
        if (removed.isEmpty())
            return planned;
        preview.accept(planned);
        if (request.dryRun())
            return planned;

        file.replaceCompleted(kept);
        fileStore.save(file);
        log.info("Removed {} completed one-shot(s) from {}", removed.size(), path);
        return new PruneOutcome(path, cutoff, removed, kept.size(), true);
    }

    public static void validate(PruneRequest request) {
        boolean hasDays = request.days() != null;
        boolean hasBefore = request.before() != null && !request.before().isBlank();
        if (hasDays == hasBefore) {
            throw new UsageException("Must provide exactly one of --days or --before");
        }
        if (hasDays && request.days() < 0) {
            throw new UsageException("Invalid value for --days. Must be a non-negative number");
        }
    }

    Instant cutoff(PruneRequest request, String defaultTimezone) {
        if (request.days() != null) {
            return clock.instant().minus(Duration.ofDays(request.days()));
        }
        String raw = request.before().trim();
        try {
            if (DATE_RE.matcher(raw).matches()) {
                return LocalDate.parse(raw).atStartOfDay(zoneOrUtc(defaultTimezone)).toInstant();
            }
            return parseInstant(raw);
        } catch (DateTimeException e) {
            throw new UsageException("Invalid date format for --before. Use YYYY-MM-DD");
        }
    }

    private static ZoneId zoneOrUtc(String zone) {
        if (zone == null)
            return ZoneOffset.UTC;
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            log.warn("Unknown defaults.timezone '{}'; using UTC for --before", zone);
            return ZoneOffset.UTC;
        }
    }

    static Instant parseExecutedAt(String raw) {
        if (raw == null || raw.isBlank())
            return null;
        try {
            String value = raw.trim();
            if (DATE_RE.matcher(value).matches())
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            return parseInstant(value);
        } catch (DateTimeException e) {
            log.debug("Unparseable executed_at '{}'", raw);
            return null;
        }
    }

    private static Instant parseInstant(String raw) {
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            return OffsetDateTime.parse(raw).toInstant();
        }
    }
}
