package com.cardioclaw.engine.store;

import com.cardioclaw.common.errors.CacheReadException;
import com.cardioclaw.common.errors.CacheWriteException;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Queries and writes against the job cache. Every public call opens and closes
 * its own connection; multi-statement writes go through
 * {@link #inTransaction(Function)}.
 */
@Slf4j
public class CacheStore {

    public static final int DEFAULT_PRUNE_DAYS = 90;
    public static final int DEFAULT_KEEP_PER_JOB = 100;

    private static final String JOB_COLUMNS =
            "id, name, schedule, agent, status, next_run_at, last_run_at, last_status, last_error, managed, created_at, updated_at";
    private static final String RUN_COLUMNS =
            "id, job_id, job_name, started_at, ended_at, duration_ms, status, error, session_id";

    private final CacheDatabase database;
    private final Clock clock;

    public CacheStore(CacheDatabase database) {
        this(database, Clock.systemUTC());
    }

    public CacheStore(CacheDatabase database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    public CacheDatabase getDatabase() {
        return database;
    }

    /**
     * Writes sharing one connection. Used by discovery so a pass is applied
     * completely or not at all.
     */
    public interface Session {

        Optional<JobRow> findJob(String id);

        void upsertJob(JobRow job);

        void recordRun(RunRow run);

        int evictStale(Collection<String> currentIds);
    }

    /**
     * Run {@code work} in a single transaction, rolling back if it throws.
     *
     * @throws CacheWriteException if the transaction cannot be committed
     */
    public <T> T inTransaction(Function<Session, T> work) {
        try (Connection conn = database.openConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.apply(new ConnectionSession(conn));
                conn.commit();
                return result;
            } catch (RuntimeException | SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new CacheWriteException("Cache transaction failed: " + e.getMessage(), e);
        }
    }

    // ---- jobs ----

    public void upsertJob(JobRow job) {
        inTransaction(session -> {
            session.upsertJob(job);
            return null;
        });
    }

    public Optional<JobRow> findJob(String id) {
        return queryOne("SELECT " + JOB_COLUMNS + " FROM jobs WHERE id = ?", ps -> ps.setString(1, id),
                CacheStore::readJob);
    }

    public Optional<JobRow> findJobByName(String name) {
        return queryOne("SELECT " + JOB_COLUMNS + " FROM jobs WHERE name = ? ORDER BY updated_at DESC LIMIT 1",
                ps -> ps.setString(1, name), CacheStore::readJob);
    }

    /**
     * @return the cached last-run timestamp, empty when the job is not cached
     *         or has never run
     */
    public Optional<Long> lastRunAt(String jobId) {
        return findJob(jobId).map(JobRow::getLastRunAt);
    }

    public List<JobRow> listJobs(JobFilter filter) {
        String sql = switch (filter) {
            case ALL -> "SELECT " + JOB_COLUMNS + " FROM jobs ORDER BY next_run_at";
            case MANAGED -> "SELECT " + JOB_COLUMNS + " FROM jobs WHERE managed = 1 ORDER BY next_run_at";
            case UNMANAGED -> "SELECT " + JOB_COLUMNS + " FROM jobs WHERE managed = 0 ORDER BY next_run_at";
            case FAILING -> "SELECT " + JOB_COLUMNS + " FROM jobs WHERE status = 'failing' ORDER BY name";
            case ACTIVE -> "SELECT " + JOB_COLUMNS + " FROM jobs WHERE status = 'active' ORDER BY next_run_at";
        };
        return queryList(sql, ps -> {
        }, CacheStore::readJob);
    }

    public int evictStale(Collection<String> currentIds) {
        return inTransaction(session -> session.evictStale(currentIds));
    }

    public StatusCounts statusCounts() {
        List<JobRow> jobs = listJobs(JobFilter.ALL);
        int managed = 0, active = 0, failing = 0, disabled = 0;
        for (JobRow job : jobs) {
            if (job.isManaged())
                managed++;
            switch (String.valueOf(job.getStatus())) {
                case JobRow.STATUS_ACTIVE -> active++;
                case JobRow.STATUS_FAILING -> failing++;
                case JobRow.STATUS_DISABLED -> disabled++;
                default -> {
                }
            }
        }
        return new StatusCounts(jobs.size(), managed, jobs.size() - managed, active, failing, disabled);
    }

    /**
     * The active job with the earliest known next run.
     */
    public Optional<JobRow> nextActiveJob() {
        return queryOne("SELECT " + JOB_COLUMNS + " FROM jobs WHERE status = 'active' AND next_run_at IS NOT NULL"
                + " ORDER BY next_run_at LIMIT 1", ps -> {
        }, CacheStore::readJob);
    }

    // ---- runs ----

    public void recordRun(RunRow run) {
        inTransaction(session -> {
            session.recordRun(run);
            return null;
        });
    }

    public List<RunRow> listRuns(String jobId, int limit) {
        return queryList("SELECT " + RUN_COLUMNS + " FROM runs WHERE job_id = ? ORDER BY started_at DESC, id DESC LIMIT ?",
                ps -> {
                    ps.setString(1, jobId);
                    ps.setInt(2, limit);
                }, CacheStore::readRun);
    }

    public List<RunRow> listRunsByName(String jobName, int limit) {
        return queryList("SELECT " + RUN_COLUMNS + " FROM runs WHERE job_name = ? ORDER BY started_at DESC, id DESC LIMIT ?",
                ps -> {
                    ps.setString(1, jobName);
                    ps.setInt(2, limit);
                }, CacheStore::readRun);
    }

    public List<RunRow> listRuns(int limit) {
        return queryList("SELECT " + RUN_COLUMNS + " FROM runs ORDER BY started_at DESC, id DESC LIMIT ?",
                ps -> ps.setInt(1, limit), CacheStore::readRun);
    }

    /**
     * Count, success count and mean duration per job name for runs started
     * within the last {@code daysBack} days.
     */
    public List<RunSummary> summary(int daysBack) {
        long cutoff = clock.millis() - Duration.ofDays(daysBack).toMillis();
        return queryList("""
                SELECT job_name,
                       COUNT(*) AS total_runs,
                       SUM(CASE WHEN status = 'ok' THEN 1 ELSE 0 END) AS successful_runs,
                       AVG(duration_ms) AS avg_duration_ms
                FROM runs
                WHERE started_at > ?
                GROUP BY job_name
                ORDER BY job_name
                """, ps -> ps.setLong(1, cutoff), rs -> {
            double avg = rs.getDouble("avg_duration_ms");
            Double avgDuration = rs.wasNull() ? null : avg;
            return new RunSummary(rs.getString("job_name"), rs.getLong("total_runs"),
                    rs.getLong("successful_runs"), avgDuration);
        });
    }

    /**
     * Delete runs started more than {@code daysBack} days ago, then trim every
     * job's history to its {@code keepPerJob} most recent runs.
     */
    public RunPruneResult pruneRuns(int daysBack, int keepPerJob) {
        long cutoff = clock.millis() - Duration.ofDays(daysBack).toMillis();
        try (Connection conn = database.openConnection()) {
            conn.setAutoCommit(false);
            try {
                int deletedOld;
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM runs WHERE started_at < ?")) {
                    ps.setLong(1, cutoff);
                    deletedOld = ps.executeUpdate();
                }

                List<String> jobIds = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement("SELECT DISTINCT job_id FROM runs");
                     ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        jobIds.add(rs.getString(1));
                    }
                }

                int deletedExcess = 0;
                try (PreparedStatement ps = conn.prepareStatement("""
                        DELETE FROM runs WHERE id IN (
                            SELECT id FROM runs WHERE job_id = ?
                            ORDER BY started_at DESC, id DESC
                            LIMIT -1 OFFSET ?
                        )
                        """)) {
                    for (String jobId : jobIds) {
                        ps.setString(1, jobId);
                        ps.setInt(2, keepPerJob);
                        deletedExcess += ps.executeUpdate();
                    }
                }
                conn.commit();
                if (deletedOld + deletedExcess > 0) {
                    log.debug("Pruned runs: {} older than {} days, {} beyond {} per job",
                            deletedOld, daysBack, deletedExcess, keepPerJob);
                }
                return new RunPruneResult(deletedOld, deletedExcess);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new CacheWriteException("Failed to prune runs: " + e.getMessage(), e);
        }
    }

    // ---- plumbing ----

    @FunctionalInterface
    interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    @FunctionalInterface
    interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private <T> List<T> queryList(String sql, Binder binder, RowMapper<T> mapper) {
        try (Connection conn = database.openConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            List<T> result = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapper.map(rs));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new CacheReadException("Cache query failed: " + e.getMessage(), e);
        }
    }

    private <T> Optional<T> queryOne(String sql, Binder binder, RowMapper<T> mapper) {
        List<T> rows = queryList(sql, binder, mapper);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    static JobRow readJob(ResultSet rs) throws SQLException {
        return JobRow.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .schedule(rs.getString("schedule"))
                .agent(rs.getString("agent"))
                .status(rs.getString("status"))
                .nextRunAt(getLong(rs, "next_run_at"))
                .lastRunAt(getLong(rs, "last_run_at"))
                .lastStatus(rs.getString("last_status"))
                .lastError(rs.getString("last_error"))
                .managed(rs.getInt("managed") == 1)
                .createdAt(getLong(rs, "created_at"))
                .updatedAt(getLong(rs, "updated_at"))
                .build();
    }

    static RunRow readRun(ResultSet rs) throws SQLException {
        return RunRow.builder()
                .id(rs.getLong("id"))
                .jobId(rs.getString("job_id"))
                .jobName(rs.getString("job_name"))
                .startedAt(rs.getLong("started_at"))
                .endedAt(getLong(rs, "ended_at"))
                .durationMs(getLong(rs, "duration_ms"))
                .status(rs.getString("status"))
                .error(rs.getString("error"))
                .sessionId(rs.getString("session_id"))
                .build();
    }

    private static Long getLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static void setLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    private final class ConnectionSession implements Session {

        private final Connection conn;

        ConnectionSession(Connection conn) {
            this.conn = conn;
        }

        @Override
        public Optional<JobRow> findJob(String id) {
            try (PreparedStatement ps = conn.prepareStatement("SELECT " + JOB_COLUMNS + " FROM jobs WHERE id = ?")) {
                ps.setString(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(readJob(rs)) : Optional.empty();
                }
            } catch (SQLException e) {
                throw new CacheReadException("Cache query failed: " + e.getMessage(), e);
            }
        }

        @Override
        public void upsertJob(JobRow job) {
            long now = clock.millis();
            try (PreparedStatement ps = conn.prepareStatement("""
                    INSERT INTO jobs (id, name, schedule, agent, status, next_run_at, last_run_at,
                                      last_status, last_error, managed, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    ON CONFLICT(id) DO UPDATE SET
                        name = excluded.name,
                        schedule = excluded.schedule,
                        agent = excluded.agent,
                        status = excluded.status,
                        next_run_at = excluded.next_run_at,
                        last_run_at = excluded.last_run_at,
                        last_status = excluded.last_status,
                        last_error = excluded.last_error,
                        managed = excluded.managed,
                        updated_at = excluded.updated_at
                    """)) {
                ps.setString(1, job.getId());
                ps.setString(2, job.getName() == null ? "" : job.getName());
                ps.setString(3, job.getSchedule());
                ps.setString(4, job.getAgent());
                ps.setString(5, job.getStatus());
                setLong(ps, 6, job.getNextRunAt());
                setLong(ps, 7, job.getLastRunAt());
                ps.setString(8, job.getLastStatus());
                ps.setString(9, job.getLastError());
                ps.setInt(10, job.isManaged() ? 1 : 0);
                ps.setLong(11, now);
                ps.setLong(12, now);
                ps.executeUpdate();
            } catch (SQLException e) {
                throw new CacheWriteException("Failed to upsert job " + job.getId() + ": " + e.getMessage(), e);
            }
        }

        @Override
        public void recordRun(RunRow run) {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO runs (job_id, job_name, started_at, ended_at, duration_ms, status, error, session_id)"
                            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?)")) {
                ps.setString(1, run.getJobId());
                ps.setString(2, run.getJobName());
                ps.setLong(3, run.getStartedAt());
                setLong(ps, 4, run.getEndedAt());
                setLong(ps, 5, run.getDurationMs());
                ps.setString(6, run.getStatus());
                ps.setString(7, run.getError());
                ps.setString(8, run.getSessionId());
                ps.executeUpdate();
            } catch (SQLException e) {
                throw new CacheWriteException("Failed to record run for " + run.getJobId() + ": " + e.getMessage(), e);
            }
        }

        // An empty id list deletes nothing.
        @Override
        public int evictStale(Collection<String> currentIds) {
            if (currentIds == null || currentIds.isEmpty())
                return 0;
            String placeholders = String.join(",", Collections.nCopies(currentIds.size(), "?"));
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM jobs WHERE id NOT IN (" + placeholders + ")")) {
                int i = 1;
                for (String id : currentIds) {
                    ps.setString(i++, id);
                }
                return ps.executeUpdate();
            } catch (SQLException e) {
                throw new CacheWriteException("Failed to evict stale jobs: " + e.getMessage(), e);
            }
        }
    }
}
