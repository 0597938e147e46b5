package com.agentbench.core.store;

import com.agentbench.core.error.JobNotFoundException;
import com.agentbench.core.error.UsageLimitExceededException;
import com.agentbench.core.model.Job;
import com.agentbench.core.model.JobStatus;
import com.agentbench.core.model.QueueEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * {@link JobStore} over a relational database.
 * <p>
 * Each job is one row holding the JSON document plus the columns queries filter on. Updates are
 * optimistic: the row carries a {@code version} that every write must match and bump.
 */
public class JdbcJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    private static final int MAX_UPDATE_ATTEMPTS = 20;

    private static final String INSERT_JOB_SQL = """
            INSERT INTO %s (id, user_id, agent_id, status, submitted_at, completed_at, version, document)
            VALUES (?, ?, ?, ?, ?, ?, 0, ?)
            """.formatted(JdbcSchema.JOBS);

    private static final String INSERT_ENTRY_SQL = """
            INSERT INTO %s (id, job_id, priority, status, created_at, claimed_at, claimed_by, attempts, last_error)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(JdbcSchema.QUEUE);

    private static final String CHARGE_USAGE_SQL = """
            UPDATE %s SET tests_this_month = tests_this_month + 1
            WHERE id = ? AND (? < 0 OR tests_this_month < ?)
            """.formatted(JdbcSchema.USERS);

    private static final String LOCK_USER_SQL = """
            SELECT id FROM %s WHERE id = ? FOR UPDATE
            """.formatted(JdbcSchema.USERS);

    private static final String SELECT_BY_ID_SQL = """
            SELECT document, version FROM %s WHERE id = ?
            """.formatted(JdbcSchema.JOBS);

    private static final String UPDATE_SQL = """
            UPDATE %s SET status = ?, completed_at = ?, document = ?, version = version + 1
            WHERE id = ? AND version = ?
            """.formatted(JdbcSchema.JOBS);

    private static final String SELECT_BY_AGENT_SQL = """
            SELECT document FROM %s WHERE agent_id = ? ORDER BY submitted_at DESC, id DESC LIMIT ?
            """.formatted(JdbcSchema.JOBS);

    private static final String SELECT_BY_USER_SQL = """
            SELECT document FROM %s WHERE user_id = ? ORDER BY submitted_at DESC, id DESC LIMIT ?
            """.formatted(JdbcSchema.JOBS);

    private static final String SELECT_BY_USER_STATUS_SQL = """
            SELECT document FROM %s WHERE user_id = ? AND status = ?
            ORDER BY submitted_at DESC, id DESC LIMIT ?
            """.formatted(JdbcSchema.JOBS);

    private static final String SELECT_BY_STATUS_SQL = """
            SELECT document FROM %s WHERE status = ?
            """.formatted(JdbcSchema.JOBS);

    private static final String SELECT_RECENTLY_COMPLETED_SQL = """
            SELECT document FROM %s WHERE status = 'COMPLETED' AND completed_at IS NOT NULL
            ORDER BY completed_at DESC LIMIT ?
            """.formatted(JdbcSchema.JOBS);

    private static final String COUNT_UNFINISHED_BY_USER_SQL = """
            SELECT COUNT(*) FROM %s
            WHERE user_id = ? AND status NOT IN ('COMPLETED', 'FAILED', 'ABANDONED', 'ARCHIVED')
            """.formatted(JdbcSchema.JOBS);

    private final DataSource dataSource;

    public JdbcJobStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    @Override
    public Job submit(Job job, QueueEntry entry, UsageCharge charge, int maxUnfinished) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                if (maxUnfinished > 0) {
                    // the user row lock serializes submissions of one user until commit
                    try (PreparedStatement stmt = conn.prepareStatement(LOCK_USER_SQL)) {
                        stmt.setString(1, job.userId());
                        stmt.executeQuery().close();
                    }
                    if (countUnfinished(conn, job.userId()) >= maxUnfinished) {
                        conn.rollback();
                        throw UsageLimitExceededException.concurrent(maxUnfinished);
                    }
                }
                if (charge != null) {
                    try (PreparedStatement stmt = conn.prepareStatement(CHARGE_USAGE_SQL)) {
                        stmt.setString(1, charge.userId());
                        stmt.setInt(2, charge.monthlyCap());
                        stmt.setInt(3, charge.monthlyCap());
                        if (stmt.executeUpdate() == 0) {
                            conn.rollback();
                            throw new UsageLimitExceededException("Monthly test limit of "
                                    + charge.monthlyCap() + " reached for user " + charge.userId());
                        }
                    }
                }
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_JOB_SQL)) {
                    stmt.setString(1, job.id());
                    stmt.setString(2, job.userId());
                    stmt.setString(3, job.agentId());
                    stmt.setString(4, job.status().name());
                    stmt.setTimestamp(5, toTimestamp(job.submittedAt()));
                    stmt.setTimestamp(6, toTimestamp(job.completedAt()));
                    stmt.setString(7, StoreJson.write(job));
                    stmt.executeUpdate();
                }
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_ENTRY_SQL)) {
                    JdbcQueueStore.bindEntry(stmt, entry);
                    stmt.executeUpdate();
                }
                conn.commit();
                log.debug("Stored job {} with queue entry {}", job.id(), entry.id());
                return job;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to submit job " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        return loadVersioned(jobId).map(VersionedJob::job);
    }

    @Override
    public Job update(String jobId, UnaryOperator<Job> change) {
        for (int attempt = 0; attempt < MAX_UPDATE_ATTEMPTS; attempt++) {
            VersionedJob current = loadVersioned(jobId)
                    .orElseThrow(() -> new JobNotFoundException("Job", jobId));
            Job updated = change.apply(current.job());
            if (updated == current.job()) {
                return updated;
            }
            try (Connection conn = dataSource.getConnection();
                 PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
                stmt.setString(1, updated.status().name());
                stmt.setTimestamp(2, toTimestamp(updated.completedAt()));
                stmt.setString(3, StoreJson.write(updated));
                stmt.setString(4, jobId);
                stmt.setLong(5, current.version());
                if (stmt.executeUpdate() == 1) {
                    return updated;
                }
            } catch (SQLException e) {
                throw new StoreException("Failed to update job " + jobId, e);
            }
            log.debug("Concurrent update of job {}, retrying (attempt {})", jobId, attempt + 1);
        }
        throw new StoreException("Gave up updating job " + jobId + " after " + MAX_UPDATE_ATTEMPTS
                + " concurrent modifications", null);
    }

    @Override
    public List<Job> findByAgent(String agentId, int limit) {
        return queryJobs(SELECT_BY_AGENT_SQL, stmt -> {
            stmt.setString(1, agentId);
            stmt.setInt(2, limit);
        });
    }

    @Override
    public List<Job> findByUser(String userId, JobStatus status, int limit) {
        if (status == null) {
            return queryJobs(SELECT_BY_USER_SQL, stmt -> {
                stmt.setString(1, userId);
                stmt.setInt(2, limit);
            });
        }
        return queryJobs(SELECT_BY_USER_STATUS_SQL, stmt -> {
            stmt.setString(1, userId);
            stmt.setString(2, status.name());
            stmt.setInt(3, limit);
        });
    }

    @Override
    public List<Job> findByStatus(JobStatus status) {
        return queryJobs(SELECT_BY_STATUS_SQL, stmt -> stmt.setString(1, status.name()));
    }

    @Override
    public List<Job> findRecentlyCompleted(int limit) {
        return queryJobs(SELECT_RECENTLY_COMPLETED_SQL, stmt -> stmt.setInt(1, limit));
    }

    @Override
    public long countByStatus(Set<JobStatus> statuses) {
        if (statuses.isEmpty()) {
            return 0;
        }
        String placeholders = statuses.stream().map(s -> "?").collect(Collectors.joining(", "));
        String sql = "SELECT COUNT(*) FROM %s WHERE status IN (%s)".formatted(JdbcSchema.JOBS, placeholders);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            int i = 1;
            for (JobStatus status : statuses) {
                stmt.setString(i++, status.name());
            }
            return singleLong(stmt);
        } catch (SQLException e) {
            throw new StoreException("Failed to count jobs by status", e);
        }
    }

    @Override
    public long countUnfinishedByUser(String userId) {
        try (Connection conn = dataSource.getConnection()) {
            return countUnfinished(conn, userId);
        } catch (SQLException e) {
            throw new StoreException("Failed to count unfinished jobs of user " + userId, e);
        }
    }

    private static long countUnfinished(Connection conn, String userId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(COUNT_UNFINISHED_BY_USER_SQL)) {
            stmt.setString(1, userId);
            return singleLong(stmt);
        }
    }

    // ── Internals ────────────────────────────────────────────────────────

    private record VersionedJob(Job job, long version) {}

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    private Optional<VersionedJob> loadVersioned(String jobId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, jobId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new VersionedJob(
                            StoreJson.read(rs.getString("document"), Job.class), rs.getLong("version")));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to load job " + jobId, e);
        }
    }

    private List<Job> queryJobs(String sql, Binder binder) {
        List<Job> jobs = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    jobs.add(StoreJson.read(rs.getString("document"), Job.class));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to query jobs", e);
        }
        return jobs;
    }

    private static long singleLong(PreparedStatement stmt) throws SQLException {
        try (ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
