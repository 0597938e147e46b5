package com.agentbench.core.store;

import com.agentbench.core.model.QueueEntry;
import com.agentbench.core.model.QueueEntryStatus;

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

/**
 * {@link QueueStore} over a relational database. A claim is a single guarded UPDATE, so the row
 * lock of the database arbitrates between workers.
 */
public class JdbcQueueStore implements QueueStore {

    private static final String COLUMNS =
            "id, job_id, priority, status, created_at, claimed_at, claimed_by, attempts, last_error";

    private static final String SELECT_PENDING_SQL = """
            SELECT %s FROM %s WHERE status = 'pending'
            ORDER BY priority ASC, created_at ASC, id ASC LIMIT ?
            """.formatted(COLUMNS, JdbcSchema.QUEUE);

    private static final String SELECT_BY_ID_SQL = """
            SELECT %s FROM %s WHERE id = ?
            """.formatted(COLUMNS, JdbcSchema.QUEUE);

    private static final String SELECT_BY_JOB_SQL = """
            SELECT %s FROM %s WHERE job_id = ?
            """.formatted(COLUMNS, JdbcSchema.QUEUE);

    private static final String CLAIM_SQL = """
            UPDATE %s SET status = 'claimed', claimed_at = ?, claimed_by = ?
            WHERE id = ? AND status = ? AND attempts = ?
            """.formatted(JdbcSchema.QUEUE);

    private static final String COMPARE_AND_SET_SQL = """
            UPDATE %s SET status = ?, claimed_at = ?, claimed_by = ?, attempts = ?, last_error = ?
            WHERE id = ? AND status = ? AND attempts = ?
            """.formatted(JdbcSchema.QUEUE);

    private static final String SELECT_CLAIMED_BEFORE_SQL = """
            SELECT %s FROM %s WHERE status = 'claimed' AND claimed_at < ?
            """.formatted(COLUMNS, JdbcSchema.QUEUE);

    private static final String COUNT_PENDING_SQL = """
            SELECT COUNT(*) FROM %s WHERE status = 'pending'
            """.formatted(JdbcSchema.QUEUE);

    private static final String COUNT_AHEAD_SQL = """
            SELECT COUNT(*) FROM %s WHERE status = 'pending' AND (
                priority < ?
                OR (priority = ? AND created_at < ?)
                OR (priority = ? AND created_at = ? AND id < ?)
            )
            """.formatted(JdbcSchema.QUEUE);

    private static final String OLDEST_PENDING_SQL = """
            SELECT MIN(created_at) FROM %s WHERE status = 'pending'
            """.formatted(JdbcSchema.QUEUE);

    private final DataSource dataSource;

    public JdbcQueueStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    @Override
    public List<QueueEntry> findPending(int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_PENDING_SQL)) {
            stmt.setInt(1, limit);
            return readAll(stmt);
        } catch (SQLException e) {
            throw new StoreException("Failed to select pending queue entries", e);
        }
    }

    @Override
    public Optional<QueueEntry> findById(String entryId) {
        return findOne(SELECT_BY_ID_SQL, entryId);
    }

    @Override
    public Optional<QueueEntry> findByJobId(String jobId) {
        return findOne(SELECT_BY_JOB_SQL, jobId);
    }

    @Override
    public boolean tryClaim(String entryId, QueueEntryStatus expectedStatus, int expectedAttempts,
                            String workerId, Instant claimedAt) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CLAIM_SQL)) {
            stmt.setTimestamp(1, Timestamp.from(claimedAt));
            stmt.setString(2, workerId);
            stmt.setString(3, entryId);
            stmt.setString(4, expectedStatus.value());
            stmt.setInt(5, expectedAttempts);
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to claim queue entry " + entryId, e);
        }
    }

    @Override
    public boolean compareAndSet(QueueEntry expected, QueueEntry replacement) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COMPARE_AND_SET_SQL)) {
            stmt.setString(1, replacement.status().value());
            stmt.setTimestamp(2, JdbcJobStore.toTimestamp(replacement.claimedAt()));
            stmt.setString(3, replacement.claimedBy());
            stmt.setInt(4, replacement.attempts());
            stmt.setString(5, replacement.lastError());
            stmt.setString(6, expected.id());
            stmt.setString(7, expected.status().value());
            stmt.setInt(8, expected.attempts());
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to update queue entry " + expected.id(), e);
        }
    }

    @Override
    public List<QueueEntry> findClaimedBefore(Instant cutoff) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_CLAIMED_BEFORE_SQL)) {
            stmt.setTimestamp(1, Timestamp.from(cutoff));
            return readAll(stmt);
        } catch (SQLException e) {
            throw new StoreException("Failed to select stale claims", e);
        }
    }

    @Override
    public long countPending() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_PENDING_SQL);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new StoreException("Failed to count pending entries", e);
        }
    }

    @Override
    public long countPendingAhead(QueueEntry entry) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_AHEAD_SQL)) {
            Timestamp createdAt = Timestamp.from(entry.createdAt());
            stmt.setInt(1, entry.priority());
            stmt.setInt(2, entry.priority());
            stmt.setTimestamp(3, createdAt);
            stmt.setInt(4, entry.priority());
            stmt.setTimestamp(5, createdAt);
            stmt.setString(6, entry.id());
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to compute queue position of " + entry.id(), e);
        }
    }

    @Override
    public Optional<Instant> oldestPendingCreatedAt() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(OLDEST_PENDING_SQL);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? Optional.ofNullable(JdbcJobStore.toInstant(rs.getTimestamp(1))) : Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to read oldest pending entry", e);
        }
    }

    static void bindEntry(PreparedStatement stmt, QueueEntry entry) throws SQLException {
        stmt.setString(1, entry.id());
        stmt.setString(2, entry.jobId());
        stmt.setInt(3, entry.priority());
        stmt.setString(4, entry.status().value());
        stmt.setTimestamp(5, Timestamp.from(entry.createdAt()));
        stmt.setTimestamp(6, JdbcJobStore.toTimestamp(entry.claimedAt()));
        stmt.setString(7, entry.claimedBy());
        stmt.setInt(8, entry.attempts());
        stmt.setString(9, entry.lastError());
    }

    private Optional<QueueEntry> findOne(String sql, String key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, key);
            List<QueueEntry> found = readAll(stmt);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw new StoreException("Failed to load queue entry for " + key, e);
        }
    }

    private static List<QueueEntry> readAll(PreparedStatement stmt) throws SQLException {
        List<QueueEntry> entries = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                entries.add(new QueueEntry(
                        rs.getString("id"),
                        rs.getString("job_id"),
                        rs.getInt("priority"),
                        QueueEntryStatus.fromValue(rs.getString("status")),
                        JdbcJobStore.toInstant(rs.getTimestamp("created_at")),
                        JdbcJobStore.toInstant(rs.getTimestamp("claimed_at")),
                        rs.getString("claimed_by"),
                        rs.getInt("attempts"),
                        rs.getString("last_error")));
            }
        }
        return entries;
    }
}
