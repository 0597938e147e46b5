package com.agentbench.core.store;

import com.agentbench.core.model.Tier;
import com.agentbench.core.model.UserAccount;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

public class JdbcUserStore implements UserStore {

    private static final String SELECT_SQL = """
            SELECT id, tier, tests_this_month, usage_reset_at FROM %s WHERE id = ?
            """.formatted(JdbcSchema.USERS);

    private static final String UPDATE_SQL = """
            UPDATE %s SET tier = ?, tests_this_month = ?, usage_reset_at = ? WHERE id = ?
            """.formatted(JdbcSchema.USERS);

    private static final String INSERT_SQL = """
            INSERT INTO %s (tier, tests_this_month, usage_reset_at, id) VALUES (?, ?, ?, ?)
            """.formatted(JdbcSchema.USERS);

    private static final String TRY_INCREMENT_SQL = """
            UPDATE %s SET tests_this_month = tests_this_month + 1
            WHERE id = ? AND (? < 0 OR tests_this_month < ?)
            """.formatted(JdbcSchema.USERS);

    private static final String INCREMENT_SQL = """
            UPDATE %s SET tests_this_month = tests_this_month + 1 WHERE id = ?
            """.formatted(JdbcSchema.USERS);

    private static final String REFUND_SQL = """
            UPDATE %s SET tests_this_month = tests_this_month - 1 WHERE id = ? AND tests_this_month > 0
            """.formatted(JdbcSchema.USERS);

    private static final String RESET_SQL = """
            UPDATE %s SET tests_this_month = 0, usage_reset_at = ? WHERE tier = ?
            """.formatted(JdbcSchema.USERS);

    private final DataSource dataSource;

    public JdbcUserStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    @Override
    public Optional<UserAccount> findById(String userId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, userId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new UserAccount(
                            rs.getString("id"),
                            Tier.fromValue(rs.getString("tier")),
                            rs.getInt("tests_this_month"),
                            JdbcJobStore.toInstant(rs.getTimestamp("usage_reset_at"))));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to load user " + userId, e);
        }
    }

    @Override
    public UserAccount save(UserAccount user) {
        try (Connection conn = dataSource.getConnection()) {
            if (write(conn, UPDATE_SQL, user) == 0) {
                write(conn, INSERT_SQL, user);
            }
            return user;
        } catch (SQLException e) {
            throw new StoreException("Failed to save user " + user.id(), e);
        }
    }

    @Override
    public boolean tryIncrementUsage(String userId, int monthlyCap) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(TRY_INCREMENT_SQL)) {
            stmt.setString(1, userId);
            stmt.setInt(2, monthlyCap);
            stmt.setInt(3, monthlyCap);
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to charge usage for " + userId, e);
        }
    }

    @Override
    public int incrementUsage(String userId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INCREMENT_SQL)) {
            stmt.setString(1, userId);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to increment usage for " + userId, e);
        }
        return findById(userId).map(UserAccount::testsThisMonth).orElse(0);
    }

    @Override
    public void refundUsage(String userId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(REFUND_SQL)) {
            stmt.setString(1, userId);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to refund usage for " + userId, e);
        }
    }

    @Override
    public int resetUsage(Tier tier, Instant resetAt) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(RESET_SQL)) {
            stmt.setTimestamp(1, JdbcJobStore.toTimestamp(resetAt));
            stmt.setString(2, tier.value());
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to reset usage for tier " + tier.value(), e);
        }
    }

    private static int write(Connection conn, String sql, UserAccount user) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, user.tier().value());
            stmt.setInt(2, user.testsThisMonth());
            stmt.setTimestamp(3, JdbcJobStore.toTimestamp(user.usageResetAt()));
            stmt.setString(4, user.id());
            return stmt.executeUpdate();
        }
    }
}
