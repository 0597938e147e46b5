package com.agentbench.core.store;

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
 * One collection of JSON documents in the shared documents table. Used for the low-volume
 * records (agents, deployments, account connections) that need no conditional updates.
 */
class JdbcDocumentTable<T> {

    private static final String SELECT_SQL = """
            SELECT body FROM %s WHERE collection = ? AND id = ?
            """.formatted(JdbcSchema.DOCUMENTS);

    private static final String SELECT_BY_OWNER_SQL = """
            SELECT body FROM %s WHERE collection = ? AND owner_key = ?
            ORDER BY created_at DESC, id DESC LIMIT ?
            """.formatted(JdbcSchema.DOCUMENTS);

    private static final String UPDATE_SQL = """
            UPDATE %s SET owner_key = ?, body = ? WHERE collection = ? AND id = ?
            """.formatted(JdbcSchema.DOCUMENTS);

    private static final String INSERT_SQL = """
            INSERT INTO %s (owner_key, body, collection, id, created_at) VALUES (?, ?, ?, ?, ?)
            """.formatted(JdbcSchema.DOCUMENTS);

    private final DataSource dataSource;
    private final String collection;
    private final Class<T> type;

    JdbcDocumentTable(DataSource dataSource, String collection, Class<T> type) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.collection = collection;
        this.type = type;
    }

    Optional<T> find(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, collection);
            stmt.setString(2, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(StoreJson.read(rs.getString(1), type)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load " + collection + " " + id, e);
        }
    }

    List<T> findByOwner(String ownerKey, int limit) {
        List<T> found = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_OWNER_SQL)) {
            stmt.setString(1, collection);
            stmt.setString(2, ownerKey);
            stmt.setInt(3, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    found.add(StoreJson.read(rs.getString(1), type));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to list " + collection + " for " + ownerKey, e);
        }
        return found;
    }

    T save(String id, String ownerKey, Instant createdAt, T document) {
        String body = StoreJson.write(document);
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
                stmt.setString(1, ownerKey);
                stmt.setString(2, body);
                stmt.setString(3, collection);
                stmt.setString(4, id);
                if (stmt.executeUpdate() > 0) {
                    return document;
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
                stmt.setString(1, ownerKey);
                stmt.setString(2, body);
                stmt.setString(3, collection);
                stmt.setString(4, id);
                stmt.setTimestamp(5, Timestamp.from(createdAt));
                stmt.executeUpdate();
            }
            return document;
        } catch (SQLException e) {
            throw new StoreException("Failed to save " + collection + " " + id, e);
        }
    }
}
