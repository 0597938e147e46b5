package com.agentbench.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * DDL for the JDBC stores. Written to run on PostgreSQL and on H2 in PostgreSQL mode.
 */
public final class JdbcSchema {

    private static final Logger log = LoggerFactory.getLogger(JdbcSchema.class);

    static final String JOBS = "ab_jobs";
    static final String QUEUE = "ab_queue_entries";
    static final String USERS = "ab_users";
    static final String DOCUMENTS = "ab_documents";

    private static final List<String> DDL = List.of(
            """
            CREATE TABLE IF NOT EXISTS %s (
                id            VARCHAR(64) PRIMARY KEY,
                user_id       VARCHAR(255) NOT NULL,
                agent_id      VARCHAR(255) NOT NULL,
                status        VARCHAR(32) NOT NULL,
                submitted_at  TIMESTAMP NOT NULL,
                completed_at  TIMESTAMP,
                version       BIGINT NOT NULL,
                document      TEXT NOT NULL
            )
            """.formatted(JOBS),
            "CREATE INDEX IF NOT EXISTS ab_jobs_agent_idx ON %s (agent_id, submitted_at)".formatted(JOBS),
            "CREATE INDEX IF NOT EXISTS ab_jobs_user_idx ON %s (user_id, submitted_at)".formatted(JOBS),
            "CREATE INDEX IF NOT EXISTS ab_jobs_status_idx ON %s (status)".formatted(JOBS),
            """
            CREATE TABLE IF NOT EXISTS %s (
                id          VARCHAR(64) PRIMARY KEY,
                job_id      VARCHAR(64) NOT NULL,
                priority    INT NOT NULL,
                status      VARCHAR(16) NOT NULL,
                created_at  TIMESTAMP NOT NULL,
                claimed_at  TIMESTAMP,
                claimed_by  VARCHAR(255),
                attempts    INT NOT NULL,
                last_error  TEXT
            )
            """.formatted(QUEUE),
            "CREATE INDEX IF NOT EXISTS ab_queue_select_idx ON %s (status, priority, created_at)".formatted(QUEUE),
            "CREATE INDEX IF NOT EXISTS ab_queue_job_idx ON %s (job_id)".formatted(QUEUE),
            """
            CREATE TABLE IF NOT EXISTS %s (
                id                VARCHAR(255) PRIMARY KEY,
                tier              VARCHAR(16) NOT NULL,
                tests_this_month  INT NOT NULL,
                usage_reset_at    TIMESTAMP
            )
            """.formatted(USERS),
            """
            CREATE TABLE IF NOT EXISTS %s (
                collection  VARCHAR(32) NOT NULL,
                id          VARCHAR(255) NOT NULL,
                owner_key   VARCHAR(255),
                created_at  TIMESTAMP NOT NULL,
                body        TEXT NOT NULL,
                PRIMARY KEY (collection, id)
            )
            """.formatted(DOCUMENTS)
    );

    private JdbcSchema() {}

    /**
     * Creates all tables and indexes that do not exist yet.
     */
    public static void createTables(DataSource dataSource) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String ddl : DDL) {
                stmt.execute(ddl);
            }
        }
        log.info("Store tables ensured ({}, {}, {}, {})", JOBS, QUEUE, USERS, DOCUMENTS);
    }
}
