package com.sahayak.core.audit;

import com.sahayak.core.model.AuditRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link AuditStore} over a relational {@code audit_logs} table.
 * <p>
 * The table is created by {@link #createTables()} if missing. Result updates
 * only apply to rows still marked {@code dispatched}.
 */
public class JdbcAuditStore implements AuditStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditStore.class);

    private static final String TABLE_NAME = "audit_logs";

    static final int COMMAND_TEXT_MAX = 1024;
    static final int RESULT_MAX = 256;
    static final int ERROR_MAX = 1024;

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id           VARCHAR(36) PRIMARY KEY,
                user_id      VARCHAR(255),
                command_text VARCHAR(1024) NOT NULL,
                action_json  TEXT,
                result       VARCHAR(256) NOT NULL,
                error        VARCHAR(1024),
                created_at   TIMESTAMP NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS idx_audit_logs_created_at ON %s (created_at)
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, user_id, command_text, action_json, result, error, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String UPDATE_RESULT_SQL = """
            UPDATE %s SET result = ?, error = ?
            WHERE id = ? AND result = 'dispatched'
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT id, user_id, command_text, action_json, result, error, created_at
            FROM %s
            WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_RECENT_SQL = """
            SELECT id, user_id, command_text, action_json, result, error, created_at
            FROM %s
            ORDER BY created_at DESC
            LIMIT ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcAuditStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates the audit table and its index if they do not already exist.
     * Called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE_SQL);
            stmt.execute(CREATE_INDEX_SQL);
            log.info("Audit table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public String append(AuditRecord record) {
        String id = record.id() != null ? record.id() : UUID.randomUUID().toString();
        Instant createdAt = record.createdAt() != null ? record.createdAt() : Instant.now();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, id);
            stmt.setString(2, record.userId());
            stmt.setString(3, truncate(record.commandText(), COMMAND_TEXT_MAX));
            stmt.setString(4, record.actionJson());
            stmt.setString(5, truncate(record.result(), RESULT_MAX));
            stmt.setString(6, truncate(record.error(), ERROR_MAX));
            stmt.setTimestamp(7, Timestamp.from(createdAt));
            stmt.executeUpdate();
            log.debug("Appended audit record '{}'", id);
            return id;
        } catch (SQLException e) {
            throw new AuditException("Failed to append audit record for user " + record.userId(), e);
        }
    }

    @Override
    public boolean update(String id, String result, String error) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_RESULT_SQL)) {
            stmt.setString(1, truncate(result, RESULT_MAX));
            stmt.setString(2, truncate(error, ERROR_MAX));
            stmt.setString(3, id);
            int updated = stmt.executeUpdate();
            if (updated == 0) {
                log.debug("Audit record '{}' not found or already resolved", id);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new AuditException("Failed to update audit record " + id, e);
        }
    }

    @Override
    public Optional<AuditRecord> findById(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new AuditException("Failed to read audit record " + id, e);
        }
    }

    @Override
    public List<AuditRecord> findRecent(int limit) {
        List<AuditRecord> records = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_RECENT_SQL)) {
            stmt.setInt(1, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(fromResultSet(rs));
                }
            }
            return records;
        } catch (SQLException e) {
            throw new AuditException("Failed to list audit records", e);
        }
    }

    private AuditRecord fromResultSet(ResultSet rs) throws SQLException {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new AuditRecord(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("command_text"),
                rs.getString("action_json"),
                rs.getString("result"),
                rs.getString("error"),
                createdAt != null ? createdAt.toInstant() : null);
    }

    static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
