package com.crossfire.cache;

import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * {@link CacheStorage} on a relational table, one row per (group key, session id).
 *
 * <p>Insert-or-merge is an update followed by an insert when no row matched. A concurrent insert of
 * the same key surfaces as an integrity violation and is resolved by updating the row that won.
 */
@Slf4j
public class JdbcCacheStorage implements CacheStorage {
    private static final Pattern TABLE_NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final DataSource dataSource;
    private final String tableName;

    public JdbcCacheStorage(DataSource dataSource, String tableName) {
        if (tableName == null || !TABLE_NAME_PATTERN.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid cache table name: " + tableName);
        }
        this.dataSource = dataSource;
        this.tableName = tableName;
    }

    /**
     * Creates the cache table when it does not exist yet.
     */
    public void createTable() {
        String ddl = "CREATE TABLE IF NOT EXISTS " + tableName + " ("
                + "group_key VARCHAR(512) NOT NULL, "
                + "session_id VARCHAR(512) NOT NULL, "
                + "created_at_ms BIGINT NOT NULL, "
                + "ttl_seconds INT NOT NULL, "
                + "cached_value TEXT, "
                + "PRIMARY KEY (group_key, session_id))";
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            st.execute(ddl);
            log.info("Cache table ready: table={}", tableName);
        } catch (SQLException e) {
            throw new CacheStorageException("Failed to create cache table " + tableName, e);
        }
    }

    @Override
    public void insertOrMerge(StoredCacheRecord record) {
        try (Connection conn = dataSource.getConnection()) {
            if (update(conn, record) > 0) {
                return;
            }
            try {
                insert(conn, record);
            } catch (SQLException e) {
                if (!isIntegrityViolation(e)) {
                    throw e;
                }
                log.debug("Concurrent cache insert, merging: group_key={}, session_id={}", record.getGroupKey(), record.getSessionId());
                update(conn, record);
            }
        } catch (SQLException e) {
            throw new CacheStorageException("Failed to write cache record: group_key=" + record.getGroupKey(), e);
        }
    }

    @Override
    public List<StoredCacheRecord> findAll(String groupKey) {
        boolean all = groupKey == null || groupKey.isEmpty();
        String sql = "SELECT group_key, session_id, created_at_ms, ttl_seconds, cached_value FROM " + tableName
                + (all ? "" : " WHERE group_key = ?");

        List<StoredCacheRecord> out = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            if (!all) {
                ps.setString(1, groupKey);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new StoredCacheRecord(
                            rs.getString(1),
                            rs.getString(2),
                            Instant.ofEpochMilli(rs.getLong(3)),
                            rs.getInt(4),
                            rs.getString(5)));
                }
            }
        } catch (SQLException e) {
            throw new CacheStorageException("Failed to read cache records: group_key=" + groupKey, e);
        }
        return out;
    }

    private int update(Connection conn, StoredCacheRecord record) throws SQLException {
        String sql = "UPDATE " + tableName + " SET created_at_ms = ?, ttl_seconds = ?, cached_value = ? "
                + "WHERE group_key = ? AND session_id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, record.getCreatedAt().toEpochMilli());
            ps.setInt(2, record.getTtlSeconds());
            ps.setString(3, record.getCachedValue());
            ps.setString(4, record.getGroupKey());
            ps.setString(5, record.getSessionId());
            return ps.executeUpdate();
        }
    }

    private void insert(Connection conn, StoredCacheRecord record) throws SQLException {
        String sql = "INSERT INTO " + tableName + " (group_key, session_id, created_at_ms, ttl_seconds, cached_value) "
                + "VALUES (?, ?, ?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, record.getGroupKey());
            ps.setString(2, record.getSessionId());
            ps.setLong(3, record.getCreatedAt().toEpochMilli());
            ps.setInt(4, record.getTtlSeconds());
            ps.setString(5, record.getCachedValue());
            ps.executeUpdate();
        }
    }

    private static boolean isIntegrityViolation(SQLException e) {
        String sqlState = e.getSQLState();
        return sqlState != null && sqlState.startsWith("23");
    }
}
