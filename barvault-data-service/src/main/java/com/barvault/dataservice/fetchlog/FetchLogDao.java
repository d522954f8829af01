package com.barvault.dataservice.fetchlog;

import com.barvault.core.model.BarSpec;
import com.barvault.core.model.InstrumentId;
import com.barvault.core.time.Timestamps;
import com.barvault.dataservice.fetch.FetchRequest;
import com.barvault.dataservice.fetch.FetchStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Audit trail of fetch requests. One row per request, updated on every transition.
 * Instants are stored as epoch nanoseconds.
 */
public class FetchLogDao implements FetchLog {

    private static final Logger log = LoggerFactory.getLogger(FetchLogDao.class);

    private static final String SELECT_COLUMNS = """
        SELECT request_id, instrument_id, bar_spec, range_start, range_end, status,
               retry_count, max_retries, error, created_at, completed_at
        FROM fetch_requests
        """;

    private final FetchLogConnection conn;

    public FetchLogDao(FetchLogConnection conn) {
        this.conn = conn;
    }

    /**
     * Upsert the request's current state. SQL errors are logged, never thrown.
     */
    @Override
    public void record(FetchRequest request) {
        try {
            upsert(request.snapshot());
        } catch (SQLException e) {
            log.warn("Failed to record fetch {}: {}", request.getRequestId(), e.getMessage());
        }
    }

    public void upsert(FetchRequest.Snapshot s) throws SQLException {
        conn.executeInTransaction(c -> {
            String sql = """
                INSERT INTO fetch_requests
                (request_id, instrument_id, bar_spec, range_start, range_end, status,
                 retry_count, max_retries, error, created_at, completed_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(request_id) DO UPDATE SET
                    status = excluded.status,
                    retry_count = excluded.retry_count,
                    error = excluded.error,
                    completed_at = excluded.completed_at,
                    updated_at = excluded.updated_at
                """;
            try (PreparedStatement stmt = c.prepareStatement(sql)) {
                stmt.setString(1, s.requestId().toString());
                stmt.setString(2, s.instrumentId().toString());
                stmt.setString(3, s.barSpec().toString());
                stmt.setLong(4, Timestamps.toEpochNanos(s.start()));
                stmt.setLong(5, Timestamps.toEpochNanos(s.end()));
                stmt.setString(6, s.status().name());
                stmt.setInt(7, s.retryCount());
                stmt.setInt(8, s.maxRetries());
                stmt.setString(9, s.error());
                stmt.setLong(10, Timestamps.toEpochNanos(s.createdAt()));
                if (s.completedAt() != null) {
                    stmt.setLong(11, Timestamps.toEpochNanos(s.completedAt()));
                } else {
                    stmt.setNull(11, Types.INTEGER);
                }
                stmt.setLong(12, System.currentTimeMillis());
                stmt.executeUpdate();
            }
        });
    }

    public Optional<FetchRequest.Snapshot> get(UUID requestId) throws SQLException {
        Connection c = conn.getConnection();
        try (PreparedStatement stmt = c.prepareStatement(SELECT_COLUMNS + " WHERE request_id = ?")) {
            stmt.setString(1, requestId.toString());
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromRow(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Most recent requests first.
     */
    public List<FetchRequest.Snapshot> recent(int limit) throws SQLException {
        Connection c = conn.getConnection();
        try (PreparedStatement stmt = c.prepareStatement(
                SELECT_COLUMNS + " ORDER BY created_at DESC LIMIT ?")) {
            stmt.setInt(1, limit);
            return readAll(stmt);
        }
    }

    public List<FetchRequest.Snapshot> findByStatus(FetchStatus status) throws SQLException {
        Connection c = conn.getConnection();
        try (PreparedStatement stmt = c.prepareStatement(
                SELECT_COLUMNS + " WHERE status = ? ORDER BY created_at DESC")) {
            stmt.setString(1, status.name());
            return readAll(stmt);
        }
    }

    private static List<FetchRequest.Snapshot> readAll(PreparedStatement stmt) throws SQLException {
        List<FetchRequest.Snapshot> result = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                result.add(fromRow(rs));
            }
        }
        return result;
    }

    private static FetchRequest.Snapshot fromRow(ResultSet rs) throws SQLException {
        long completed = rs.getLong("completed_at");
        Instant completedAt = rs.wasNull() ? null : Timestamps.fromEpochNanos(completed);
        return new FetchRequest.Snapshot(
            UUID.fromString(rs.getString("request_id")),
            InstrumentId.parse(rs.getString("instrument_id")),
            BarSpec.parse(rs.getString("bar_spec")),
            Timestamps.fromEpochNanos(rs.getLong("range_start")),
            Timestamps.fromEpochNanos(rs.getLong("range_end")),
            FetchStatus.valueOf(rs.getString("status")),
            rs.getInt("retry_count"),
            rs.getInt("max_retries"),
            rs.getString("error"),
            Timestamps.fromEpochNanos(rs.getLong("created_at")),
            completedAt
        );
    }
}
