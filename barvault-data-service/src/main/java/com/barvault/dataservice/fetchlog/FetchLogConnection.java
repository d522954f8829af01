package com.barvault.dataservice.fetchlog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * SQLite connection for the fetch log database, in WAL mode so the inspection API
 * can read while fetches write.
 */
public class FetchLogConnection implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FetchLogConnection.class);

    private final Path dbFile;
    private volatile Connection connection;
    private final Object lock = new Object();

    public FetchLogConnection(Path dbFile) {
        this.dbFile = dbFile;
    }

    public Path getDbFile() {
        return dbFile;
    }

    /**
     * Get or create the connection. Only writes are serialized, via executeInTransaction().
     */
    public Connection getConnection() throws SQLException {
        Connection conn = connection;
        if (conn != null && !conn.isClosed()) {
            return conn;
        }

        synchronized (lock) {
            if (connection == null || connection.isClosed()) {
                connection = createConnection();
            }
            return connection;
        }
    }

    private Connection createConnection() throws SQLException {
        Path parent = dbFile.toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new SQLException("Cannot create directory " + parent + ": " + e.getMessage(), e);
            }
        }

        Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbFile.toAbsolutePath());
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.execute("PRAGMA synchronous=NORMAL");
            stmt.execute("PRAGMA busy_timeout=5000");
        }
        log.debug("Opened fetch log at {}", dbFile.toAbsolutePath());
        return conn;
    }

    public void initializeSchema() throws SQLException {
        executeInTransaction(conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("""
                    CREATE TABLE IF NOT EXISTS fetch_requests (
                        request_id TEXT PRIMARY KEY,
                        instrument_id TEXT NOT NULL,
                        bar_spec TEXT NOT NULL,
                        range_start INTEGER NOT NULL,
                        range_end INTEGER NOT NULL,
                        status TEXT NOT NULL,
                        retry_count INTEGER NOT NULL DEFAULT 0,
                        max_retries INTEGER NOT NULL,
                        error TEXT,
                        created_at INTEGER NOT NULL,
                        completed_at INTEGER,
                        updated_at INTEGER NOT NULL
                    )
                    """);
                stmt.execute("CREATE INDEX IF NOT EXISTS idx_fetch_requests_status ON fetch_requests(status)");
                stmt.execute("CREATE INDEX IF NOT EXISTS idx_fetch_requests_created ON fetch_requests(created_at)");
            }
        });
    }

    /**
     * Execute a function within a transaction.
     * Commits on success, rolls back on failure.
     */
    public <T> T executeInTransaction(TransactionFunction<T> function) throws SQLException {
        Connection conn = getConnection();
        synchronized (lock) {
            boolean autoCommitOriginal = conn.getAutoCommit();
            try {
                conn.setAutoCommit(false);
                T result = function.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    log.warn("Rollback failed: {}", rollbackEx.getMessage());
                }
                throw e;
            } finally {
                try {
                    conn.setAutoCommit(autoCommitOriginal);
                } catch (SQLException e) {
                    log.warn("Could not restore auto-commit: {}", e.getMessage());
                }
            }
        }
    }

    public void executeInTransaction(TransactionConsumer consumer) throws SQLException {
        executeInTransaction(conn -> {
            consumer.accept(conn);
            return null;
        });
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (connection != null) {
                try {
                    connection.close();
                } catch (SQLException e) {
                    log.warn("Error closing fetch log: {}", e.getMessage());
                }
                connection = null;
            }
        }
    }

    @FunctionalInterface
    public interface TransactionFunction<T> {
        T apply(Connection connection) throws SQLException;
    }

    @FunctionalInterface
    public interface TransactionConsumer {
        void accept(Connection connection) throws SQLException;
    }
}
