package io.gearledger.storage;

import io.gearledger.config.SyncConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * SQLite handle for the results ledger.
 *
 * <p>No connection is cached here: callers open one with {@link #openConnection()}
 * on their own thread and close it before returning, so a connection is never
 * visible to a second thread. Concurrent writers queue on the busy timeout
 * instead of failing with {@code SQLITE_BUSY}.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final Path dbFile;
    private final String jdbcUrl;
    private final int busyTimeoutMs;

    public Database(SyncConfig config, int busyTimeoutMs) {
        this(config.dbFile(), busyTimeoutMs);
    }

    public Database(Path dbFile, int busyTimeoutMs) {
        this.dbFile = dbFile;
        this.jdbcUrl = "jdbc:sqlite:" + dbFile.toString();
        this.busyTimeoutMs = busyTimeoutMs;
    }

    public Path dbFile() {
        return dbFile;
    }

    public void init() {
        initDirectories();
        applyAndValidatePragmas();
        initSchema();
        log.info("Results database ready at {}", dbFile);
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties());
    }

    private Properties connectionProperties() {
        SQLiteConfig cfg = new SQLiteConfig();
        cfg.setBusyTimeout(busyTimeoutMs);
        // Write transactions hold the reserved lock from BEGIN.
        cfg.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        cfg.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        return cfg.toProperties();
    }

    private void initDirectories() {
        try {
            Path parent = dbFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize database directory for " + dbFile, e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS results (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        artikul TEXT NOT NULL,
                        normalized_key TEXT NOT NULL,
                        client TEXT NOT NULL,
                        client_key TEXT NOT NULL,
                        quantity INTEGER NOT NULL DEFAULT 1,
                        weight REAL NOT NULL DEFAULT 0,
                        brand TEXT NOT NULL DEFAULT '',
                        description TEXT NOT NULL DEFAULT '',
                        sale_price REAL NOT NULL DEFAULT 0,
                        total_price REAL NOT NULL DEFAULT 0,
                        last_updated_ms INTEGER NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE UNIQUE INDEX IF NOT EXISTS idx_results_key
                    ON results(normalized_key, client_key)
                    """);
            st.execute("""
                    CREATE INDEX IF NOT EXISTS idx_results_updated
                    ON results(last_updated_ms DESC)
                    """);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize results schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            // journal_mode is persistent in the file; the other pragmas come with every connection.
            st.execute("PRAGMA journal_mode=WAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "busy_timeout", String.valueOf(busyTimeoutMs));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
