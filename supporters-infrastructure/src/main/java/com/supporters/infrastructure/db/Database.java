package com.supporters.infrastructure.db;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * SQLite connection factory for the payment ledger.
 */
public final class Database {

    public static final String URL_PREFIX = "jdbc:sqlite:";

    private final String url;

    public Database(String url) {
        this.url = Objects.requireNonNull(url, "url");
        if (!url.startsWith(URL_PREFIX)) {
            throw new IllegalArgumentException("Only SQLite URLs are supported: " + url);
        }
    }

    public static Database forFile(Path file) {
        return new Database(URL_PREFIX + file.toAbsolutePath());
    }

    public String url() {
        return url;
    }

    public Connection getConnection() {
        try {
            ensureParentDir();
            Connection c = DriverManager.getConnection(url);

            try (Statement st = c.createStatement()) {
                st.execute("PRAGMA journal_mode=WAL;");
            }

            return c;
        } catch (SQLException e) {
            throw new LedgerAccessException("Failed to connect to SQLite: " + url, e);
        }
    }

    /** Schema initialization (payments + indexes). Idempotent. */
    public void initSchema() {
        String sql = """
        CREATE TABLE IF NOT EXISTS payments (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          date TEXT NOT NULL,
          entity TEXT NOT NULL,
          payee TEXT,
          program TEXT,
          amount TEXT
        );

        CREATE INDEX IF NOT EXISTS idx_payments_entity ON payments(entity);
        CREATE INDEX IF NOT EXISTS idx_payments_date ON payments(date);
        """;

        try (Connection c = getConnection(); Statement st = c.createStatement()) {
            st.executeUpdate(sql);
        } catch (SQLException e) {
            throw new LedgerAccessException("initSchema() error", e);
        }
    }

    private void ensureParentDir() {
        String path = url.substring(URL_PREFIX.length());
        if (path.isBlank() || path.startsWith(":memory:") || path.startsWith("file:")) return;
        Path parent = Path.of(path).toAbsolutePath().getParent();
        if (parent == null) return;
        try {
            Files.createDirectories(parent);
        } catch (Exception e) {
            throw new LedgerAccessException("Failed to create directory " + parent, e);
        }
    }
}
