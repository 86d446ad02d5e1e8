package io.herald.core.ledger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.Objects;

public final class SqliteDedupLedger implements DedupLedger {
    private final String jdbcUrl;
    private final Clock clock;

    public SqliteDedupLedger(Path dbPath) throws LedgerStorageException {
        this(dbPath, Clock.systemUTC());
    }

    public SqliteDedupLedger(Path dbPath, Clock clock) throws LedgerStorageException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        try {
            Files.createDirectories(dbPath.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new LedgerStorageException("Failed to create ledger directory for " + dbPath, e);
        }
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        init();
    }

    @Override
    public synchronized boolean contains(String key) throws LedgerStorageException {
        String sql = "SELECT 1 FROM published_keys WHERE key = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, DedupLedger.normalizeKey(key));
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next();
            }
        } catch (SQLException e) {
            throw new LedgerStorageException("Failed to query dedup ledger", e);
        }
    }

    @Override
    public synchronized boolean record(String key) throws LedgerStorageException {
        String sql = """
            INSERT OR IGNORE INTO published_keys (key, recorded_at)
            VALUES (?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            connection.setAutoCommit(false);
            statement.setString(1, DedupLedger.normalizeKey(key));
            statement.setString(2, clock.instant().toString());
            int inserted = statement.executeUpdate();
            connection.commit();
            return inserted > 0;
        } catch (SQLException e) {
            throw new LedgerStorageException("Failed to record key in dedup ledger", e);
        }
    }

    @Override
    public synchronized int size() throws LedgerStorageException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT COUNT(*) FROM published_keys")) {
            return resultSet.next() ? resultSet.getInt(1) : 0;
        } catch (SQLException e) {
            throw new LedgerStorageException("Failed to count dedup ledger entries", e);
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=FULL;");
        }
        return connection;
    }

    private void init() throws LedgerStorageException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS published_keys (
                key TEXT PRIMARY KEY,
                recorded_at TEXT NOT NULL
            )
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
        } catch (SQLException e) {
            throw new LedgerStorageException("Failed to initialize SQLite dedup ledger", e);
        }
    }
}
