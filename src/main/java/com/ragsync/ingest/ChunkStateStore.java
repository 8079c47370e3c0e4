package com.ragsync.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SQLite-backed record of the chunk set produced by the last successful run.
 *
 * <p>The table is replaced wholesale inside a single transaction, so readers either see the
 * previous run's rows or the new ones. Concurrent writers are not coordinated here.
 */
public class ChunkStateStore {
    private static final Logger log = LoggerFactory.getLogger(ChunkStateStore.class);

    static final String TABLE = "rag_chunks";

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS rag_chunks (
                id TEXT PRIMARY KEY,
                source TEXT NOT NULL,
                topic TEXT NOT NULL,
                body TEXT NOT NULL,
                checksum TEXT NOT NULL,
                updated_at TEXT NOT NULL
            )
            """;
    private static final String INSERT = """
            INSERT INTO rag_chunks (id, source, topic, body, checksum, updated_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private final Path path;

    public ChunkStateStore(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    public boolean exists() {
        return Files.exists(path);
    }

    public Map<String, String> loadChecksums() throws IOException {
        Map<String, String> checksums = new HashMap<>();
        if (!exists()) {
            return checksums;
        }
        try (Connection connection = open();
                Statement statement = connection.createStatement()) {
            if (!hasTable(connection)) {
                return checksums;
            }
            try (ResultSet rows = statement.executeQuery("SELECT id, checksum FROM rag_chunks")) {
                while (rows.next()) {
                    checksums.put(rows.getString("id"), rows.getString("checksum"));
                }
            }
            return checksums;
        } catch (SQLException e) {
            throw new StateStoreException(path, "load checksums", e);
        }
    }

    public Map<String, StoredChunk> loadAll() throws IOException {
        Map<String, StoredChunk> chunks = new LinkedHashMap<>();
        if (!exists()) {
            return chunks;
        }
        try (Connection connection = open();
                Statement statement = connection.createStatement()) {
            if (!hasTable(connection)) {
                return chunks;
            }
            try (ResultSet rows = statement.executeQuery(
                    "SELECT id, source, topic, body, checksum, updated_at FROM rag_chunks ORDER BY id")) {
                while (rows.next()) {
                    StoredChunk chunk = readChunk(rows);
                    chunks.put(chunk.id(), chunk);
                }
            }
            return chunks;
        } catch (SQLException e) {
            throw new StateStoreException(path, "load chunks", e);
        }
    }

    public void replaceAll(List<DocumentChunk> chunks, Instant updatedAt) throws IOException {
        if (path.getParent() != null) {
            try {
                Files.createDirectories(path.getParent());
            } catch (IOException e) {
                throw new StateStoreException(path, "create parent directory", e);
            }
        }
        String timestamp = DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(updatedAt.atOffset(ZoneOffset.UTC));
        try (Connection connection = open()) {
            connection.setAutoCommit(false);
            try {
                try (Statement statement = connection.createStatement()) {
                    statement.execute(CREATE_TABLE);
                    statement.executeUpdate("DELETE FROM rag_chunks");
                }
                // prepared only once the table exists; sqlite compiles the statement eagerly
                try (PreparedStatement insert = connection.prepareStatement(INSERT)) {
                    for (DocumentChunk chunk : chunks) {
                        insert.setString(1, chunk.id());
                        insert.setString(2, chunk.source());
                        insert.setString(3, chunk.topic());
                        insert.setString(4, chunk.body());
                        insert.setString(5, chunk.checksum());
                        insert.setString(6, timestamp);
                        insert.addBatch();
                    }
                    insert.executeBatch();
                }
                connection.commit();
            } catch (SQLException e) {
                rollback(connection, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new StateStoreException(path, "replace chunks", e);
        }
        log.debug("Replaced {} row(s) in {}", chunks.size(), path);
    }

    public StateSummary summarize(int sampleLimit) throws IOException {
        if (!exists()) {
            throw new NoSuchFileException(path.toString(), null, "State store is missing; run a sync first");
        }
        try (Connection connection = open()) {
            if (!hasTable(connection)) {
                return new StateSummary(0, Map.of(), List.of());
            }
            long rowCount = 0;
            Map<String, Long> rowsBySource = new LinkedHashMap<>();
            List<StoredChunk> samples = new ArrayList<>();
            try (Statement statement = connection.createStatement()) {
                try (ResultSet rows = statement.executeQuery("SELECT COUNT(*) FROM rag_chunks")) {
                    rows.next();
                    rowCount = rows.getLong(1);
                }
                try (ResultSet rows = statement.executeQuery(
                        "SELECT source, COUNT(*) FROM rag_chunks GROUP BY source ORDER BY source")) {
                    while (rows.next()) {
                        rowsBySource.put(rows.getString(1), rows.getLong(2));
                    }
                }
            }
            if (sampleLimit > 0) {
                try (PreparedStatement sample = connection.prepareStatement(
                        "SELECT id, source, topic, body, checksum, updated_at FROM rag_chunks ORDER BY RANDOM() LIMIT ?")) {
                    sample.setInt(1, sampleLimit);
                    try (ResultSet rows = sample.executeQuery()) {
                        while (rows.next()) {
                            samples.add(readChunk(rows));
                        }
                    }
                }
            }
            return new StateSummary(rowCount, rowsBySource, samples);
        } catch (SQLException e) {
            throw new StateStoreException(path, "summarize", e);
        }
    }

    private Connection open() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + path.toAbsolutePath());
    }

    private static boolean hasTable(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT name FROM sqlite_master WHERE type = 'table' AND name = ?")) {
            statement.setString(1, TABLE);
            try (ResultSet rows = statement.executeQuery()) {
                return rows.next();
            }
        }
    }

    private static StoredChunk readChunk(ResultSet rows) throws SQLException {
        return new StoredChunk(
                rows.getString("id"),
                rows.getString("source"),
                rows.getString("topic"),
                rows.getString("body"),
                rows.getString("checksum"),
                rows.getString("updated_at"));
    }

    private static void rollback(Connection connection, SQLException failure) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            failure.addSuppressed(rollbackFailure);
        }
    }

    public record StateSummary(long rowCount, Map<String, Long> rowsBySource, List<StoredChunk> samples) {
    }
}
