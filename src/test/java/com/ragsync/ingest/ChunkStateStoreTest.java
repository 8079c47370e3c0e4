package com.ragsync.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ChunkStateStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReadMissingStoreAsEmptyState() throws Exception {
        ChunkStateStore store = new ChunkStateStore(tempDir.resolve("missing.db"));

        assertTrue(store.loadChecksums().isEmpty());
        assertTrue(store.loadAll().isEmpty());
        assertFalse(Files.exists(tempDir.resolve("missing.db")));
    }

    @Test
    void shouldReadStoreWithoutTableAsEmptyState() throws Exception {
        Path db = tempDir.resolve("other.db");
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + db);
                Statement statement = connection.createStatement()) {
            statement.execute("CREATE TABLE unrelated (id TEXT)");
        }

        assertTrue(new ChunkStateStore(db).loadChecksums().isEmpty());
    }

    @Test
    void shouldReplaceAllRowsWithNewChunkSet() throws Exception {
        ChunkStateStore store = new ChunkStateStore(tempDir.resolve("nested/dir/rag_chunks.db"));
        store.replaceAll(List.of(chunk("a:1", "one"), chunk("b:1", "two")), Instant.parse("2026-01-01T00:00:00Z"));

        store.replaceAll(List.of(chunk("a:1", "uno"), chunk("c:1", "three")), Instant.parse("2026-01-02T10:15:30Z"));

        assertEquals(Map.of(
                "a:1", ContentFingerprinter.fingerprint("uno"),
                "c:1", ContentFingerprinter.fingerprint("three")),
                store.loadChecksums());
        StoredChunk stored = store.loadAll().get("c:1");
        assertEquals("three", stored.body());
        assertEquals("faq.json", stored.source());
        assertEquals("Topic", stored.topic());
        assertEquals("2026-01-02T10:15:30Z", stored.updatedAt());
    }

    @Test
    void shouldCreateStoreFromMissingFileAndReplaceItAgain() throws Exception {
        Path db = tempDir.resolve("fresh.db");
        ChunkStateStore store = new ChunkStateStore(db);

        store.replaceAll(List.of(chunk("a:1", "one")), Instant.EPOCH);

        assertTrue(Files.exists(db));
        assertEquals(Map.of("a:1", ContentFingerprinter.fingerprint("one")), store.loadChecksums());

        store.replaceAll(List.of(chunk("b:1", "two")), Instant.EPOCH);

        assertEquals(Map.of("b:1", ContentFingerprinter.fingerprint("two")), store.loadChecksums());
    }

    @Test
    void shouldReportUncreatableParentDirectoryAsStateStoreFailure() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
        ChunkStateStore store = new ChunkStateStore(blocker.resolve("rag_chunks.db"));

        assertThrows(StateStoreException.class, () -> store.replaceAll(List.of(chunk("a:1", "one")), Instant.EPOCH));
    }

    @Test
    void shouldKeepPreviousRowsWhenReplacementFails() throws Exception {
        ChunkStateStore store = new ChunkStateStore(tempDir.resolve("rag_chunks.db"));
        store.replaceAll(List.of(chunk("a:1", "one")), Instant.EPOCH);

        List<DocumentChunk> duplicated = List.of(chunk("x:1", "first"), chunk("x:1", "second"));

        assertThrows(StateStoreException.class, () -> store.replaceAll(duplicated, Instant.EPOCH));
        assertEquals(Map.of("a:1", ContentFingerprinter.fingerprint("one")), store.loadChecksums());
    }

    @Test
    void shouldSummarizeRowsPerSource() throws Exception {
        ChunkStateStore store = new ChunkStateStore(tempDir.resolve("rag_chunks.db"));
        store.replaceAll(List.of(
                new DocumentChunk("faq-a:1", "faq.json", "A", "a", "h1"),
                new DocumentChunk("faq-b:1", "faq.json", "B", "b", "h2"),
                new DocumentChunk("cv-all:1", "cv.json", "cv", "c", "h3")), Instant.EPOCH);

        ChunkStateStore.StateSummary summary = store.summarize(2);

        assertEquals(3, summary.rowCount());
        assertEquals(List.of("cv.json", "faq.json"), List.copyOf(summary.rowsBySource().keySet()));
        assertEquals(2L, summary.rowsBySource().get("faq.json"));
        assertEquals(2, summary.samples().size());
    }

    @Test
    void shouldRefuseToSummarizeMissingStore() {
        ChunkStateStore store = new ChunkStateStore(tempDir.resolve("absent.db"));

        assertThrows(NoSuchFileException.class, () -> store.summarize(3));
    }

    private static DocumentChunk chunk(String id, String body) {
        return new DocumentChunk(id, "faq.json", "Topic", body, ContentFingerprinter.fingerprint(body));
    }
}
