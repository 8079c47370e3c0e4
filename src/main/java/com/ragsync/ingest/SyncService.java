package com.ragsync.ingest;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one synchronization pass: scan, diff, embed and upsert changed chunks, delete stale ones,
 * then rewrite the state store with the full chunk set.
 *
 * <p>The state store is written only after every remote call has succeeded. A run that fails
 * part-way leaves the previous state in place, so the next run derives the same diff again.
 */
public class SyncService {
    private static final Logger log = LoggerFactory.getLogger(SyncService.class);

    private final KnowledgeBaseScanner scanner;
    private final ChunkStateStore stateStore;
    private final VectorSync vectorSync;
    private final Clock clock;

    public SyncService(KnowledgeBaseScanner scanner, ChunkStateStore stateStore, VectorSync vectorSync) {
        this(scanner, stateStore, vectorSync, Clock.systemUTC());
    }

    SyncService(KnowledgeBaseScanner scanner, ChunkStateStore stateStore, VectorSync vectorSync, Clock clock) {
        this.scanner = scanner;
        this.stateStore = stateStore;
        this.vectorSync = vectorSync;
        this.clock = clock;
    }

    public SyncReport sync(Path dataDir) throws IOException {
        List<DocumentChunk> chunks = scanner.scan(dataDir);
        log.info("Discovered {} chunks from {}", chunks.size(), dataDir);

        Map<String, String> previous = stateStore.loadChecksums();
        ChunkDiff diff = ChunkDiff.compute(previous, chunks);
        if (!diff.toDelete().isEmpty()) {
            log.info("Detected {} stale chunk(s) to delete.", diff.toDelete().size());
        }
        log.info("{} chunk(s) need fresh embeddings and upserts.", diff.toRefresh().size());

        vectorSync.refresh(diff.toRefresh());
        vectorSync.delete(diff.toDelete());

        stateStore.replaceAll(chunks, clock.instant());
        log.info("State store updated at {}", stateStore.path().toAbsolutePath());

        return new SyncReport(
                chunks.size(),
                diff.toRefresh().size(),
                diff.toDelete().size(),
                diff.unchangedCount(),
                vectorSync.isLive());
    }
}
