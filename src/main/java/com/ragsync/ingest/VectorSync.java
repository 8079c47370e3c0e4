package com.ragsync.ingest;

import java.io.IOException;
import java.util.List;

/**
 * What a sync run may do to the remote vector index. Chosen once at startup: either a live pair of
 * embedding service and index, or a local-only stand-in that leaves the index untouched.
 */
public interface VectorSync {
    boolean isLive();

    void refresh(List<DocumentChunk> chunks) throws IOException;

    void delete(List<String> ids) throws IOException;
}
