package com.ragsync.ingest;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Classification of the current chunk set against the last persisted state.
 *
 * @param toRefresh chunks that are new or whose checksum changed, in scan order
 * @param toDelete previously known ids that are no longer produced, sorted
 * @param unchangedCount chunks whose id and checksum both match the persisted state
 */
public record ChunkDiff(List<DocumentChunk> toRefresh, List<String> toDelete, int unchangedCount) {

    public static ChunkDiff compute(Map<String, String> previousChecksums, List<DocumentChunk> current) {
        Set<String> currentIds = current.stream()
                .map(DocumentChunk::id)
                .collect(Collectors.toSet());
        List<String> toDelete = previousChecksums.keySet().stream()
                .filter(id -> !currentIds.contains(id))
                .sorted()
                .toList();
        List<DocumentChunk> toRefresh = current.stream()
                .filter(chunk -> !chunk.checksum().equals(previousChecksums.get(chunk.id())))
                .toList();
        return new ChunkDiff(toRefresh, toDelete, current.size() - toRefresh.size());
    }

    public boolean isEmpty() {
        return toRefresh.isEmpty() && toDelete.isEmpty();
    }
}
