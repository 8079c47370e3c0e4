package com.ragsync.ingest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RemoteVectorSync implements VectorSync {
    private static final Logger log = LoggerFactory.getLogger(RemoteVectorSync.class);

    private final EmbeddingService embeddingService;
    private final VectorIndex index;

    public RemoteVectorSync(EmbeddingService embeddingService, VectorIndex index) {
        this.embeddingService = embeddingService;
        this.index = index;
    }

    @Override
    public boolean isLive() {
        return true;
    }

    @Override
    public void refresh(List<DocumentChunk> chunks) throws IOException {
        if (chunks.isEmpty()) {
            log.info("No embeddings need to be refreshed.");
            return;
        }
        List<String> bodies = chunks.stream().map(DocumentChunk::body).toList();
        List<float[]> vectors = embeddingService.embed(bodies);
        if (vectors.size() != chunks.size()) {
            throw new RemoteCallException(OpenAiEmbeddingService.SERVICE,
                    "expected " + chunks.size() + " embedding(s) but received " + vectors.size());
        }
        log.debug("Embedded {} chunk(s) with model {}", chunks.size(), embeddingService.model());

        List<VectorRecord> records = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            DocumentChunk chunk = chunks.get(i);
            records.add(new VectorRecord(chunk.id(), vectors.get(i), Map.of(
                    "source", chunk.source(),
                    "topic", chunk.topic(),
                    "checksum", chunk.checksum())));
        }
        index.upsert(records);
    }

    @Override
    public void delete(List<String> ids) throws IOException {
        index.delete(ids);
    }
}
