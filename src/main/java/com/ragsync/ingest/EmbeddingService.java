package com.ragsync.ingest;

import java.io.IOException;
import java.util.List;

public interface EmbeddingService {
    /**
     * Embeds every text, returning one vector per input in the same order. Any failed request
     * aborts the whole call; no partial result is returned.
     */
    List<float[]> embed(List<String> texts) throws IOException;

    String model();
}
