package com.ragsync.ingest;

import java.io.IOException;
import java.util.List;

public interface VectorIndex {
    void upsert(List<VectorRecord> vectors) throws IOException;

    void delete(List<String> ids) throws IOException;
}
