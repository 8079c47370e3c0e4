package com.ragsync.ingest;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LocalOnlyVectorSync implements VectorSync {
    private static final Logger log = LoggerFactory.getLogger(LocalOnlyVectorSync.class);

    @Override
    public boolean isLive() {
        return false;
    }

    @Override
    public void refresh(List<DocumentChunk> chunks) {
        if (!chunks.isEmpty()) {
            log.info("Skipping remote sync for {} chunk(s); the state store will still be updated.", chunks.size());
        }
    }

    @Override
    public void delete(List<String> ids) {
        if (!ids.isEmpty()) {
            log.info("Skipping remote delete of {} stale chunk(s).", ids.size());
        }
    }
}
