package com.ragsync.ingest;

public record StoredChunk(String id, String source, String topic, String body, String checksum, String updatedAt) {
}
