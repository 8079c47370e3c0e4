package com.ragsync.ingest;

public record DocumentChunk(String id, String source, String topic, String body, String checksum) {
}
