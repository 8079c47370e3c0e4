package com.ragsync.ingest;

public record SourceDocument(String baseId, String topic, String text) {
}
