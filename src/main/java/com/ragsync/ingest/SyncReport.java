package com.ragsync.ingest;

public record SyncReport(int totalChunks, int refreshedChunks, int deletedChunks, int unchangedChunks, boolean remoteSynced) {
}
