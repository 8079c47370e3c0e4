package com.ragsync.ingest;

import java.util.Map;

public record VectorRecord(String id, float[] values, Map<String, String> metadata) {
}
