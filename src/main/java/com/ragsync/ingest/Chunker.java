package com.ragsync.ingest;

import java.util.ArrayList;
import java.util.List;

public class Chunker {
    private final int chunkSize;
    private final int overlap;

    public Chunker(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive but was " + chunkSize);
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap must not be negative but was " + overlap);
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    /**
     * Splits on code point positions, so a window never ends inside a surrogate pair.
     */
    public List<String> split(String text) {
        int length = text.codePointCount(0, text.length());
        if (length <= chunkSize) {
            return List.of(text.strip());
        }

        int[] offsets = codePointOffsets(text, length);
        List<String> chunks = new ArrayList<>();
        int start = 0;
        int end = chunkSize;
        while (start < length) {
            String chunk = text.substring(offsets[start], offsets[end]).strip();
            if (!chunk.isEmpty()) {
                chunks.add(chunk);
            }
            if (end >= length) {
                break;
            }
            // always move forward, even when the overlap swallows the whole window
            start = Math.max(end - overlap, start + 1);
            end = Math.min(length, start + chunkSize);
        }
        return chunks;
    }

    private static int[] codePointOffsets(String text, int codePoints) {
        int[] offsets = new int[codePoints + 1];
        int index = 0;
        for (int i = 0; i < codePoints; i++) {
            offsets[i] = index;
            index += Character.charCount(text.codePointAt(index));
        }
        offsets[codePoints] = text.length();
        return offsets;
    }
}
