package com.ragsync.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class KnowledgeBaseScanner {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseScanner.class);
    private static final String JSON_SUFFIX = ".json";

    private final ObjectMapper mapper = JsonMapper.builder().build();
    private final DocumentExtractor extractor;
    private final Chunker chunker;

    public KnowledgeBaseScanner(Chunker chunker) {
        this(new DocumentExtractor(), chunker);
    }

    KnowledgeBaseScanner(DocumentExtractor extractor, Chunker chunker) {
        this.extractor = extractor;
        this.chunker = chunker;
    }

    public List<DocumentChunk> scan(Path dataDir) throws IOException {
        if (!Files.exists(dataDir)) {
            throw new NoSuchFileException(dataDir.toString(), null, "Data directory does not exist");
        }
        if (!Files.isDirectory(dataDir)) {
            throw new NotDirectoryException(dataDir.toString());
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(dataDir)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(JSON_SUFFIX))
                    .sorted()
                    .toList();
        }

        List<DocumentChunk> chunks = new ArrayList<>();
        Set<String> seenBaseIds = new HashSet<>();
        for (Path file : files) {
            String fileName = file.getFileName().toString();
            String stem = fileName.substring(0, fileName.length() - JSON_SUFFIX.length());
            JsonNode payload = mapper.readTree(file.toFile());
            int before = chunks.size();
            extractor.extract(stem, payload).forEach(document -> {
                String baseId = uniqueBaseId(document.baseId(), seenBaseIds);
                List<String> pieces = chunker.split(document.text());
                for (int i = 0; i < pieces.size(); i++) {
                    String body = pieces.get(i);
                    chunks.add(new DocumentChunk(
                            baseId + ":" + (i + 1),
                            fileName,
                            document.topic(),
                            body,
                            ContentFingerprinter.fingerprint(body)));
                }
            });
            log.debug("Chunked {} into {} chunk(s)", fileName, chunks.size() - before);
        }
        return chunks;
    }

    private static String uniqueBaseId(String baseId, Set<String> seenBaseIds) {
        String candidate = baseId;
        int occurrence = 1;
        while (!seenBaseIds.add(candidate)) {
            occurrence++;
            candidate = baseId + "-" + occurrence;
        }
        if (occurrence > 1) {
            log.warn("Duplicate document id {} renamed to {}", baseId, candidate);
        }
        return candidate;
    }
}
