package com.ragsync.ingest;

import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Writes vectors to a Pinecone-compatible index over its REST data plane. Upserts and deletes are
 * sent in fixed-size batches, scoped to the namespace when one is configured.
 */
public class PineconeIndexClient implements VectorIndex {
    static final String SERVICE = "Vector index";

    private static final Logger log = LoggerFactory.getLogger(PineconeIndexClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String apiKey;
    private final String namespace;
    private final int batchSize;

    public PineconeIndexClient(OkHttpClient httpClient, String host, String apiKey, String namespace, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive but was " + batchSize);
        }
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.baseUrl = stripTrailingSlashes(host);
        this.apiKey = apiKey;
        this.namespace = namespace == null || namespace.isBlank() ? null : namespace;
        this.batchSize = batchSize;
    }

    @Override
    public void upsert(List<VectorRecord> vectors) throws IOException {
        if (vectors.isEmpty()) {
            return;
        }
        log.info("Upserting {} vector(s) to the index...", vectors.size());
        for (List<VectorRecord> batch : Batches.of(vectors, batchSize)) {
            ObjectNode payload = mapper.createObjectNode();
            payload.set("vectors", mapper.valueToTree(batch));
            post("/vectors/upsert", payload, "upsert");
        }
    }

    @Override
    public void delete(List<String> ids) throws IOException {
        if (ids.isEmpty()) {
            return;
        }
        log.info("Deleting {} vector(s) from the index...", ids.size());
        for (List<String> batch : Batches.of(ids, batchSize)) {
            ObjectNode payload = mapper.createObjectNode();
            payload.set("ids", mapper.valueToTree(batch));
            post("/vectors/delete", payload, "delete");
        }
    }

    private void post(String path, ObjectNode payload, String operation) throws IOException {
        if (namespace != null) {
            payload.put("namespace", namespace);
        }
        Request request = new Request.Builder()
                .url(baseUrl + path)
                .header("Api-Key", apiKey)
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
                .build();
        int status;
        String text;
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            status = response.code();
            text = body == null ? "" : body.string();
        } catch (IOException e) {
            throw new RemoteCallException(SERVICE + " " + operation, "transport failure: " + e.getMessage(), e);
        }
        if (status < 200 || status >= 300) {
            log.debug("Index {} failed status={} body={}", operation, status, text);
            throw new RemoteCallException(SERVICE + " " + operation, status, text);
        }
    }

    private static String stripTrailingSlashes(String host) {
        String trimmed = host.strip();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
