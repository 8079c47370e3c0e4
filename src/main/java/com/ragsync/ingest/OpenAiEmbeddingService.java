package com.ragsync.ingest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class OpenAiEmbeddingService implements EmbeddingService {
    static final String SERVICE = "Embedding";

    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingService.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final int batchSize;

    public OpenAiEmbeddingService(OkHttpClient httpClient, String endpoint, String apiKey, String model, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive but was " + batchSize);
        }
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.model = model;
        this.batchSize = batchSize;
    }

    @Override
    public List<float[]> embed(List<String> texts) throws IOException {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (List<String> batch : Batches.of(texts, batchSize)) {
            vectors.addAll(embedBatch(batch));
        }
        return vectors;
    }

    @Override
    public String model() {
        return model;
    }

    private List<float[]> embedBatch(List<String> batch) throws IOException {
        ObjectNode payload = mapper.createObjectNode().put("model", model);
        ArrayNode input = payload.putArray("input");
        batch.forEach(input::add);

        Request request = new Request.Builder()
                .url(endpoint)
                .header("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
                .build();
        int status;
        String text;
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            status = response.code();
            text = body == null ? "" : body.string();
        } catch (IOException e) {
            throw new RemoteCallException(SERVICE, "transport failure: " + e.getMessage(), e);
        }
        if (status < 200 || status >= 300) {
            log.debug("Embedding request failed status={} batchSize={} body={}", status, batch.size(), text);
            throw new RemoteCallException(SERVICE, status, text);
        }
        JsonNode data;
        try {
            data = mapper.readTree(text).path("data");
        } catch (JsonProcessingException e) {
            throw new RemoteCallException(SERVICE, "malformed response: " + e.getOriginalMessage(), e);
        }
        if (!data.isArray() || data.size() != batch.size()) {
            throw new RemoteCallException(SERVICE,
                    "expected " + batch.size() + " embedding(s) but received " + (data.isArray() ? data.size() : 0));
        }
        List<float[]> vectors = new ArrayList<>(batch.size());
        for (JsonNode item : data) {
            vectors.add(toVector(item.path("embedding")));
        }
        return vectors;
    }

    private static float[] toVector(JsonNode vectorNode) throws RemoteCallException {
        if (!vectorNode.isArray()) {
            throw new RemoteCallException(SERVICE, "embedding entry without a vector");
        }
        float[] out = new float[vectorNode.size()];
        for (int i = 0; i < vectorNode.size(); i++) {
            out[i] = (float) vectorNode.get(i).asDouble();
        }
        return out;
    }
}
