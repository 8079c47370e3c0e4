package com.ragsync.ingest;

import java.time.Duration;

import com.ragsync.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class VectorSyncs {
    private VectorSyncs() {
    }

    public static VectorSync fromConfig(AppConfig config, OkHttpClient httpClient) {
        if (config.getSync().isSkipRemote()) {
            return new LocalOnlyVectorSync();
        }
        AppConfig.EmbeddingConfig embedding = config.getEmbedding();
        AppConfig.IndexConfig index = config.getIndex();
        OkHttpClient embeddingHttp = httpClient.newBuilder()
                .callTimeout(Duration.ofSeconds(embedding.getTimeoutSeconds()))
                .build();
        OkHttpClient indexHttp = httpClient.newBuilder()
                .callTimeout(Duration.ofSeconds(index.getTimeoutSeconds()))
                .build();
        return new RemoteVectorSync(
                new OpenAiEmbeddingService(embeddingHttp,
                        embedding.getEndpoint(),
                        embedding.getApiKey(),
                        embedding.getModel(),
                        embedding.getBatchSize()),
                new PineconeIndexClient(indexHttp,
                        index.getHost(),
                        index.getApiKey(),
                        index.getNamespace(),
                        index.getBatchSize()));
    }
}
