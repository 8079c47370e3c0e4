package com.ragsync.runtime;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    public static final String ENV_EMBEDDING_API_KEY = "OPENAI_API_KEY";
    public static final String ENV_EMBEDDING_MODEL = "OPENAI_EMBEDDING_MODEL";
    public static final String ENV_INDEX_API_KEY = "PINECONE_API_KEY";
    public static final String ENV_INDEX_HOST = "PINECONE_HOST";
    public static final String ENV_INDEX_NAMESPACE = "PINECONE_NAMESPACE";

    private SyncConfig sync = new SyncConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private IndexConfig index = new IndexConfig();

    public SyncConfig getSync() {
        return sync;
    }

    public void setSync(SyncConfig sync) {
        this.sync = sync == null ? new SyncConfig() : sync;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public IndexConfig getIndex() {
        return index;
    }

    public void setIndex(IndexConfig index) {
        this.index = index == null ? new IndexConfig() : index;
    }

    public AppConfig applyEnvironment(Map<String, String> environment) {
        String embeddingKey = environment.get(ENV_EMBEDDING_API_KEY);
        if (!isBlank(embeddingKey)) {
            embedding.setApiKey(embeddingKey);
        }
        String model = environment.get(ENV_EMBEDDING_MODEL);
        if (!isBlank(model)) {
            embedding.setModel(model);
        }
        String indexKey = environment.get(ENV_INDEX_API_KEY);
        if (!isBlank(indexKey)) {
            index.setApiKey(indexKey);
        }
        String host = environment.get(ENV_INDEX_HOST);
        if (!isBlank(host)) {
            index.setHost(host);
        }
        String namespace = environment.get(ENV_INDEX_NAMESPACE);
        if (!isBlank(namespace)) {
            index.setNamespace(namespace);
        }
        return this;
    }

    public void validate() {
        if (sync.getChunkSize() <= 0) {
            throw new IllegalArgumentException("chunk size must be positive but was " + sync.getChunkSize());
        }
        if (sync.getChunkOverlap() < 0 || sync.getChunkOverlap() >= sync.getChunkSize()) {
            throw new IllegalArgumentException("chunk overlap must be in [0, " + sync.getChunkSize()
                    + ") but was " + sync.getChunkOverlap());
        }
        if (sync.isSkipRemote()) {
            return;
        }
        if (embedding.getBatchSize() <= 0 || index.getBatchSize() <= 0) {
            throw new IllegalArgumentException("batch sizes must be positive (embedding="
                    + embedding.getBatchSize() + ", index=" + index.getBatchSize() + ")");
        }
        if (isBlank(embedding.getApiKey())) {
            throw new IllegalArgumentException(ENV_EMBEDDING_API_KEY
                    + " is required to build embeddings unless --skip-remote is set.");
        }
        if (isBlank(index.getApiKey())) {
            throw new IllegalArgumentException(ENV_INDEX_API_KEY + " is required unless --skip-remote is set.");
        }
        if (isBlank(index.getHost())) {
            throw new IllegalArgumentException(ENV_INDEX_HOST
                    + " must be provided (option or environment) unless --skip-remote is set.");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SyncConfig {
        private String dataDir = "static/data";
        private String statePath = "static/data/rag_chunks.db";
        private int chunkSize = 900;
        private int chunkOverlap = 150;
        private boolean skipRemote = false;

        public String getDataDir() {
            return dataDir;
        }

        public void setDataDir(String dataDir) {
            this.dataDir = dataDir;
        }

        public String getStatePath() {
            return statePath;
        }

        public void setStatePath(String statePath) {
            this.statePath = statePath;
        }

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getChunkOverlap() {
            return chunkOverlap;
        }

        public void setChunkOverlap(int chunkOverlap) {
            this.chunkOverlap = chunkOverlap;
        }

        public boolean isSkipRemote() {
            return skipRemote;
        }

        public void setSkipRemote(boolean skipRemote) {
            this.skipRemote = skipRemote;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String endpoint = "https://api.openai.com/v1/embeddings";
        private String model = "text-embedding-3-small";
        private String apiKey;
        private int batchSize = 32;
        private int timeoutSeconds = 60;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexConfig {
        private String host;
        private String namespace;
        private String apiKey;
        private int batchSize = 32;
        private int timeoutSeconds = 60;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }
}
