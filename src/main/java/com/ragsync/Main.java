package com.ragsync;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.ragsync.ingest.ChunkStateStore;
import com.ragsync.ingest.Chunker;
import com.ragsync.ingest.KnowledgeBaseScanner;
import com.ragsync.ingest.RemoteCallException;
import com.ragsync.ingest.StateStoreException;
import com.ragsync.ingest.StoredChunk;
import com.ragsync.ingest.SyncReport;
import com.ragsync.ingest.SyncService;
import com.ragsync.ingest.VectorSync;
import com.ragsync.ingest.VectorSyncs;
import com.ragsync.runtime.AppConfig;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "rag-sync",
        mixinStandardHelpOptions = true,
        version = "rag-sync 0.1.0",
        description = "Chunks JSON knowledge files, records them in SQLite and syncs changed chunks to a vector index.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG_ERROR = 2;
    static final int EXIT_INPUT_ERROR = 3;
    static final int EXIT_REMOTE_FAILURE = 4;
    static final int EXIT_STATE_FAILURE = 5;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "sync")
    Mode mode;

    @Option(names = "--data-dir", description = "Directory that contains the JSON knowledge files")
    Path dataDir;

    @Option(names = "--state-path", description = "Path to the SQLite file that stores chunk metadata")
    Path statePath;

    @Option(names = "--index-host", description = "Base vector index host URL")
    String indexHost;

    @Option(names = "--index-namespace", description = "Optional index namespace for the vectors")
    String indexNamespace;

    @Option(names = "--index-batch-size", description = "Batch size for index upserts and deletes")
    Integer indexBatchSize;

    @Option(names = "--chunk-size", description = "Maximum characters per chunk before splitting")
    Integer chunkSize;

    @Option(names = "--chunk-overlap", description = "Character overlap between sequential chunks")
    Integer chunkOverlap;

    @Option(names = "--skip-remote", description = "Only refresh the state store without calling the embedding or index services")
    boolean skipRemote;

    @Option(names = "--embedding-model", description = "Embedding model id")
    String embeddingModel;

    @Option(names = "--limit", description = "Number of random sample rows shown in inspect mode", defaultValue = "3")
    int sampleLimit;

    private final Map<String, String> environment;
    private final OkHttpClient httpClient;
    private final PrintStream out;

    enum Mode {
        sync,
        inspect
    }

    public Main() {
        this(System.getenv(), new OkHttpClient(), System.out);
    }

    Main(Map<String, String> environment, OkHttpClient httpClient, PrintStream out) {
        this.environment = environment;
        this.httpClient = httpClient;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            AppConfig config = resolveConfig();
            if (mode == Mode.inspect) {
                inspect(Path.of(config.getSync().getStatePath()));
            } else {
                runSync(config);
            }
            return EXIT_OK;
        } catch (IllegalArgumentException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (RemoteCallException e) {
            log.error("Remote sync failed, state store left unchanged: {}", e.getMessage());
            return EXIT_REMOTE_FAILURE;
        } catch (StateStoreException e) {
            log.error("State store failure: {}", e.getMessage(), e);
            return EXIT_STATE_FAILURE;
        } catch (IOException e) {
            log.error("Input error: {}", e.getMessage());
            return EXIT_INPUT_ERROR;
        }
    }

    AppConfig resolveConfig() throws IOException {
        AppConfig config = loadConfig(configPath).applyEnvironment(environment);
        AppConfig.SyncConfig sync = config.getSync();
        if (dataDir != null) {
            sync.setDataDir(dataDir.toString());
        }
        if (statePath != null) {
            sync.setStatePath(statePath.toString());
        }
        if (chunkSize != null) {
            sync.setChunkSize(chunkSize);
        }
        if (chunkOverlap != null) {
            sync.setChunkOverlap(chunkOverlap);
        }
        if (skipRemote) {
            sync.setSkipRemote(true);
        }
        if (indexHost != null) {
            config.getIndex().setHost(indexHost);
        }
        if (indexNamespace != null) {
            config.getIndex().setNamespace(indexNamespace);
        }
        if (indexBatchSize != null) {
            config.getIndex().setBatchSize(indexBatchSize);
        }
        if (embeddingModel != null) {
            config.getEmbedding().setModel(embeddingModel);
        }
        if (mode == Mode.sync) {
            config.validate();
        }
        return config;
    }

    private void runSync(AppConfig config) throws IOException {
        AppConfig.SyncConfig sync = config.getSync();
        VectorSync vectorSync = VectorSyncs.fromConfig(config, httpClient);
        SyncService service = new SyncService(
                new KnowledgeBaseScanner(new Chunker(sync.getChunkSize(), sync.getChunkOverlap())),
                new ChunkStateStore(Path.of(sync.getStatePath())),
                vectorSync);
        log.info("Starting sync dataDir={} statePath={} remote={}",
                sync.getDataDir(), sync.getStatePath(), vectorSync.isLive() ? "live" : "skipped");
        SyncReport report = service.sync(Path.of(sync.getDataDir()));
        log.info("Sync finished: total={} refreshed={} deleted={} unchanged={} remoteSynced={}",
                report.totalChunks(),
                report.refreshedChunks(),
                report.deletedChunks(),
                report.unchangedChunks(),
                report.remoteSynced());
    }

    private void inspect(Path storePath) throws IOException {
        ChunkStateStore.StateSummary summary = new ChunkStateStore(storePath).summarize(sampleLimit);
        out.printf("rows=%d%n", summary.rowCount());
        summary.rowsBySource().forEach((source, count) -> out.printf("  %s: %d%n", source, count));
        if (!summary.samples().isEmpty()) {
            out.println("sample rows:");
            for (StoredChunk chunk : summary.samples()) {
                out.printf("  %s (%s)%n", chunk.id(), chunk.topic());
            }
        }
    }

    private static AppConfig loadConfig(Path config) throws IOException {
        if (config == null || !Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try {
            return mapper.readValue(config.toFile(), AppConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid config file " + config + ": " + e.getOriginalMessage(), e);
        }
    }
}
