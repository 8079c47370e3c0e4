package com.ragsync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ragsync.ingest.ChunkStateStore;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Response;
import okhttp3.ResponseBody;
import picocli.CommandLine;

class MainTest {

    @TempDir
    Path tempDir;

    private Path dataDir;
    private Path statePath;
    private Path configPath;
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws IOException {
        dataDir = Files.createDirectories(tempDir.resolve("data"));
        statePath = tempDir.resolve("rag_chunks.db");
        configPath = tempDir.resolve("absent.yml");
        Files.writeString(dataDir.resolve("faq.json"), "[{\"question\": \"What is X?\", \"answer\": \"A thing.\"}]");
        Files.writeString(dataDir.resolve("jobs.json"), "[{\"company\": \"Acme\"}, {\"company\": \"Initech\"}]");
    }

    @Test
    void shouldRefreshLocalStateWhenRemoteSyncIsSkipped() throws Exception {
        int exitCode = execute(Map.of(), "--skip-remote");

        assertEquals(Main.EXIT_OK, exitCode);
        assertEquals(3, new ChunkStateStore(statePath).loadChecksums().size());
    }

    @Test
    void shouldFailWithConfigErrorWhenCredentialsAreMissing() {
        int exitCode = execute(Map.of());

        assertEquals(Main.EXIT_CONFIG_ERROR, exitCode);
        assertFalse(Files.exists(statePath));
    }

    @Test
    void shouldRejectOverlapNotSmallerThanChunkSize() {
        int exitCode = execute(Map.of(), "--skip-remote", "--chunk-size", "100", "--chunk-overlap", "100");

        assertEquals(Main.EXIT_CONFIG_ERROR, exitCode);
    }

    @Test
    void shouldFailWithInputErrorWhenDataDirectoryIsMissing() {
        int exitCode = new CommandLine(new Main(Map.of(), new OkHttpClient(), quietOut())).execute(
                "--config", configPath.toString(),
                "--data-dir", tempDir.resolve("nowhere").toString(),
                "--state-path", statePath.toString(),
                "--skip-remote");

        assertEquals(Main.EXIT_INPUT_ERROR, exitCode);
    }

    @Test
    void shouldExitWithRemoteFailureAndKeepStateUntouched() {
        OkHttpClient failingHttp = new OkHttpClient.Builder()
                .addInterceptor(chain -> new Response.Builder()
                        .request(chain.request())
                        .protocol(Protocol.HTTP_1_1)
                        .code(401)
                        .message("Unauthorized")
                        .body(ResponseBody.create("{\"error\":\"bad key\"}", MediaType.parse("application/json")))
                        .build())
                .build();
        Map<String, String> environment = Map.of(
                "OPENAI_API_KEY", "sk",
                "PINECONE_API_KEY", "pc",
                "PINECONE_HOST", "https://index.test");

        int exitCode = new CommandLine(new Main(environment, failingHttp, quietOut())).execute(
                "--config", configPath.toString(),
                "--data-dir", dataDir.toString(),
                "--state-path", statePath.toString());

        assertEquals(Main.EXIT_REMOTE_FAILURE, exitCode);
        assertFalse(Files.exists(statePath));
    }

    @Test
    void shouldExitWithRemoteFailureWhenHostIsUnreachable() {
        OkHttpClient unreachable = new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    throw new ConnectException("Failed to connect to index.test");
                })
                .build();
        Map<String, String> environment = Map.of(
                "OPENAI_API_KEY", "sk",
                "PINECONE_API_KEY", "pc",
                "PINECONE_HOST", "https://index.test");

        int exitCode = new CommandLine(new Main(environment, unreachable, quietOut())).execute(
                "--config", configPath.toString(),
                "--data-dir", dataDir.toString(),
                "--state-path", statePath.toString());

        assertEquals(Main.EXIT_REMOTE_FAILURE, exitCode);
        assertFalse(Files.exists(statePath));
    }

    @Test
    void shouldPrintStateSummaryInInspectMode() {
        assertEquals(Main.EXIT_OK, execute(Map.of(), "--skip-remote"));

        int exitCode = new CommandLine(new Main(Map.of(), new OkHttpClient(), new PrintStream(output, true, StandardCharsets.UTF_8)))
                .execute("--config", configPath.toString(), "--mode", "inspect", "--state-path", statePath.toString(), "--limit", "1");

        String printed = output.toString(StandardCharsets.UTF_8);
        assertEquals(Main.EXIT_OK, exitCode);
        assertTrue(printed.contains("rows=3"));
        assertTrue(printed.contains("  faq.json: 1"));
        assertTrue(printed.contains("  jobs.json: 2"));
        assertTrue(printed.contains("sample rows:"));
    }

    @Test
    void shouldReportMissingStoreInInspectMode() {
        int exitCode = new CommandLine(new Main(Map.of(), new OkHttpClient(), quietOut()))
                .execute("--config", configPath.toString(), "--mode", "inspect", "--state-path", statePath.toString());

        assertEquals(Main.EXIT_INPUT_ERROR, exitCode);
    }

    private int execute(Map<String, String> environment, String... extraArgs) {
        String[] base = {
                "--config", configPath.toString(),
                "--data-dir", dataDir.toString(),
                "--state-path", statePath.toString() };
        String[] args = new String[base.length + extraArgs.length];
        System.arraycopy(base, 0, args, 0, base.length);
        System.arraycopy(extraArgs, 0, args, base.length, extraArgs.length);
        return new CommandLine(new Main(environment, new OkHttpClient(), quietOut())).execute(args);
    }

    private PrintStream quietOut() {
        return new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
    }
}
