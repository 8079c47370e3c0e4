package com.ragsync.ingest;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.ragsync.runtime.AppConfig;

import okhttp3.OkHttpClient;

class VectorSyncsTest {

    @Test
    void shouldChooseLocalOnlySyncWhenRemoteIsSkipped() {
        AppConfig config = new AppConfig();
        config.getSync().setSkipRemote(true);

        VectorSync sync = VectorSyncs.fromConfig(config, new OkHttpClient());

        assertInstanceOf(LocalOnlyVectorSync.class, sync);
        assertFalse(sync.isLive());
    }

    @Test
    void shouldWireRemoteClientsFromConfig() {
        AppConfig config = new AppConfig().applyEnvironment(Map.of(
                "OPENAI_API_KEY", "sk",
                "PINECONE_API_KEY", "pc",
                "PINECONE_HOST", "https://index.test"));

        VectorSync sync = VectorSyncs.fromConfig(config, new OkHttpClient());

        assertInstanceOf(RemoteVectorSync.class, sync);
        assertTrue(sync.isLive());
    }
}
