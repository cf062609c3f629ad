package com.pipeline.cachingdb;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class CacheConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsPropertiesFile() throws IOException {
        Path file = tempDir.resolve("cachingdb.properties");
        Files.write(file, String.join("\n",
                "lmtdb.host=lmt.example.org",
                "lmtdb.user=reader",
                "lmtdb.password=pw",
                "lmtdb.database=filesystem_snx11168",
                "cache.file=/tmp/lmt.sqlite",
                "fetch.chunk.seconds=900").getBytes());

        CacheConfig config = CacheConfig.load(file.toString());

        assertEquals("lmt.example.org", config.getHost());
        assertEquals("/tmp/lmt.sqlite", config.getCacheFile());
        assertEquals(Duration.ofMinutes(15), config.getChunkWidth());
        assertNotNull(config.getRemoteCredentials());
        assertEquals("filesystem_snx11168", config.getRemoteCredentials().getDatabase());
        assertFalse(config.toString().contains("pw"));
    }

    @Test
    void missingFileFallsBackToDefaults() {
        CacheConfig config = CacheConfig.load(tempDir.resolve("absent.properties").toString());
        assertEquals(3600, config.getChunkSeconds());
        assertNull(config.getRemoteCredentials());
        assertNull(config.getCacheFile());
    }

    @Test
    void environmentFillsOnlyUnsetCredentials() {
        Properties props = new Properties();
        props.setProperty("lmtdb.host", "explicit-host");

        Map<String, String> env = new HashMap<>();
        env.put(CacheConfig.ENV_HOST, "env-host");
        env.put(CacheConfig.ENV_USER, "env-user");
        env.put(CacheConfig.ENV_PASSWORD, "env-pw");
        env.put(CacheConfig.ENV_DATABASE, "env-db");

        CacheConfig config = CacheConfig.fromProperties(props).withEnvironmentDefaults(env);

        assertEquals("explicit-host", config.getHost());
        assertEquals("env-user", config.getUser());
        assertEquals("env-db", config.getRemoteCredentials().getDatabase());
    }
}
