package me.internalizable.relay.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelayConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileIsCreatedWithDefaults() throws IOException {
        Path path = tempDir.resolve("conf/relay.yml");

        RelayConfig config = RelayConfig.load(path);

        assertTrue(Files.exists(path));
        assertEquals(500, config.getDefaultDebounceMs());
        assertEquals(5000, config.getGracePeriodMs());
        assertEquals(2000, config.getRetryInitialDelayMs());
        assertEquals(30_000, config.getRetryMaxDelayMs());
        assertEquals(0, config.getMaxRetryAttempts());
        assertFalse(config.isRedisEnabled());

        String written = Files.readString(path);
        assertTrue(written.startsWith("# Relay Change Feed Configuration"));
        assertFalse(written.contains("redisPassword"));
        assertTrue(written.indexOf("defaultDebounceMs") < written.indexOf("redisHost"));
    }

    @Test
    void savedValuesAreLoadedBack() throws IOException {
        Path path = tempDir.resolve("relay.yml");
        RelayConfig config = new RelayConfig();
        config.setGracePeriodMs(1500);
        config.setRetryMultiplier(3.0);
        config.setDebugLogging(true);
        config.setRedisChannelPrefix("cdc:");
        config.save(path);

        RelayConfig loaded = RelayConfig.load(path);

        assertEquals(1500, loaded.getGracePeriodMs());
        assertEquals(3.0, loaded.getRetryMultiplier());
        assertTrue(loaded.isDebugLogging());
        assertEquals("cdc:", loaded.getRedisChannelPrefix());
        assertNull(loaded.getRedisPassword());
    }

    @Test
    void partialFileKeepsDefaultsForTheRest() throws IOException {
        Path path = tempDir.resolve("relay.yml");
        Files.writeString(path, "defaultDebounceMs: 250\nredisEnabled: true\nredisHost: cache.internal\n");

        RelayConfig config = RelayConfig.load(path);

        assertEquals(250, config.getDefaultDebounceMs());
        assertTrue(config.isRedisEnabled());
        assertEquals("cache.internal", config.getRedisHost());
        assertEquals(6379, config.getRedisPort());
        assertEquals(10, config.getChannelTimeoutSeconds());
    }

    @Test
    void emptyFileYieldsDefaults() throws IOException {
        Path path = tempDir.resolve("relay.yml");
        Files.writeString(path, "");

        assertEquals(500, RelayConfig.load(path).getDefaultDebounceMs());
    }
}
