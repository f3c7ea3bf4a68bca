package de.bsommerfeld.marketscope.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldWriteDefaultsWhenFileIsMissing() throws Exception {
        Path file = tempDir.resolve("nested").resolve("config.toml");

        GlobalConfig config = ConfigLoader.load(file);

        assertTrue(Files.exists(file));
        assertEquals(24, config.getStore().getCacheTtlHours());
    }

    @Test
    void load_shouldReadValuesWrittenBySave() throws Exception {
        Path file = tempDir.resolve("config.toml");
        var config = new GlobalConfig();
        config.setDebugMode(true);
        config.getStore().setCacheTtlHours(6);
        config.getStore().setDatabaseFile("custom.db");
        config.getResearch().setSingleFlight(false);

        ConfigLoader.save(config, file);
        GlobalConfig loaded = ConfigLoader.load(file);

        assertTrue(loaded.isDebugMode());
        assertEquals(6, loaded.getStore().getCacheTtlHours());
        assertEquals("custom.db", loaded.getStore().getDatabaseFile());
        assertFalse(loaded.getResearch().isSingleFlight());
    }

    @Test
    void load_shouldKeepDefaultsForMissingKeysAndIgnoreUnknownOnes() throws Exception {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, """
                legacy-key = "whatever"

                [store]
                cache-ttl-hours = 12
                """);

        GlobalConfig loaded = ConfigLoader.load(file);

        assertEquals(12, loaded.getStore().getCacheTtlHours());
        assertEquals("market-research.db", loaded.getStore().getDatabaseFile());
        assertEquals(30, loaded.getResearch().getConfirmationWindowSeconds());
    }
}
