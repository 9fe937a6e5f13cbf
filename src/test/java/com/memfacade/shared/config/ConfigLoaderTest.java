package com.memfacade.shared.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private MemFacadeConfig writeAndLoad(String yaml, Map<String, String> env) throws IOException {
        var file = tempDir.resolve("config.yaml");
        Files.writeString(file, yaml);
        return ConfigLoader.load(file, env);
    }

    @Test
    void defaultsWhenFileMissing() {
        var cfg = ConfigLoader.load(tempDir.resolve("absent.yaml"), Map.of());
        assertEquals(MemFacadeConfig.defaults(), cfg);
        assertEquals(10_000, cfg.scanLimit());
        assertEquals(100, cfg.defaultListLimit());
        assertEquals(1, cfg.batchWorkers());
        assertEquals(200, cfg.maxErrorMessageLength());
    }

    @Test
    void defaultsWhenFileEmpty() throws IOException {
        assertEquals(MemFacadeConfig.defaults(), writeAndLoad("", Map.of()));
    }

    @Test
    void parsesFullConfig() throws IOException {
        var yaml = """
            store:
              index-path: /var/lib/memfacade
            analytics:
              scan-limit: 500
            list:
              default-limit: 25
            batch:
              workers: 4
            errors:
              max-message-length: 120
            """;
        var cfg = writeAndLoad(yaml, Map.of());
        assertEquals("/var/lib/memfacade", cfg.indexPath());
        assertEquals(500, cfg.scanLimit());
        assertEquals(25, cfg.defaultListLimit());
        assertEquals(4, cfg.batchWorkers());
        assertEquals(120, cfg.maxErrorMessageLength());
    }

    @Test
    void environmentOverridesFile() throws IOException {
        var yaml = """
            store:
              index-path: /from/file
            batch:
              workers: 2
            """;
        var cfg = writeAndLoad(yaml, Map.of("MEMFACADE_INDEX_PATH", "/from/env", "MEMFACADE_BATCH_WORKERS", "8"));
        assertEquals("/from/env", cfg.indexPath());
        assertEquals(8, cfg.batchWorkers());
    }

    @Test
    void emptySectionFallsBackToDefaults() throws IOException {
        var cfg = writeAndLoad("analytics:\n", Map.of());
        assertEquals(MemFacadeConfig.DEFAULT_SCAN_LIMIT, cfg.scanLimit());
    }

    @Test
    void rejectsNonPositiveValues() {
        var ex = assertThrows(IllegalArgumentException.class,
                () -> writeAndLoad("analytics:\n  scan-limit: 0\n", Map.of()));
        assertTrue(ex.getMessage().contains("analytics.scan-limit"));

        assertThrows(IllegalArgumentException.class,
                () -> writeAndLoad("", Map.of("MEMFACADE_BATCH_WORKERS", "many")));
    }
}
